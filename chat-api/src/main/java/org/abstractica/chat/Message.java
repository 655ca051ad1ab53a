package org.abstractica.chat;

import java.time.Instant;
import java.util.Objects;

/**
 * A chat message.
 *
 * <p>The {@code deliveryState} is local only and never part of the wire
 * format. Messages received from the server are {@link DeliveryState.Delivered}.</p>
 *
 * @param id            message identity; client-generated for locally authored messages
 * @param senderId      id of the author
 * @param senderName    display name of the author
 * @param content       message text
 * @param timestamp     creation time
 * @param roomId        id of the chat room the message belongs to
 * @param deliveryState local delivery status
 */
public record Message(
        String id,
        String senderId,
        String senderName,
        String content,
        Instant timestamp,
        String roomId,
        DeliveryState deliveryState
)
{
    public Message
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(senderName, "senderName");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(deliveryState, "deliveryState");
    }

    /**
     * Returns a copy of this message with a different delivery state.
     *
     * @param state the new delivery state
     * @return the updated message
     */
    public Message withDeliveryState(DeliveryState state)
    {
        return new Message(id, senderId, senderName, content, timestamp, roomId, state);
    }
}
