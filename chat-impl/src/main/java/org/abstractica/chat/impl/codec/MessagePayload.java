package org.abstractica.chat.impl.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.abstractica.chat.DeliveryState;
import org.abstractica.chat.Message;

import java.time.Instant;
import java.util.Objects;

/**
 * Wire shape of an inbound {@code message} frame.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record MessagePayload(
        String id,
        String content,
        String senderId,
        String senderName,
        String chatRoomId,
        Instant timestamp
)
{
    MessagePayload
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(senderName, "senderName");
        Objects.requireNonNull(chatRoomId, "chatRoomId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    Message toMessage()
    {
        return new Message(id, senderId, senderName, content, timestamp, chatRoomId, new DeliveryState.Delivered());
    }
}
