package org.abstractica.chat;

import java.io.IOException;
import java.util.List;

/**
 * Source of previously exchanged messages for a room.
 *
 * <p>Typically backed by a REST endpoint authenticated with the same bearer
 * token as the chat connection.</p>
 */
@FunctionalInterface
public interface MessageHistory
{
    /**
     * Fetches the message history of a room, oldest first.
     *
     * @param roomId the room
     * @return the messages, each in {@link DeliveryState.Delivered} state
     * @throws IOException if the history cannot be retrieved
     */
    List<Message> fetchMessages(String roomId) throws IOException;
}
