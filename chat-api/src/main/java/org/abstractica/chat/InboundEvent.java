package org.abstractica.chat;

import java.util.Objects;

/**
 * Typed event produced from inbound frames.
 *
 * <p>Events are broadcast to every subscriber registered at the time of
 * emission. Subscribers attaching later do not see earlier events.</p>
 */
public sealed interface InboundEvent
{
    /**
     * A chat message arrived, possibly an echo of a locally sent message.
     *
     * @param message the decoded message
     */
    record MessageReceived(Message message) implements InboundEvent
    {
        public MessageReceived
        {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * Server acknowledged a message sent by this client.
     *
     * @param messageId id of the acknowledged message
     */
    record MessageAck(String messageId) implements InboundEvent
    {
        public MessageAck
        {
            Objects.requireNonNull(messageId, "messageId");
        }
    }

    /**
     * A user started or stopped typing in a room.
     *
     * @param userId   the typing user
     * @param roomId   the room
     * @param isTyping whether the user is typing
     */
    record UserTyping(String userId, String roomId, boolean isTyping) implements InboundEvent
    {
        public UserTyping
        {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(roomId, "roomId");
        }
    }

    /**
     * A user's online status changed.
     *
     * @param userId   the user
     * @param isOnline whether the user is online
     */
    record PresenceChanged(String userId, boolean isOnline) implements InboundEvent
    {
        public PresenceChanged
        {
            Objects.requireNonNull(userId, "userId");
        }
    }

    /**
     * A new user registered; directory views should refresh.
     */
    record UserRegistered() implements InboundEvent {}

    /**
     * Server reported an error.
     *
     * @param text the error text
     */
    record ServerError(String text) implements InboundEvent
    {
        public ServerError
        {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * The session was authenticated.
     */
    record Connected() implements InboundEvent {}

    /**
     * The session was closed by {@link ChatConnection#disconnect()}.
     */
    record Disconnected() implements InboundEvent {}
}
