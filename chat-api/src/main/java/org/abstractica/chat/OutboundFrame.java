package org.abstractica.chat;

import java.util.Objects;

/**
 * Outbound intents understood by the wire codec.
 */
public sealed interface OutboundFrame
{
    /**
     * Authentication handshake; must be the first frame on a new transport.
     *
     * @param token bearer token
     */
    record Auth(String token) implements OutboundFrame
    {
        public Auth
        {
            Objects.requireNonNull(token, "token");
        }

        @Override
        public String toString()
        {
            return "Auth[token=***]";
        }
    }

    /**
     * A chat message.
     *
     * @param id      client-generated message id
     * @param content message text
     * @param roomId  target room
     */
    record ChatMessage(String id, String content, String roomId) implements OutboundFrame
    {
        public ChatMessage
        {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(roomId, "roomId");
        }
    }

    /**
     * Typing indicator.
     *
     * @param roomId   the room being typed in
     * @param isTyping whether the local user is typing
     */
    record Typing(String roomId, boolean isTyping) implements OutboundFrame
    {
        public Typing
        {
            Objects.requireNonNull(roomId, "roomId");
        }
    }

    /**
     * Keepalive request.
     */
    record Ping() implements OutboundFrame {}

    /**
     * Keepalive reply.
     */
    record Pong() implements OutboundFrame {}
}
