package org.abstractica.chat.impl.codec;

import org.abstractica.chat.InboundEvent;

import java.util.Objects;

/**
 * Result of decoding one inbound frame.
 *
 * <p>Control frames ({@link Ping}, {@link Pong}, authentication results) are
 * consumed by the connection itself; {@link Event} frames are broadcast to
 * subscribers; {@link Ignored} frames are dropped after a diagnostic log.</p>
 */
public sealed interface InboundFrame
{
    /**
     * Literal {@code ping}; answered with {@code pong}.
     */
    record Ping() implements InboundFrame {}

    /**
     * Literal {@code pong}; reply to a keepalive.
     */
    record Pong() implements InboundFrame {}

    /**
     * Server accepted the authentication frame.
     */
    record AuthAccepted() implements InboundFrame {}

    /**
     * Server explicitly rejected the authentication frame.
     *
     * @param message rejection text provided by the server
     */
    record AuthRejected(String message) implements InboundFrame
    {
        public AuthRejected
        {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * A typed event for subscribers.
     *
     * @param event the decoded event
     */
    record Event(InboundEvent event) implements InboundFrame
    {
        public Event
        {
            Objects.requireNonNull(event, "event");
        }
    }

    /**
     * Frame was not understood and is dropped.
     *
     * @param reason why the frame was dropped
     */
    record Ignored(String reason) implements InboundFrame
    {
        public Ignored
        {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
