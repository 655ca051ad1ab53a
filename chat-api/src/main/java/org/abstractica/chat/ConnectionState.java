package org.abstractica.chat;

import java.time.Duration;
import java.util.Objects;

/**
 * State of a chat connection.
 *
 * <p>Sealed interface enabling exhaustive handling of connection states.
 * Exactly one state is current at any time; it is owned by the connection
 * and observed through {@link ChatConnection#onStateChanged}.</p>
 */
public sealed interface ConnectionState
{
    /**
     * Returns a short human-readable description of this state.
     *
     * @return the display text
     */
    String displayText();

    /**
     * Returns whether the connection is authenticated and can send frames.
     *
     * @return true only for {@link Connected}
     */
    default boolean isConnected()
    {
        return this instanceof Connected;
    }

    /**
     * No transport is open and no reconnection is scheduled.
     */
    record Disconnected() implements ConnectionState
    {
        @Override
        public String displayText()
        {
            return "Disconnected";
        }
    }

    /**
     * Transport is being opened or the authentication handshake is in progress.
     */
    record Connecting() implements ConnectionState
    {
        @Override
        public String displayText()
        {
            return "Connecting...";
        }
    }

    /**
     * Authenticated session is established.
     */
    record Connected() implements ConnectionState
    {
        @Override
        public String displayText()
        {
            return "Connected";
        }
    }

    /**
     * Connection was lost and a reconnection attempt is scheduled or running.
     *
     * @param attempt the reconnection attempt number (1-based)
     * @param delay   the backoff delay before this attempt
     */
    record Reconnecting(int attempt, Duration delay) implements ConnectionState
    {
        public Reconnecting
        {
            if (attempt < 1)
            {
                throw new IllegalArgumentException("Attempt must be positive: " + attempt);
            }
            Objects.requireNonNull(delay, "delay");
        }

        @Override
        public String displayText()
        {
            return "Reconnecting...";
        }
    }

    /**
     * Connection failed and will not be retried automatically.
     *
     * <p>A new call to {@link ChatConnection#connect(String)} is required to
     * recover.</p>
     *
     * @param reason description of the failure
     */
    record Failed(String reason) implements ConnectionState
    {
        public Failed
        {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String displayText()
        {
            return "Failed: " + reason;
        }
    }
}
