package org.abstractica.chat;

import java.net.URI;
import java.time.Duration;

/**
 * Factory for creating ChatConnection instances.
 *
 * <p>Use the builder to configure the connection before creation:</p>
 * <pre>{@code
 * ChatConnection connection = factory.builder()
 *     .serverUri(URI.create("ws://chat.example.com/ws"))
 *     .authTimeout(Duration.ofSeconds(5))
 *     .heartbeatInterval(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public interface ChatConnectionFactory
{
    /**
     * Creates a new connection builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a ChatConnection.
     */
    interface Builder
    {
        /**
         * Sets the WebSocket endpoint of the chat server.
         *
         * @param uri the {@code ws://} or {@code wss://} URI
         * @return this builder
         */
        Builder serverUri(URI uri);

        /**
         * Sets how long {@link ChatConnection#connect(String)} waits for the
         * authentication acknowledgment.
         *
         * <p>Optional. Defaults to 5 seconds.</p>
         *
         * @param timeout the timeout
         * @return this builder
         */
        Builder authTimeout(Duration timeout);

        /**
         * Sets the interval between keepalive pings.
         *
         * <p>Optional. Defaults to 30 seconds.</p>
         *
         * @param interval the interval
         * @return this builder
         */
        Builder heartbeatInterval(Duration interval);

        /**
         * Sets the reconnect backoff.
         *
         * <p>Optional. Defaults to a 2 second base delay, a 30 second cap and
         * 5 attempts.</p>
         *
         * @param baseDelay   delay before the first attempt, doubled for each further attempt
         * @param maxDelay    upper bound for the delay
         * @param maxAttempts number of attempts before the connection fails
         * @return this builder
         */
        Builder reconnect(Duration baseDelay, Duration maxDelay, int maxAttempts);

        /**
         * Builds the connection.
         *
         * @return the configured connection, in the disconnected state
         * @throws IllegalStateException if required parameters are missing
         */
        ChatConnection build();
    }
}
