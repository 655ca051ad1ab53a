package org.abstractica.chat.impl.client;

import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ChatConnectionFactory;
import org.abstractica.chat.impl.reliability.HeartbeatDriver;
import org.abstractica.chat.impl.reliability.ReconnectPolicy;
import org.abstractica.chat.impl.scheduling.ExecutorTaskScheduler;
import org.abstractica.chat.impl.scheduling.TaskScheduler;
import org.abstractica.chat.impl.transport.TransportFactory;
import org.abstractica.chat.impl.transport.WebSocketTransportFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of ChatConnectionFactory.
 */
public class DefaultChatConnectionFactory implements ChatConnectionFactory
{
    /**
     * Default time allowed for the server to acknowledge authentication.
     */
    public static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofSeconds(5);

    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private URI serverUri;
        private Duration authTimeout = DEFAULT_AUTH_TIMEOUT;
        private Duration heartbeatInterval = HeartbeatDriver.DEFAULT_INTERVAL;
        private ReconnectPolicy reconnectPolicy = new ReconnectPolicy();
        private Duration connectTimeout = WebSocketTransportFactory.DEFAULT_CONNECT_TIMEOUT;
        private Duration sendTimeout = WebSocketTransportFactory.DEFAULT_SEND_TIMEOUT;
        private TransportFactory transportFactory; // Optional, defaults to WebSocket
        private TaskScheduler scheduler; // Optional, owned by the connection when not set

        @Override
        public DefaultBuilder serverUri(URI uri)
        {
            this.serverUri = Objects.requireNonNull(uri, "uri");
            return this;
        }

        @Override
        public DefaultBuilder authTimeout(Duration timeout)
        {
            this.authTimeout = requirePositive(timeout, "timeout");
            return this;
        }

        @Override
        public DefaultBuilder heartbeatInterval(Duration interval)
        {
            this.heartbeatInterval = requirePositive(interval, "interval");
            return this;
        }

        @Override
        public DefaultBuilder reconnect(Duration baseDelay, Duration maxDelay, int maxAttempts)
        {
            this.reconnectPolicy = new ReconnectPolicy(baseDelay, maxDelay, maxAttempts);
            return this;
        }

        /**
         * Sets the time allowed for opening the WebSocket.
         *
         * <p>Ignored when a custom transport factory is set.</p>
         *
         * @param timeout the timeout
         * @return this builder
         */
        public DefaultBuilder connectTimeout(Duration timeout)
        {
            this.connectTimeout = requirePositive(timeout, "timeout");
            return this;
        }

        /**
         * Sets the time allowed for writing a single frame.
         *
         * <p>Ignored when a custom transport factory is set.</p>
         *
         * @param timeout the timeout
         * @return this builder
         */
        public DefaultBuilder sendTimeout(Duration timeout)
        {
            this.sendTimeout = requirePositive(timeout, "timeout");
            return this;
        }

        /**
         * Sets the factory used to create a transport for each connection attempt.
         *
         * <p>If not set, WebSocket transports to the server URI are used.
         * Use {@link org.abstractica.chat.impl.transport.SimulatedServer}
         * for testing or local development.</p>
         *
         * @param factory the transport factory
         * @return this builder
         */
        public DefaultBuilder transportFactory(TransportFactory factory)
        {
            this.transportFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        /**
         * Sets the scheduler for authentication timeouts, reconnect delays and
         * keepalive pings.
         *
         * <p>A scheduler supplied here is not closed by the connection.</p>
         *
         * @param scheduler the scheduler
         * @return this builder
         */
        public DefaultBuilder scheduler(TaskScheduler scheduler)
        {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        @Override
        public ChatConnection build()
        {
            TransportFactory transports = transportFactory;
            if (transports == null)
            {
                if (serverUri == null)
                {
                    throw new IllegalStateException("Server URI must be specified");
                }
                transports = new WebSocketTransportFactory(serverUri, connectTimeout, sendTimeout);
            }

            boolean ownsScheduler = scheduler == null;
            TaskScheduler timers = ownsScheduler ? new ExecutorTaskScheduler("chat-timer") : scheduler;

            return new DefaultChatConnection(
                    transports,
                    timers,
                    ownsScheduler,
                    authTimeout,
                    heartbeatInterval,
                    reconnectPolicy);
        }

        private static Duration requirePositive(Duration duration, String name)
        {
            Objects.requireNonNull(duration, name);
            if (duration.isZero() || duration.isNegative())
            {
                throw new IllegalArgumentException(name + " must be positive: " + duration);
            }
            return duration;
        }
    }
}
