package org.abstractica.chat.impl.client;

import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ConnectionState;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultChatConnectionFactory}.
 */
class DefaultChatConnectionFactoryTest
{
    @Test
    void build_withoutServerOrTransport_throws()
    {
        assertThrows(IllegalStateException.class, () -> new DefaultChatConnectionFactory().builder().build());
    }

    @Test
    void build_withUri_startsDisconnected()
    {
        try (ChatConnection connection = new DefaultChatConnectionFactory().builder()
                .serverUri(URI.create("ws://localhost:8080/ws"))
                .build())
        {
            assertEquals(new ConnectionState.Disconnected(), connection.getState());
            assertFalse(connection.isConnected());
        }
    }

    @Test
    void build_httpUri_throws()
    {
        DefaultChatConnectionFactory.DefaultBuilder builder = new DefaultChatConnectionFactory().builder()
                .serverUri(URI.create("http://localhost:8080/ws"));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void durations_mustBePositive()
    {
        DefaultChatConnectionFactory.DefaultBuilder builder = new DefaultChatConnectionFactory().builder();

        assertThrows(IllegalArgumentException.class, () -> builder.authTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.heartbeatInterval(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> builder.sendTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.connectTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> builder.reconnect(Duration.ofSeconds(10), Duration.ofSeconds(1), 3));
    }
}
