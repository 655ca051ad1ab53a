package org.abstractica.chat.impl.transport;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WebSocketTransportFactory} and unopened {@link WebSocketTransport}s.
 */
class WebSocketTransportFactoryTest
{
    @Test
    void constructor_nonWebSocketScheme_throws()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new WebSocketTransportFactory(URI.create("http://localhost:8080/ws")));
    }

    @Test
    void create_returnsUnopenedTransport()
    {
        WebSocketTransportFactory factory = new WebSocketTransportFactory(URI.create("ws://localhost:8080/ws"));

        Transport transport = factory.create();

        assertFalse(transport.isOpen());
        assertThrows(IOException.class, () -> transport.send("hello"));
        assertEquals(URI.create("ws://localhost:8080/ws"), factory.getUri());
    }

    @Test
    void close_unopened_failsReceive()
    {
        Transport transport = new WebSocketTransportFactory(URI.create("wss://chat.example.com/ws")).create();

        transport.close();
        transport.close();

        assertThrows(IOException.class, transport::receive);
    }
}
