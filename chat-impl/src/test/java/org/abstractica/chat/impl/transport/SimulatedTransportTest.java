package org.abstractica.chat.impl.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SimulatedTransport} and {@link SimulatedServer}.
 */
class SimulatedTransportTest
{
    private SimulatedServer server;

    @BeforeEach
    void setUp()
    {
        server = new SimulatedServer();
    }

    @Test
    void push_isReceivedInOrder() throws IOException
    {
        Transport transport = server.create();
        transport.open();

        server.latest().push("first");
        server.latest().push("second");

        assertEquals("first", transport.receive());
        assertEquals("second", transport.receive());
    }

    @Test
    void send_recordsFrameAndCallsHandler() throws Exception
    {
        server.onFrame((transport, frame) -> transport.push("echo:" + frame));
        Transport transport = server.create();
        transport.open();

        transport.send("hello");

        assertEquals(List.of("hello"), server.latest().getSentFrames());
        assertTrue(server.latest().awaitSentFrame("hello"::equals, Duration.ofSeconds(1)));
        assertEquals("echo:hello", transport.receive());
    }

    @Test
    void close_failsPendingAndLaterReceives() throws IOException
    {
        Transport transport = server.create();
        transport.open();

        transport.close();

        assertThrows(IOException.class, transport::receive);
        assertThrows(IOException.class, transport::receive);
        assertThrows(IOException.class, () -> transport.send("late"));
        assertFalse(transport.isOpen());
    }

    @Test
    void drop_failsReceive() throws IOException
    {
        Transport transport = server.create();
        transport.open();

        server.latest().drop();

        IOException e = assertThrows(IOException.class, transport::receive);
        assertTrue(e.getMessage().contains("reset"));
        assertEquals(0, server.getOpenCount());
    }

    @Test
    void refusedConnection_failsOpen()
    {
        server.setRefuseConnections(true);
        Transport transport = server.create();

        assertThrows(IOException.class, transport::open);
        assertFalse(transport.isOpen());
    }

    @Test
    void failSends_failsWritesOnly() throws IOException
    {
        Transport transport = server.create();
        transport.open();
        server.latest().setFailSends(true);

        assertThrows(IOException.class, () -> transport.send("x"));
        server.latest().push("still readable");
        assertEquals("still readable", transport.receive());
    }

    @Test
    void authenticatingHandler_acceptsOnlyExpectedToken() throws IOException
    {
        server.onFrame(SimulatedServer.authenticating("t0ken"));
        Transport transport = server.create();
        transport.open();

        transport.send("{\"type\":\"auth\",\"token\":\"nope\"}");
        transport.send("{\"type\":\"auth\",\"token\":\"t0ken\"}");
        transport.send("ping");

        assertTrue(transport.receive().contains("\"authenticated\":false"));
        assertTrue(transport.receive().contains("\"authenticated\":true"));
        assertEquals("pong", transport.receive());
    }
}
