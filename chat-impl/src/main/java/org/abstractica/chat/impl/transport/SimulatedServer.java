package org.abstractica.chat.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory chat peer that hands out {@link SimulatedTransport}s.
 *
 * <p>Used for testing and local development without a server:</p>
 * <pre>{@code
 * SimulatedServer server = new SimulatedServer();
 * server.onFrame(SimulatedServer.authenticating("secret"));
 *
 * ChatConnection connection = new DefaultChatConnectionFactory().builder()
 *     .transportFactory(server)
 *     .build();
 * connection.connect("secret");
 *
 * server.latest().push("{\"type\":\"userRegistered\"}");
 * server.latest().drop();
 * }</pre>
 */
public class SimulatedServer implements TransportFactory
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedServer.class);

    private static final String AUTH_ACCEPTED = "{\"type\":\"success\",\"authenticated\":true,\"message\":\"Authenticated\"}";
    private static final String AUTH_REJECTED = "{\"type\":\"success\",\"authenticated\":false,\"message\":\"Invalid token\"}";

    private final List<SimulatedTransport> transports = new CopyOnWriteArrayList<>();
    private final AtomicInteger idCounter = new AtomicInteger();
    private volatile FrameHandler frameHandler = (transport, frame) -> {};
    private volatile boolean refuseConnections;
    private volatile boolean stallConnections;

    /**
     * Handles frames the client sends to the server.
     */
    @FunctionalInterface
    public interface FrameHandler
    {
        /**
         * Called on the sending thread for each client frame.
         *
         * @param transport the transport the frame arrived on
         * @param frame     the frame text
         */
        void onFrame(SimulatedTransport transport, String frame);
    }

    /**
     * Returns a handler that acknowledges an auth frame carrying the expected
     * token, rejects other auth frames and answers keepalive pings.
     *
     * @param expectedToken the token to accept
     * @return the handler
     */
    public static FrameHandler authenticating(String expectedToken)
    {
        Objects.requireNonNull(expectedToken, "expectedToken");
        String expectedFrame = "{\"type\":\"auth\",\"token\":\"" + expectedToken + "\"}";
        return (transport, frame) ->
        {
            if (frame.equals("ping"))
            {
                transport.push("pong");
            }
            else if (frame.startsWith("{\"type\":\"auth\""))
            {
                transport.push(frame.equals(expectedFrame) ? AUTH_ACCEPTED : AUTH_REJECTED);
            }
        };
    }

    @Override
    public Transport create()
    {
        SimulatedTransport transport = new SimulatedTransport(this, idCounter.incrementAndGet());
        transports.add(transport);
        return transport;
    }

    /**
     * Sets the handler for client frames.
     *
     * @param handler the handler
     */
    public void onFrame(FrameHandler handler)
    {
        this.frameHandler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Makes subsequent {@link Transport#open()} calls fail.
     *
     * @param refuse true to refuse connections
     */
    public void setRefuseConnections(boolean refuse)
    {
        this.refuseConnections = refuse;
    }

    /**
     * Makes subsequent {@link Transport#open()} calls block until stalling is
     * turned off or the client closes the transport, like a connect to an
     * unreachable host.
     *
     * @param stall true to stall connections
     */
    public void setStallConnections(boolean stall)
    {
        this.stallConnections = stall;
    }

    /**
     * Returns all transports created so far, in creation order.
     *
     * @return the transports
     */
    public List<SimulatedTransport> getTransports()
    {
        return List.copyOf(transports);
    }

    /**
     * Returns the most recently created transport.
     *
     * @return the transport
     * @throws IllegalStateException if no transport was created
     */
    public SimulatedTransport latest()
    {
        if (transports.isEmpty())
        {
            throw new IllegalStateException("No transport created yet");
        }
        return transports.get(transports.size() - 1);
    }

    /**
     * Waits until at least {@code count} transports have been created.
     *
     * @param count   the number of transports
     * @param timeout maximum time to wait
     * @return true if reached in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTransports(int count, Duration timeout) throws InterruptedException
    {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (transports.size() < count)
        {
            if (System.nanoTime() > deadline)
            {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    /**
     * Returns how many created transports are still open.
     *
     * @return the open transport count
     */
    public long getOpenCount()
    {
        return transports.stream().filter(SimulatedTransport::isOpen).count();
    }

    boolean isRefusingConnections()
    {
        return refuseConnections;
    }

    boolean isStallingConnections()
    {
        return stallConnections;
    }

    void connectionOpened(SimulatedTransport transport)
    {
        LOG.debug("Client connected on transport {}", transport.getId());
    }

    void frameReceived(SimulatedTransport transport, String frame)
    {
        try
        {
            frameHandler.onFrame(transport, frame);
        }
        catch (Exception e)
        {
            LOG.error("Frame handler error", e);
        }
    }
}
