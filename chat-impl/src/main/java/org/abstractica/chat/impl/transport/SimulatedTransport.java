package org.abstractica.chat.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Predicate;

/**
 * In-memory transport connected to a {@link SimulatedServer}.
 *
 * <p>The client side implements {@link Transport}. The server side is driven
 * by tests through {@link #push(String)}, {@link #drop()} and
 * {@link #setFailSends(boolean)}, and observed through
 * {@link #getSentFrames()} and {@link #awaitSentFrame}.</p>
 */
public class SimulatedTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedTransport.class);

    private final SimulatedServer server;
    private final int id;
    private final BlockingQueue<Inbound> inboundQueue;
    private final List<String> sentFrames;
    private final Object sendLock = new Object();

    private volatile boolean opened;
    private volatile boolean closed;
    private volatile boolean failSends;

    private sealed interface Inbound
    {
        record Frame(String text) implements Inbound {}
        record Closed(IOException cause) implements Inbound {}
    }

    SimulatedTransport(SimulatedServer server, int id)
    {
        this.server = Objects.requireNonNull(server, "server");
        this.id = id;
        this.inboundQueue = new LinkedBlockingQueue<>();
        this.sentFrames = new ArrayList<>();
    }

    // ========== Transport ==========

    @Override
    public void open() throws IOException
    {
        if (opened)
        {
            throw new IllegalStateException("Transport can only be opened once");
        }
        while (server.isStallingConnections() && !closed)
        {
            try
            {
                Thread.sleep(5);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while connecting");
            }
        }
        if (closed)
        {
            throw new IOException("Transport closed while connecting");
        }
        if (server.isRefusingConnections())
        {
            closed = true;
            throw new IOException("Connection refused by simulated server");
        }
        opened = true;
        LOG.debug("Simulated transport {} open", id);
        server.connectionOpened(this);
    }

    @Override
    public String receive() throws IOException
    {
        Inbound item;
        try
        {
            item = inboundQueue.take();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while receiving");
        }

        if (item instanceof Inbound.Closed closedItem)
        {
            inboundQueue.offer(closedItem);
            throw closedItem.cause();
        }
        return ((Inbound.Frame) item).text();
    }

    @Override
    public void send(String text) throws IOException
    {
        Objects.requireNonNull(text, "text");
        synchronized (sendLock)
        {
            if (!isOpen())
            {
                throw new IOException("Transport is not open");
            }
            if (failSends)
            {
                throw new IOException("Simulated write failure");
            }
            synchronized (sentFrames)
            {
                sentFrames.add(text);
                sentFrames.notifyAll();
            }
        }
        server.frameReceived(this, text);
    }

    @Override
    public boolean isOpen()
    {
        return opened && !closed;
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;
        inboundQueue.offer(new Inbound.Closed(new IOException("Transport closed")));
        LOG.debug("Simulated transport {} closed", id);
    }

    // ========== Server Side ==========

    /**
     * Delivers a frame from the server to the client.
     *
     * @param frame the frame text
     */
    public void push(String frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (closed)
        {
            LOG.debug("Dropping push to closed transport {}", id);
            return;
        }
        inboundQueue.offer(new Inbound.Frame(frame));
    }

    /**
     * Simulates a network failure: the client's pending read fails and
     * further sends fail.
     */
    public void drop()
    {
        if (closed)
        {
            return;
        }
        closed = true;
        inboundQueue.offer(new Inbound.Closed(new IOException("Connection reset by simulated server")));
        LOG.debug("Simulated transport {} dropped", id);
    }

    /**
     * Makes subsequent sends fail while the read side stays up.
     *
     * @param fail true to fail sends
     */
    public void setFailSends(boolean fail)
    {
        this.failSends = fail;
    }

    /**
     * Returns the frames the client has sent on this transport.
     *
     * @return a snapshot of sent frames in order
     */
    public List<String> getSentFrames()
    {
        synchronized (sentFrames)
        {
            return List.copyOf(sentFrames);
        }
    }

    /**
     * Waits until the client has sent a frame matching the predicate.
     *
     * @param match   the frame predicate
     * @param timeout maximum time to wait
     * @return true if a matching frame was sent in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitSentFrame(Predicate<String> match, Duration timeout) throws InterruptedException
    {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (sentFrames)
        {
            while (true)
            {
                for (String frame : sentFrames)
                {
                    if (match.test(frame))
                    {
                        return true;
                    }
                }
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0)
                {
                    return false;
                }
                sentFrames.wait(remainingMs);
            }
        }
    }

    /**
     * Returns whether the client closed this transport or it was dropped.
     *
     * @return true once closed
     */
    public boolean isClosed()
    {
        return closed;
    }

    public int getId()
    {
        return id;
    }
}
