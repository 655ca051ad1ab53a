package org.abstractica.chat.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport over a JDK {@link WebSocket}.
 *
 * <p>Inbound messages are reassembled from partial frames and queued; binary
 * messages are decoded as UTF-8 text. The receive loop takes frames from the
 * queue. Writes are serialized and bounded by the send timeout.</p>
 *
 * <p>Closing while {@link #open()} waits for the handshake makes the open
 * fail at once. A socket that completes after the open gave up is aborted.</p>
 */
public class WebSocketTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketTransport.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(1);

    private final HttpClient httpClient;
    private final URI uri;
    private final Duration connectTimeout;
    private final Duration sendTimeout;

    private final BlockingQueue<Inbound> inboundQueue;
    private final Object sendLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile WebSocket webSocket;
    private volatile CompletableFuture<WebSocket> pendingOpen;

    /**
     * Items queued for the receive loop.
     */
    private sealed interface Inbound
    {
        record Frame(String text) implements Inbound {}
        record Closed(IOException cause) implements Inbound {}
    }

    /**
     * Creates an unopened transport.
     *
     * @param httpClient     client used to open the WebSocket
     * @param uri            server endpoint
     * @param connectTimeout maximum time to establish the connection
     * @param sendTimeout    maximum time for a single frame write
     */
    public WebSocketTransport(HttpClient httpClient, URI uri, Duration connectTimeout, Duration sendTimeout)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
        this.inboundQueue = new LinkedBlockingQueue<>();
    }

    @Override
    public void open() throws IOException
    {
        if (webSocket != null)
        {
            throw new IllegalStateException("Transport can only be opened once");
        }
        if (closed.get())
        {
            throw new IOException("Transport closed before connecting to " + uri);
        }

        LOG.debug("Opening WebSocket to {}", uri);
        CompletableFuture<WebSocket> building = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new FrameListener());

        // Cancelling the copy ends the wait without discarding the socket
        CompletableFuture<WebSocket> waiting = building.copy();
        pendingOpen = waiting;
        if (closed.get())
        {
            waiting.cancel(false);
        }

        WebSocket socket;
        try
        {
            socket = waiting.get(connectTimeout.toMillis() + CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (ExecutionException e)
        {
            throw new IOException("Failed to connect to " + uri, e.getCause());
        }
        catch (CancellationException e)
        {
            abortWhenBuilt(building);
            throw new IOException("Transport closed while connecting to " + uri);
        }
        catch (TimeoutException e)
        {
            abortWhenBuilt(building);
            throw new IOException("Timed out connecting to " + uri, e);
        }
        catch (InterruptedException e)
        {
            abortWhenBuilt(building);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while connecting to " + uri);
        }
        finally
        {
            pendingOpen = null;
        }

        webSocket = socket;
        if (closed.get())
        {
            socket.abort();
            throw new IOException("Transport closed while connecting to " + uri);
        }
    }

    private void abortWhenBuilt(CompletableFuture<WebSocket> building)
    {
        building.whenComplete((socket, error) ->
        {
            if (socket != null)
            {
                LOG.debug("Aborting WebSocket to {} opened after connect gave up", uri);
                socket.abort();
            }
        });
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
            // Keep the marker so later reads fail as well
            inboundQueue.offer(closedItem);
            throw closedItem.cause();
        }
        return ((Inbound.Frame) item).text();
    }

    @Override
    public void send(String text) throws IOException
    {
        Objects.requireNonNull(text, "text");
        WebSocket socket = webSocket;
        if (socket == null || closed.get())
        {
            throw new IOException("Transport is not open");
        }

        synchronized (sendLock)
        {
            try
            {
                socket.sendText(text, true).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            catch (ExecutionException e)
            {
                throw new IOException("Failed to send frame", e.getCause());
            }
            catch (TimeoutException e)
            {
                throw new IOException("Timed out sending frame after " + sendTimeout.toMillis() + "ms", e);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while sending");
            }
        }
    }

    @Override
    public boolean isOpen()
    {
        WebSocket socket = webSocket;
        return socket != null && !closed.get() && !socket.isInputClosed() && !socket.isOutputClosed();
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        CompletableFuture<WebSocket> waiting = pendingOpen;
        if (waiting != null)
        {
            waiting.cancel(false);
        }

        WebSocket socket = webSocket;
        if (socket != null)
        {
            try
            {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "Client disconnect")
                        .get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
            catch (ExecutionException | TimeoutException e)
            {
                LOG.debug("Close handshake did not complete: {}", e.toString());
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
            finally
            {
                socket.abort();
            }
        }

        inboundQueue.offer(new Inbound.Closed(new IOException("Transport closed")));
        LOG.debug("WebSocket to {} closed", uri);
    }

    // ========== Listener ==========

    private class FrameListener implements WebSocket.Listener
    {
        private final StringBuilder textBuffer = new StringBuilder();
        private final ByteArrayOutputStream binaryBuffer = new ByteArrayOutputStream();

        @Override
        public void onOpen(WebSocket socket)
        {
            LOG.debug("WebSocket to {} open", uri);
            socket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket socket, CharSequence data, boolean last)
        {
            textBuffer.append(data);
            if (last)
            {
                inboundQueue.offer(new Inbound.Frame(textBuffer.toString()));
                textBuffer.setLength(0);
            }
            socket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket socket, ByteBuffer data, boolean last)
        {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            binaryBuffer.write(bytes, 0, bytes.length);
            if (last)
            {
                inboundQueue.offer(new Inbound.Frame(binaryBuffer.toString(StandardCharsets.UTF_8)));
                binaryBuffer.reset();
            }
            socket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket socket, int statusCode, String reason)
        {
            LOG.info("WebSocket closed by server: {} {}", statusCode, reason);
            inboundQueue.offer(new Inbound.Closed(new IOException("Closed by server: " + statusCode + " " + reason)));
            return null;
        }

        @Override
        public void onError(WebSocket socket, Throwable error)
        {
            LOG.warn("WebSocket error: {}", error.toString());
            inboundQueue.offer(new Inbound.Closed(new IOException("WebSocket error", error)));
        }
    }
}
