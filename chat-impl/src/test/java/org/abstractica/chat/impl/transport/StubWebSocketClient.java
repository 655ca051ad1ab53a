package org.abstractica.chat.impl.transport;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import java.io.IOException;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;

/**
 * HttpClient whose WebSocket handshake completes only when a test says so.
 */
public class StubWebSocketClient extends HttpClient
{
    private final CompletableFuture<WebSocket> handshake = new CompletableFuture<>();
    private final CountDownLatch started = new CountDownLatch(1);

    /**
     * Completes the pending handshake with a new socket.
     *
     * @return the socket handed to the transport
     */
    public StubWebSocket completeHandshake()
    {
        StubWebSocket socket = new StubWebSocket();
        handshake.complete(socket);
        return socket;
    }

    public CountDownLatch getStarted()
    {
        return started;
    }

    @Override
    public WebSocket.Builder newWebSocketBuilder()
    {
        return new WebSocket.Builder()
        {
            @Override
            public WebSocket.Builder header(String name, String value)
            {
                return this;
            }

            @Override
            public WebSocket.Builder connectTimeout(Duration timeout)
            {
                return this;
            }

            @Override
            public WebSocket.Builder subprotocols(String mostPreferred, String... lesserPreferred)
            {
                return this;
            }

            @Override
            public CompletableFuture<WebSocket> buildAsync(URI uri, WebSocket.Listener listener)
            {
                started.countDown();
                return handshake;
            }
        };
    }

    // ========== Unused ==========

    @Override
    public Optional<CookieHandler> cookieHandler()
    {
        return Optional.empty();
    }

    @Override
    public Optional<Duration> connectTimeout()
    {
        return Optional.empty();
    }

    @Override
    public Redirect followRedirects()
    {
        return Redirect.NEVER;
    }

    @Override
    public Optional<ProxySelector> proxy()
    {
        return Optional.empty();
    }

    @Override
    public SSLContext sslContext()
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public SSLParameters sslParameters()
    {
        throw new UnsupportedOperationException();
    }

    @Override
    public Optional<Authenticator> authenticator()
    {
        return Optional.empty();
    }

    @Override
    public Version version()
    {
        return Version.HTTP_1_1;
    }

    @Override
    public Optional<Executor> executor()
    {
        return Optional.empty();
    }

    @Override
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> responseBodyHandler)
            throws IOException
    {
        throw new IOException("Not supported");
    }

    @Override
    public <T> CompletableFuture<HttpResponse<T>> sendAsync(
            HttpRequest request,
            HttpResponse.BodyHandler<T> responseBodyHandler)
    {
        return CompletableFuture.failedFuture(new IOException("Not supported"));
    }

    @Override
    public <T> CompletableFuture<HttpResponse<T>> sendAsync(
            HttpRequest request,
            HttpResponse.BodyHandler<T> responseBodyHandler,
            HttpResponse.PushPromiseHandler<T> pushPromiseHandler)
    {
        return CompletableFuture.failedFuture(new IOException("Not supported"));
    }

    /**
     * Socket that only records whether it was aborted.
     */
    public static class StubWebSocket implements WebSocket
    {
        private volatile boolean aborted;

        public boolean isAborted()
        {
            return aborted;
        }

        @Override
        public CompletableFuture<WebSocket> sendText(CharSequence data, boolean last)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendBinary(ByteBuffer data, boolean last)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPing(ByteBuffer message)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPong(ByteBuffer message)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendClose(int statusCode, String reason)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public void request(long n)
        {
        }

        @Override
        public String getSubprotocol()
        {
            return "";
        }

        @Override
        public boolean isOutputClosed()
        {
            return aborted;
        }

        @Override
        public boolean isInputClosed()
        {
            return aborted;
        }

        @Override
        public void abort()
        {
            aborted = true;
        }
    }
}
