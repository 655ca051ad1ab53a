package org.abstractica.chat.impl.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates {@link WebSocketTransport}s to a fixed server URI.
 *
 * <p>All transports share one {@link HttpClient}.</p>
 */
public class WebSocketTransportFactory implements TransportFactory
{
    /**
     * Default time allowed for opening the WebSocket.
     */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Default time allowed for writing a single frame.
     */
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final URI uri;
    private final Duration connectTimeout;
    private final Duration sendTimeout;

    public WebSocketTransportFactory(URI uri)
    {
        this(uri, DEFAULT_CONNECT_TIMEOUT, DEFAULT_SEND_TIMEOUT);
    }

    public WebSocketTransportFactory(URI uri, Duration connectTimeout, Duration sendTimeout)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");

        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme))
        {
            throw new IllegalArgumentException("WebSocket URI must use ws or wss: " + uri);
        }

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public Transport create()
    {
        return new WebSocketTransport(httpClient, uri, connectTimeout, sendTimeout);
    }

    public URI getUri()
    {
        return uri;
    }
}
