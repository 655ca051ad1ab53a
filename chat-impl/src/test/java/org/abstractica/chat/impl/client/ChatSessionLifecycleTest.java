package org.abstractica.chat.impl.client;

import org.abstractica.chat.AuthenticationFailedException;
import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ConnectionCancelledException;
import org.abstractica.chat.TransportException;
import org.abstractica.chat.impl.credentials.InMemoryCredentialStore;
import org.abstractica.chat.impl.scheduling.ManualTaskScheduler;
import org.abstractica.chat.impl.transport.SimulatedServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ChatSessionLifecycle}.
 */
class ChatSessionLifecycleTest
{
    private FakeChatConnection connection;
    private InMemoryCredentialStore credentials;
    private ChatSessionLifecycle lifecycle;

    @BeforeEach
    void setUp()
    {
        connection = new FakeChatConnection();
        credentials = new InMemoryCredentialStore();
        lifecycle = new ChatSessionLifecycle(connection, credentials);
    }

    @Test
    void resume_withoutStoredToken_doesNotConnect() throws Exception
    {
        assertFalse(lifecycle.resume());

        assertTrue(connection.getConnectTokens().isEmpty());
    }

    @Test
    void resume_withStoredToken_connects() throws Exception
    {
        credentials.put(ChatSessionLifecycle.TOKEN_KEY, "stored");

        assertTrue(lifecycle.resume());

        assertEquals(List.of("stored"), connection.getConnectTokens());
        assertTrue(connection.isConnected());
    }

    @Test
    void resume_rejectedToken_clearsStoredToken()
    {
        credentials.put(ChatSessionLifecycle.TOKEN_KEY, "expired");
        connection.failConnectWith(new AuthenticationFailedException("Authentication rejected: expired"));

        assertThrows(AuthenticationFailedException.class, () -> lifecycle.resume());

        assertEquals(Optional.empty(), credentials.get(ChatSessionLifecycle.TOKEN_KEY));
    }

    @Test
    void resume_transportFailure_keepsStoredToken()
    {
        credentials.put(ChatSessionLifecycle.TOKEN_KEY, "stored");
        connection.failConnectWith(new TransportException("Connection failed", new IOException("refused")));

        assertThrows(TransportException.class, () -> lifecycle.resume());

        assertEquals(Optional.of("stored"), credentials.get(ChatSessionLifecycle.TOKEN_KEY));
    }

    @Test
    void resume_cancelledConnect_keepsStoredToken()
    {
        credentials.put(ChatSessionLifecycle.TOKEN_KEY, "stored");
        connection.failConnectWith(new ConnectionCancelledException("Connection attempt cancelled by disconnect"));

        assertThrows(ConnectionCancelledException.class, () -> lifecycle.resume());

        assertEquals(Optional.of("stored"), credentials.get(ChatSessionLifecycle.TOKEN_KEY));
    }

    @Test
    void resume_disconnectedBeforeAuthAck_keepsStoredToken() throws Exception
    {
        // Arrange
        SimulatedServer server = new SimulatedServer();
        ManualTaskScheduler scheduler = new ManualTaskScheduler();
        ChatConnection real = new DefaultChatConnectionFactory().builder()
                .transportFactory(server)
                .scheduler(scheduler)
                .build();
        ChatSessionLifecycle session = new ChatSessionLifecycle(real, credentials);
        credentials.put(ChatSessionLifecycle.TOKEN_KEY, "valid");
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread resumer = new Thread(() ->
        {
            try
            {
                session.resume();
            }
            catch (Throwable t)
            {
                failure.set(t);
            }
        });

        try
        {
            resumer.start();
            assertTrue(server.awaitTransports(1, Duration.ofSeconds(5)));
            assertTrue(server.latest().awaitSentFrame(frame -> frame.contains("\"auth\""), Duration.ofSeconds(5)));

            // Act
            real.disconnect();
            resumer.join(5000);

            // Assert
            assertFalse(resumer.isAlive());
            assertInstanceOf(ConnectionCancelledException.class, failure.get());
            assertEquals(Optional.of("valid"), credentials.get(ChatSessionLifecycle.TOKEN_KEY));
        }
        finally
        {
            session.close();
            scheduler.close();
        }
    }

    @Test
    void login_storesTokenThenConnects() throws Exception
    {
        lifecycle.login("fresh");

        assertEquals(Optional.of("fresh"), credentials.get(ChatSessionLifecycle.TOKEN_KEY));
        assertEquals(List.of("fresh"), connection.getConnectTokens());
    }

    @Test
    void logout_clearsTokenAndDisconnects() throws Exception
    {
        lifecycle.login("fresh");

        lifecycle.logout();

        assertEquals(Optional.empty(), credentials.get(ChatSessionLifecycle.TOKEN_KEY));
        assertEquals(1, connection.getDisconnectCount());
        assertFalse(connection.isConnected());
    }

    @Test
    void close_closesConnection()
    {
        lifecycle.close();

        assertTrue(connection.isClosed());
    }

    @Test
    void login_againstSimulatedServer_connects() throws Exception
    {
        SimulatedServer server = new SimulatedServer();
        server.onFrame(SimulatedServer.authenticating("secret"));
        ManualTaskScheduler scheduler = new ManualTaskScheduler();
        ChatConnection real = new DefaultChatConnectionFactory().builder()
                .transportFactory(server)
                .scheduler(scheduler)
                .build();

        try (ChatSessionLifecycle session = new ChatSessionLifecycle(real, credentials))
        {
            session.login("secret");

            assertTrue(session.getConnection().isConnected());
        }
        assertTrue(server.latest().isClosed());
        scheduler.close();
    }
}
