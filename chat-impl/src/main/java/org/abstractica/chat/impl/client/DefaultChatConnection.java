package org.abstractica.chat.impl.client;

import org.abstractica.chat.AuthenticationFailedException;
import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ChatConnectionException;
import org.abstractica.chat.ConnectionCancelledException;
import org.abstractica.chat.ConnectionState;
import org.abstractica.chat.FrameEncodingException;
import org.abstractica.chat.InboundEvent;
import org.abstractica.chat.NotConnectedException;
import org.abstractica.chat.OutboundFrame;
import org.abstractica.chat.Subscription;
import org.abstractica.chat.TransportException;
import org.abstractica.chat.handlers.EventListener;
import org.abstractica.chat.handlers.StateListener;
import org.abstractica.chat.impl.codec.FrameCodec;
import org.abstractica.chat.impl.codec.InboundFrame;
import org.abstractica.chat.impl.reliability.HeartbeatDriver;
import org.abstractica.chat.impl.reliability.ReconnectPolicy;
import org.abstractica.chat.impl.scheduling.ScheduledTask;
import org.abstractica.chat.impl.scheduling.TaskScheduler;
import org.abstractica.chat.impl.transport.Transport;
import org.abstractica.chat.impl.transport.TransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of the ChatConnection interface.
 *
 * <p>All connection state is owned by a single session thread that processes
 * commands from a queue: caller requests, decoded frames from the receive
 * loop, transport failures and timer expirations. Transports are opened on
 * their receiver thread, so a slow connect never blocks the queue. Commands
 * originating from a
 * transport carry its generation number so that late commands from a
 * replaced transport are ignored.</p>
 */
public class DefaultChatConnection implements ChatConnection
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultChatConnection.class);
    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();
    private static final long RECEIVER_JOIN_TIMEOUT_MS = 2000;

    static final String MAX_ATTEMPTS_REASON = "Max reconnect attempts reached";
    static final String NO_CREDENTIAL_REASON = "No credential available for reconnect";

    private final TransportFactory transportFactory;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;
    private final Duration authTimeout;
    private final Duration heartbeatInterval;
    private final ReconnectPolicy reconnectPolicy;
    private final String name;

    private final List<EventListener> eventListeners;
    private final List<StateListener> stateListeners;

    // Threading
    private final BlockingQueue<Command> commands;
    private volatile Thread sessionThread;
    private volatile boolean running;
    private volatile boolean closed;

    // Published state, written only by the session thread
    private volatile ConnectionState state;
    private volatile boolean authenticated;
    private volatile Transport transport;

    // Session thread only
    private String credential;
    private int reconnectAttempts;
    private long generation;
    private boolean awaitingAuth;
    private Thread receiverThread;
    private HeartbeatDriver heartbeat;
    private ScheduledTask authTimeoutTask;
    private ScheduledTask reconnectTask;
    private CompletableFuture<Void> pendingConnect;

    /**
     * Commands processed by the session thread.
     */
    private sealed interface Command
    {
        record Connect(String token, CompletableFuture<Void> result) implements Command {}
        record Disconnect(CompletableFuture<Void> done) implements Command {}
        record Shutdown(CompletableFuture<Void> done) implements Command {}
        record TransportOpened(long generation) implements Command {}
        record FrameDecoded(long generation, InboundFrame frame) implements Command {}
        record TransportFailed(long generation, IOException cause) implements Command {}
        record AuthTimeout(long generation) implements Command {}
        record ReconnectDue(long generation) implements Command {}
    }

    /**
     * Creates a disconnected connection.
     */
    DefaultChatConnection(
            TransportFactory transportFactory,
            TaskScheduler scheduler,
            boolean ownsScheduler,
            Duration authTimeout,
            Duration heartbeatInterval,
            ReconnectPolicy reconnectPolicy
    )
    {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        this.authTimeout = Objects.requireNonNull(authTimeout, "authTimeout");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.name = "chat-session-" + INSTANCE_COUNTER.incrementAndGet();

        this.eventListeners = new CopyOnWriteArrayList<>();
        this.stateListeners = new CopyOnWriteArrayList<>();
        this.commands = new LinkedBlockingQueue<>();
        this.state = new ConnectionState.Disconnected();
    }

    // ========== ChatConnection Interface ==========

    @Override
    public void connect(String token) throws ChatConnectionException, InterruptedException
    {
        Objects.requireNonNull(token, "token");
        if (Thread.currentThread() == sessionThread)
        {
            throw new IllegalStateException("connect must not be called from a listener callback");
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        enqueue(new Command.Connect(token, result));

        try
        {
            result.get();
        }
        catch (ExecutionException e)
        {
            Throwable cause = e.getCause();
            if (cause instanceof ChatConnectionException chatException)
            {
                throw chatException;
            }
            throw new IllegalStateException("Unexpected connect failure", cause);
        }
    }

    @Override
    public void disconnect()
    {
        if (closed || sessionThread == null)
        {
            return;
        }

        CompletableFuture<Void> done = new CompletableFuture<>();
        enqueue(new Command.Disconnect(done));

        // A listener calling back into the connection is handled after the current command
        if (Thread.currentThread() != sessionThread)
        {
            done.join();
        }
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }

        if (sessionThread != null)
        {
            CompletableFuture<Void> done = new CompletableFuture<>();
            enqueue(new Command.Shutdown(done));
            if (Thread.currentThread() != sessionThread)
            {
                done.join();
            }
        }
        closed = true;

        if (ownsScheduler)
        {
            scheduler.close();
        }
        LOG.debug("{} closed", name);
    }

    @Override
    public void send(OutboundFrame frame) throws ChatConnectionException
    {
        Objects.requireNonNull(frame, "frame");
        Transport current = requireAuthenticatedTransport();
        write(current, FrameCodec.encode(frame));
    }

    @Override
    public void sendText(String text) throws ChatConnectionException
    {
        Objects.requireNonNull(text, "text");
        Transport current = requireAuthenticatedTransport();
        write(current, text);
    }

    @Override
    public Subscription subscribe(EventListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        eventListeners.add(listener);
        return () -> eventListeners.remove(listener);
    }

    @Override
    public Subscription onStateChanged(StateListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        synchronized (stateListeners)
        {
            stateListeners.add(listener);
            ConnectionState current = state;
            safeCallback(() -> listener.onStateChanged(current));
        }
        return () -> stateListeners.remove(listener);
    }

    @Override
    public ConnectionState getState()
    {
        return state;
    }

    @Override
    public boolean isConnected()
    {
        return authenticated;
    }

    // ========== Session Thread ==========

    private void enqueue(Command command)
    {
        if (closed)
        {
            throw new IllegalStateException("Connection is closed");
        }
        ensureStarted();
        commands.add(command);
    }

    private synchronized void ensureStarted()
    {
        if (sessionThread != null)
        {
            return;
        }
        running = true;
        Thread thread = new Thread(this::processingLoop, name);
        thread.setDaemon(true);
        sessionThread = thread;
        thread.start();
    }

    private void processingLoop()
    {
        LOG.debug("{} loop started", name);

        while (running)
        {
            try
            {
                process(commands.take());
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }
            catch (Exception e)
            {
                LOG.error("Error in session loop", e);
            }
        }

        LOG.debug("{} loop stopped", name);
    }

    private void process(Command command)
    {
        if (command instanceof Command.Connect connect)
        {
            handleConnect(connect.token(), connect.result());
        }
        else if (command instanceof Command.Disconnect disconnect)
        {
            handleDisconnect();
            disconnect.done().complete(null);
        }
        else if (command instanceof Command.Shutdown shutdown)
        {
            handleDisconnect();
            running = false;
            shutdown.done().complete(null);
        }
        else if (command instanceof Command.TransportOpened opened)
        {
            if (opened.generation() == generation)
            {
                handleTransportOpened();
            }
        }
        else if (command instanceof Command.FrameDecoded decoded)
        {
            if (decoded.generation() == generation)
            {
                handleFrame(decoded.frame());
            }
        }
        else if (command instanceof Command.TransportFailed failed)
        {
            if (failed.generation() == generation)
            {
                handleTransportFailure(failed.cause());
            }
            else
            {
                LOG.trace("Ignoring failure of stale transport: {}", failed.cause().getMessage());
            }
        }
        else if (command instanceof Command.AuthTimeout timeout)
        {
            if (timeout.generation() == generation && awaitingAuth)
            {
                handleAuthFailure(new AuthenticationFailedException(
                        "Authentication not acknowledged within " + authTimeout.toMillis() + "ms"));
            }
        }
        else if (command instanceof Command.ReconnectDue due)
        {
            if (due.generation() == generation)
            {
                attemptReconnect();
            }
        }
    }

    // ========== Connect / Disconnect ==========

    private void handleConnect(String token, CompletableFuture<Void> result)
    {
        ConnectionState current = state;
        if (!(current instanceof ConnectionState.Disconnected) && !(current instanceof ConnectionState.Failed))
        {
            LOG.warn("Already {}, ignoring connect", current.displayText());
            result.complete(null);
            return;
        }

        LOG.info("Connecting");
        credential = token;
        reconnectAttempts = 0;
        pendingConnect = result;
        setState(new ConnectionState.Connecting());
        openTransport();
    }

    private void handleDisconnect()
    {
        cancelReconnect();
        teardownTransport();
        credential = null;
        reconnectAttempts = 0;
        completePendingConnect(new ConnectionCancelledException("Connection attempt cancelled by disconnect"));

        if (!(state instanceof ConnectionState.Disconnected))
        {
            LOG.info("Disconnected");
            setState(new ConnectionState.Disconnected());
            publish(new InboundEvent.Disconnected());
        }
    }

    private void openTransport()
    {
        Transport created = transportFactory.create();
        generation++;

        // Published before opening so a disconnect can abandon the open
        transport = created;
        startReceiver(created, generation);
    }

    private void handleTransportOpened()
    {
        Transport current = transport;
        long openedGeneration = generation;
        awaitingAuth = true;

        try
        {
            current.send(FrameCodec.encode(new OutboundFrame.Auth(credential)));
        }
        catch (IOException e)
        {
            LOG.warn("Failed to send authentication: {}", e.getMessage());
            handleTransportFailure(e);
            return;
        }
        catch (FrameEncodingException e)
        {
            handleAuthFailure(new AuthenticationFailedException("Cannot encode authentication: " + e.getMessage()));
            return;
        }

        authTimeoutTask = scheduler.schedule(() -> enqueueQuietly(new Command.AuthTimeout(openedGeneration)), authTimeout);
        LOG.debug("Authentication sent");
    }

    // ========== Frame Handling ==========

    private void handleFrame(InboundFrame frame)
    {
        if (frame instanceof InboundFrame.Ping)
        {
            Transport current = transport;
            if (current != null)
            {
                try
                {
                    current.send(FrameCodec.PONG);
                }
                catch (IOException e)
                {
                    LOG.debug("Failed to answer ping: {}", e.getMessage());
                }
            }
        }
        else if (frame instanceof InboundFrame.Pong)
        {
            LOG.trace("Pong received");
        }
        else if (frame instanceof InboundFrame.AuthAccepted)
        {
            if (awaitingAuth)
            {
                handleAuthenticated();
            }
            else
            {
                LOG.debug("Ignoring authentication acknowledgment outside handshake");
            }
        }
        else if (frame instanceof InboundFrame.AuthRejected rejected)
        {
            if (awaitingAuth)
            {
                handleAuthFailure(new AuthenticationFailedException("Authentication rejected: " + rejected.message()));
            }
            else
            {
                LOG.warn("Ignoring authentication rejection outside handshake: {}", rejected.message());
            }
        }
        else if (frame instanceof InboundFrame.Event event)
        {
            publish(event.event());
        }
    }

    private void handleAuthenticated()
    {
        cancelAuthTimeout();
        awaitingAuth = false;
        authenticated = true;

        boolean reconnected = state instanceof ConnectionState.Reconnecting;
        reconnectAttempts = 0;
        setState(new ConnectionState.Connected());
        publish(new InboundEvent.Connected());

        long sessionGeneration = generation;
        heartbeat = new HeartbeatDriver(
                scheduler,
                heartbeatInterval,
                this::sendKeepalive,
                e -> enqueueQuietly(new Command.TransportFailed(sessionGeneration, e)));
        heartbeat.start();

        completePendingConnect(null);
        LOG.info(reconnected ? "Reconnected and authenticated" : "Connected and authenticated");
    }

    private void handleAuthFailure(AuthenticationFailedException failure)
    {
        LOG.warn("Authentication failed: {}", failure.getMessage());
        cancelReconnect();
        teardownTransport();
        setState(new ConnectionState.Failed(failure.getMessage()));
        completePendingConnect(failure);
    }

    // ========== Failure / Reconnect ==========

    private void handleTransportFailure(IOException cause)
    {
        LOG.warn("Transport failure: {}", cause.getMessage());
        teardownTransport();

        if (pendingConnect != null)
        {
            setState(new ConnectionState.Failed("Connection failed: " + cause.getMessage()));
            completePendingConnect(new TransportException("Connection failed: " + cause.getMessage(), cause));
            return;
        }

        scheduleReconnect();
    }

    private void scheduleReconnect()
    {
        if (credential == null)
        {
            LOG.error("Cannot reconnect without a credential");
            setState(new ConnectionState.Failed(NO_CREDENTIAL_REASON));
            return;
        }

        reconnectAttempts++;
        Optional<Duration> delay = reconnectPolicy.delayFor(reconnectAttempts);
        if (delay.isEmpty())
        {
            LOG.error("Giving up after {} reconnect attempts", reconnectPolicy.getMaxAttempts());
            setState(new ConnectionState.Failed(MAX_ATTEMPTS_REASON));
            return;
        }

        LOG.info("Reconnecting in {}ms (attempt {}/{})",
                delay.get().toMillis(), reconnectAttempts, reconnectPolicy.getMaxAttempts());

        // Armed before publishing so observers of Reconnecting see a pending timer
        long scheduledGeneration = generation;
        reconnectTask = scheduler.schedule(
                () -> enqueueQuietly(new Command.ReconnectDue(scheduledGeneration)), delay.get());
        setState(new ConnectionState.Reconnecting(reconnectAttempts, delay.get()));
    }

    private void attemptReconnect()
    {
        reconnectTask = null;
        if (!(state instanceof ConnectionState.Reconnecting))
        {
            return;
        }
        LOG.debug("Reconnect attempt {}", reconnectAttempts);
        openTransport();
    }

    // ========== Helpers ==========

    private Transport requireAuthenticatedTransport() throws NotConnectedException
    {
        Transport current = transport;
        if (!authenticated || current == null)
        {
            throw new NotConnectedException();
        }
        return current;
    }

    private static void write(Transport target, String text) throws TransportException
    {
        try
        {
            target.send(text);
        }
        catch (IOException e)
        {
            throw new TransportException("Failed to send frame: " + e.getMessage(), e);
        }
    }

    private void sendKeepalive() throws IOException
    {
        Transport current = transport;
        if (current == null || !authenticated)
        {
            throw new IOException("Session is no longer authenticated");
        }
        current.send(FrameCodec.PING);
    }

    private void startReceiver(Transport source, long sourceGeneration)
    {
        Thread thread = new Thread(() -> receiveLoop(source, sourceGeneration), name + "-receiver-" + sourceGeneration);
        thread.setDaemon(true);
        receiverThread = thread;
        thread.start();
    }

    private void receiveLoop(Transport source, long sourceGeneration)
    {
        try
        {
            source.open();
        }
        catch (IOException e)
        {
            LOG.warn("Failed to open transport: {}", e.getMessage());
            source.close();
            enqueueQuietly(new Command.TransportFailed(sourceGeneration, e));
            return;
        }
        catch (RuntimeException e)
        {
            LOG.error("Failed to open transport", e);
            source.close();
            enqueueQuietly(new Command.TransportFailed(sourceGeneration, new IOException("Transport open failed", e)));
            return;
        }

        enqueueQuietly(new Command.TransportOpened(sourceGeneration));
        LOG.debug("Receive loop {} started", sourceGeneration);

        while (true)
        {
            try
            {
                String text = source.receive();
                enqueueQuietly(new Command.FrameDecoded(sourceGeneration, FrameCodec.decode(text)));
            }
            catch (IOException e)
            {
                enqueueQuietly(new Command.TransportFailed(sourceGeneration, e));
                break;
            }
            catch (RuntimeException e)
            {
                LOG.error("Receive loop failed", e);
                enqueueQuietly(new Command.TransportFailed(sourceGeneration, new IOException("Receive loop failed", e)));
                break;
            }
        }

        LOG.debug("Receive loop {} stopped", sourceGeneration);
    }

    private void teardownTransport()
    {
        authenticated = false;
        awaitingAuth = false;
        cancelAuthTimeout();

        if (heartbeat != null)
        {
            heartbeat.stop();
            heartbeat = null;
        }

        Transport current = transport;
        transport = null;
        generation++;

        if (current != null)
        {
            current.close();
        }
        joinReceiver();
    }

    private void joinReceiver()
    {
        Thread thread = receiverThread;
        receiverThread = null;
        if (thread == null)
        {
            return;
        }

        try
        {
            thread.join(RECEIVER_JOIN_TIMEOUT_MS);
            if (thread.isAlive())
            {
                LOG.warn("Receive loop {} did not stop within {}ms", thread.getName(), RECEIVER_JOIN_TIMEOUT_MS);
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    private void cancelAuthTimeout()
    {
        if (authTimeoutTask != null)
        {
            authTimeoutTask.cancel();
            authTimeoutTask = null;
        }
    }

    private void cancelReconnect()
    {
        if (reconnectTask != null)
        {
            reconnectTask.cancel();
            reconnectTask = null;
        }
    }

    private void completePendingConnect(ChatConnectionException failure)
    {
        CompletableFuture<Void> result = pendingConnect;
        pendingConnect = null;
        if (result == null)
        {
            return;
        }
        if (failure == null)
        {
            result.complete(null);
        }
        else
        {
            result.completeExceptionally(failure);
        }
    }

    private void enqueueQuietly(Command command)
    {
        if (closed || !running)
        {
            return;
        }
        commands.add(command);
    }

    private void setState(ConnectionState newState)
    {
        synchronized (stateListeners)
        {
            ConnectionState previous = state;
            if (previous.equals(newState))
            {
                return;
            }
            state = newState;
            LOG.debug("State {} -> {}", previous.displayText(), newState.displayText());

            for (StateListener listener : stateListeners)
            {
                safeCallback(() -> listener.onStateChanged(newState));
            }
        }
    }

    private void publish(InboundEvent event)
    {
        for (EventListener listener : eventListeners)
        {
            safeCallback(() -> listener.onEvent(event));
        }
    }

    private void safeCallback(Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (Exception e)
        {
            LOG.error("Listener error", e);
        }
    }
}
