package org.abstractica.chat;

import org.abstractica.chat.handlers.EventListener;
import org.abstractica.chat.handlers.StateListener;

/**
 * A long-lived, authenticated connection to a chat server.
 *
 * <p>The connection owns one transport at a time, authenticates it with a
 * bearer token, keeps it alive with heartbeats and reconnects with bounded
 * exponential backoff when it drops. Inbound frames are delivered to
 * subscribers as typed {@link InboundEvent}s.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ChatConnection connection = new DefaultChatConnectionFactory().builder()
 *     .serverUri(URI.create("ws://127.0.0.1:8080/ws"))
 *     .build();
 *
 * connection.onStateChanged(state -> System.out.println(state.displayText()));
 * connection.subscribe(event -> {
 *     if (event instanceof InboundEvent.MessageReceived received) {
 *         // render received.message()
 *     }
 * });
 *
 * connection.connect(token);
 * connection.send(new OutboundFrame.Typing(roomId, true));
 * }</pre>
 */
public interface ChatConnection extends AutoCloseable
{
    /**
     * Connects and authenticates.
     *
     * <p>Blocks until the server acknowledges authentication, rejects it, or
     * the authentication timeout elapses. Does nothing if the connection is
     * already connecting, connected or reconnecting. From the failed state a
     * call starts a fresh attempt with a reset reconnect counter.</p>
     *
     * <p>The authentication timeout starts once the transport is open, so a
     * caller may wait up to the transport's connect timeout plus the
     * authentication timeout.</p>
     *
     * @param token bearer token sent in the authentication frame
     * @throws AuthenticationFailedException if authentication is rejected or times out
     * @throws TransportException            if the transport cannot be opened or fails during the handshake
     * @throws ConnectionCancelledException  if {@link #disconnect()} or {@link #close()} abandons the attempt
     * @throws InterruptedException          if the calling thread is interrupted while waiting
     */
    void connect(String token) throws ChatConnectionException, InterruptedException;

    /**
     * Disconnects.
     *
     * <p>Cancels heartbeat and reconnect timers, closes the transport and
     * moves to {@link ConnectionState.Disconnected}. Repeated calls are no-ops.
     * A caller blocked in {@link #connect(String)} fails with
     * {@link ConnectionCancelledException}. A transport still being opened is
     * abandoned, so the call does not wait for its connect timeout.</p>
     */
    void disconnect();

    /**
     * Disconnects and releases the connection's threads.
     *
     * <p>The connection cannot be used afterwards.</p>
     */
    @Override
    void close();

    /**
     * Encodes and sends a frame.
     *
     * @param frame the frame to send
     * @throws NotConnectedException   if the session is not authenticated
     * @throws FrameEncodingException  if the frame cannot be encoded
     * @throws TransportException      if the transport write fails
     */
    void send(OutboundFrame frame) throws ChatConnectionException;

    /**
     * Sends a raw text frame.
     *
     * @param text the frame text
     * @throws NotConnectedException if the session is not authenticated
     * @throws TransportException    if the transport write fails
     */
    void sendText(String text) throws ChatConnectionException;

    /**
     * Registers an event listener.
     *
     * @param listener the listener
     * @return subscription that removes the listener when closed
     */
    Subscription subscribe(EventListener listener);

    /**
     * Registers a state listener and immediately delivers the current state to it.
     *
     * @param listener the listener
     * @return subscription that removes the listener when closed
     */
    Subscription onStateChanged(StateListener listener);

    /**
     * Returns the current connection state.
     *
     * @return the state
     */
    ConnectionState getState();

    /**
     * Returns whether the session is authenticated.
     *
     * @return true if frames can be sent
     */
    boolean isConnected();
}
