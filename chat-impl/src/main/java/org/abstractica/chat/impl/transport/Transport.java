package org.abstractica.chat.impl.transport;

import java.io.IOException;

/**
 * Bidirectional text-frame transport to the chat server.
 *
 * <p>A transport is opened once and closed once; reconnection uses a new
 * instance from the {@link TransportFactory}. Frames are read by exactly one
 * receive loop, while {@link #send(String)} may be called from any thread.</p>
 */
public interface Transport extends AutoCloseable
{
    /**
     * Opens the transport.
     *
     * @throws IOException if the connection cannot be established
     */
    void open() throws IOException;

    /**
     * Blocks until the next inbound frame is available.
     *
     * @return the frame text
     * @throws IOException if the transport failed or was closed
     */
    String receive() throws IOException;

    /**
     * Sends one text frame.
     *
     * <p>Thread-safe. Concurrent calls are serialized; a frame is written
     * completely before the next one begins.</p>
     *
     * @param text the frame text
     * @throws IOException if the write fails or the transport is closed
     */
    void send(String text) throws IOException;

    /**
     * Returns whether the transport is open.
     *
     * @return true between a successful {@link #open()} and {@link #close()} or failure
     */
    boolean isOpen();

    /**
     * Closes the transport. A blocked {@link #receive()} fails promptly.
     * Closing twice is a no-op.
     */
    @Override
    void close();
}
