package org.abstractica.chat.impl.transport;

/**
 * Creates transports, one per connection attempt.
 *
 * <p>Implementations provide different backends:</p>
 * <ul>
 *   <li>{@link WebSocketTransportFactory} - JDK WebSocket client for production</li>
 *   <li>{@link SimulatedServer} - in-memory peer for testing</li>
 * </ul>
 */
@FunctionalInterface
public interface TransportFactory
{
    /**
     * Creates a new, unopened transport.
     *
     * @return a new transport
     */
    Transport create();
}
