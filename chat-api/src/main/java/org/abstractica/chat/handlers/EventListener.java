package org.abstractica.chat.handlers;

import org.abstractica.chat.InboundEvent;

/**
 * Receives inbound events from a chat connection.
 *
 * <p>Listeners are called from the connection's session thread in emission
 * order. A listener must not block; exceptions it throws are logged and do
 * not affect other listeners.</p>
 */
@FunctionalInterface
public interface EventListener
{
    /**
     * Handles an inbound event.
     *
     * @param event the event
     */
    void onEvent(InboundEvent event);
}
