package org.abstractica.chat.handlers;

import org.abstractica.chat.ConnectionState;

/**
 * Observes connection state changes.
 *
 * <p>On registration the listener immediately receives the current state.</p>
 */
@FunctionalInterface
public interface StateListener
{
    /**
     * Called with the new state.
     *
     * @param state the current connection state
     */
    void onStateChanged(ConnectionState state);
}
