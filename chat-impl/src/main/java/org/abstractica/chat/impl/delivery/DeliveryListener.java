package org.abstractica.chat.impl.delivery;

import org.abstractica.chat.Message;

/**
 * Listener for changes to a room's message list.
 */
@FunctionalInterface
public interface DeliveryListener
{
    /**
     * Called when a message is added or its delivery state changes.
     *
     * <p>Called outside the tracker's lock, on the thread that caused the
     * change: the send executor, the connection's session thread or the
     * caller of {@link DeliveryTracker#submit(String)}.</p>
     *
     * @param message the message in its new state
     */
    void onMessageChanged(Message message);
}
