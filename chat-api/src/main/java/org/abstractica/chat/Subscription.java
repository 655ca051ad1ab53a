package org.abstractica.chat;

/**
 * Handle for a registered listener.
 *
 * <p>Closing the subscription removes the listener. Closing twice is a no-op.</p>
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    @Override
    void close();
}
