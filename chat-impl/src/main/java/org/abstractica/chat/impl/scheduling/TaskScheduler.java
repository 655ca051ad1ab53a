package org.abstractica.chat.impl.scheduling;

import java.time.Duration;

/**
 * Runs tasks after a delay.
 *
 * <p>All timers of a chat connection (authentication timeout, heartbeat,
 * reconnect backoff, typing quiet period) go through this interface so that
 * tests can control time.</p>
 */
public interface TaskScheduler extends AutoCloseable
{
    /**
     * Schedules a one-shot task.
     *
     * @param task  the task to run
     * @param delay delay before running, zero or positive
     * @return handle for cancelling the task
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Cancels all pending tasks and releases the scheduler's threads.
     */
    @Override
    void close();
}
