package org.abstractica.chat.impl.scheduling;

/**
 * Handle for a task scheduled on a {@link TaskScheduler}.
 */
public interface ScheduledTask
{
    /**
     * Cancels the task if it has not run yet.
     *
     * <p>Cancelling a task that already ran or was cancelled is a no-op.</p>
     */
    void cancel();

    /**
     * Returns whether the task has run or was cancelled.
     *
     * @return true if the task will not run anymore
     */
    boolean isDone();
}
