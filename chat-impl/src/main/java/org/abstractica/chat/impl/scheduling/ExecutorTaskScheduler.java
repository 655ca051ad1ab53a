package org.abstractica.chat.impl.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TaskScheduler backed by a single-threaded {@link ScheduledExecutorService}.
 *
 * <p>Tasks run on one daemon thread. A task that throws is logged; later
 * tasks are unaffected.</p>
 */
public class ExecutorTaskScheduler implements TaskScheduler
{
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();

    private final ScheduledExecutorService executor;

    /**
     * Creates a scheduler whose thread is named after the given prefix.
     *
     * @param name thread name prefix
     */
    public ExecutorTaskScheduler(String name)
    {
        Objects.requireNonNull(name, "name");
        String threadName = name + "-" + INSTANCE_COUNTER.incrementAndGet();
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay)
    {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative())
        {
            throw new IllegalArgumentException("Delay must be non-negative: " + delay);
        }

        try
        {
            ScheduledFuture<?> future = executor.schedule(() -> runSafely(task), delay.toNanos(), TimeUnit.NANOSECONDS);
            return new FutureBackedTask(future);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Scheduler closed, task dropped");
            return CancelledTask.INSTANCE;
        }
    }

    @Override
    public void close()
    {
        executor.shutdownNow();
    }

    private static void runSafely(Runnable task)
    {
        try
        {
            task.run();
        }
        catch (Exception e)
        {
            LOG.error("Scheduled task failed", e);
        }
    }

    private record FutureBackedTask(ScheduledFuture<?> future) implements ScheduledTask
    {
        @Override
        public void cancel()
        {
            future.cancel(false);
        }

        @Override
        public boolean isDone()
        {
            return future.isDone();
        }
    }

    private enum CancelledTask implements ScheduledTask
    {
        INSTANCE;

        @Override
        public void cancel()
        {
            // never scheduled
        }

        @Override
        public boolean isDone()
        {
            return true;
        }
    }
}
