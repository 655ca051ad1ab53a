package org.abstractica.chat.impl.reliability;

import org.abstractica.chat.impl.scheduling.ScheduledTask;
import org.abstractica.chat.impl.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Sends keepalive pings at a fixed interval while started.
 *
 * <p>Each round waits the interval and then sends one ping. A failed send
 * stops the driver and is reported to the failure handler, which treats it
 * like any other transport failure.</p>
 */
public class HeartbeatDriver
{
    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatDriver.class);

    /**
     * Default interval between pings.
     */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    /**
     * Sends one keepalive.
     */
    @FunctionalInterface
    public interface PingSender
    {
        void sendPing() throws IOException;
    }

    private final TaskScheduler scheduler;
    private final Duration interval;
    private final PingSender sender;
    private final Consumer<IOException> failureHandler;

    private ScheduledTask nextPing;
    private boolean running;
    private long generation;
    private long pingsSent;

    /**
     * Creates a stopped heartbeat driver.
     *
     * @param scheduler      scheduler for the ping timer
     * @param interval       time between pings
     * @param sender         sends one ping
     * @param failureHandler called once when a ping cannot be sent
     */
    public HeartbeatDriver(
            TaskScheduler scheduler,
            Duration interval,
            PingSender sender,
            Consumer<IOException> failureHandler
    )
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        if (interval.isNegative() || interval.isZero())
        {
            throw new IllegalArgumentException("Heartbeat interval must be positive: " + interval);
        }
    }

    /**
     * Starts sending pings. Restarts the interval if already running.
     */
    public synchronized void start()
    {
        cancelNextPing();
        running = true;
        generation++;
        scheduleNextPing();
        LOG.debug("Heartbeat started, interval {}ms", interval.toMillis());
    }

    /**
     * Stops sending pings. Idempotent.
     */
    public synchronized void stop()
    {
        if (!running)
        {
            return;
        }
        running = false;
        generation++;
        cancelNextPing();
        LOG.debug("Heartbeat stopped after {} pings", pingsSent);
    }

    public synchronized boolean isRunning()
    {
        return running;
    }

    public synchronized long getPingsSent()
    {
        return pingsSent;
    }

    private void scheduleNextPing()
    {
        long scheduledGeneration = generation;
        nextPing = scheduler.schedule(() -> ping(scheduledGeneration), interval);
    }

    private void cancelNextPing()
    {
        if (nextPing != null)
        {
            nextPing.cancel();
            nextPing = null;
        }
    }

    private void ping(long scheduledGeneration)
    {
        synchronized (this)
        {
            if (!running || generation != scheduledGeneration)
            {
                return;
            }
        }

        try
        {
            sender.sendPing();
        }
        catch (IOException e)
        {
            LOG.warn("Heartbeat failed: {}", e.getMessage());
            synchronized (this)
            {
                if (!running || generation != scheduledGeneration)
                {
                    return;
                }
                running = false;
                nextPing = null;
            }
            failureHandler.accept(e);
            return;
        }

        synchronized (this)
        {
            pingsSent++;
            if (running && generation == scheduledGeneration)
            {
                LOG.trace("Heartbeat sent");
                scheduleNextPing();
            }
        }
    }
}
