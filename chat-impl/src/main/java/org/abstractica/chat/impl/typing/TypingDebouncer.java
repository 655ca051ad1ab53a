package org.abstractica.chat.impl.typing;

import org.abstractica.chat.impl.scheduling.ScheduledTask;
import org.abstractica.chat.impl.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Turns compose-buffer edits into typing indicators.
 *
 * <p>The first edit of a burst emits {@code true}. The burst ends with
 * {@code false} when the buffer is cleared or after a quiet period without
 * edits.</p>
 */
public class TypingDebouncer
{
    private static final Logger LOG = LoggerFactory.getLogger(TypingDebouncer.class);

    /**
     * Default time without edits after which typing stops.
     */
    public static final Duration DEFAULT_QUIET_PERIOD = Duration.ofSeconds(2);

    /**
     * Receives typing indicator changes.
     */
    @FunctionalInterface
    public interface TypingSink
    {
        void typingChanged(boolean isTyping);
    }

    private final TaskScheduler scheduler;
    private final Duration quietPeriod;
    private final TypingSink sink;

    private boolean typing;
    private long generation;
    private ScheduledTask quietTimer;

    public TypingDebouncer(TaskScheduler scheduler, TypingSink sink)
    {
        this(scheduler, DEFAULT_QUIET_PERIOD, sink);
    }

    public TypingDebouncer(TaskScheduler scheduler, Duration quietPeriod, TypingSink sink)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.quietPeriod = Objects.requireNonNull(quietPeriod, "quietPeriod");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Records an edit of the compose buffer.
     *
     * @param text the buffer content after the edit
     */
    public synchronized void onTextChanged(String text)
    {
        Objects.requireNonNull(text, "text");
        cancelTimer();

        if (text.isEmpty())
        {
            stopTyping();
            return;
        }

        if (!typing)
        {
            typing = true;
            emit(true);
        }

        long timerGeneration = generation;
        quietTimer = scheduler.schedule(() -> quietPeriodElapsed(timerGeneration), quietPeriod);
    }

    /**
     * Ends the current burst immediately, for example after the message was sent.
     */
    public synchronized void stop()
    {
        cancelTimer();
        stopTyping();
    }

    /**
     * Cancels the quiet-period timer without emitting.
     */
    public synchronized void close()
    {
        cancelTimer();
        typing = false;
    }

    public synchronized boolean isTyping()
    {
        return typing;
    }

    private synchronized void quietPeriodElapsed(long timerGeneration)
    {
        if (timerGeneration != generation)
        {
            return;
        }
        quietTimer = null;
        stopTyping();
    }

    private void stopTyping()
    {
        if (typing)
        {
            typing = false;
            emit(false);
        }
    }

    private void cancelTimer()
    {
        generation++;
        if (quietTimer != null)
        {
            quietTimer.cancel();
            quietTimer = null;
        }
    }

    private void emit(boolean isTyping)
    {
        try
        {
            sink.typingChanged(isTyping);
        }
        catch (Exception e)
        {
            LOG.warn("Typing indicator failed: {}", e.getMessage());
        }
    }
}
