package org.abstractica.chat.impl.reliability;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Calculates reconnect backoff delays.
 *
 * <p>Attempt {@code n} (1-based) waits {@code min(base * 2^(n-1), max)}.
 * Attempts beyond {@code maxAttempts} are not allowed.</p>
 */
public final class ReconnectPolicy
{
    /**
     * Default delay before the first reconnect attempt.
     */
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);

    /**
     * Default upper bound for the backoff delay.
     */
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    /**
     * Default number of reconnect attempts.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    // 2^30 already exceeds any sensible cap
    private static final int MAX_SHIFT = 30;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    /**
     * Creates a policy with the default base delay, cap and attempt count.
     */
    public ReconnectPolicy()
    {
        this(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Creates a policy.
     *
     * @param baseDelay   delay before the first attempt
     * @param maxDelay    upper bound for any delay
     * @param maxAttempts number of attempts allowed
     */
    public ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts)
    {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || baseDelay.isZero())
        {
            throw new IllegalArgumentException("Base delay must be positive: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0)
        {
            throw new IllegalArgumentException("Max delay must be >= base delay: " + maxDelay);
        }
        if (maxAttempts < 0)
        {
            throw new IllegalArgumentException("Max attempts must be non-negative: " + maxAttempts);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Returns whether the given attempt may be made.
     *
     * @param attempt attempt number (1-based)
     * @return true if {@code attempt <= maxAttempts}
     */
    public boolean allows(int attempt)
    {
        return attempt >= 1 && attempt <= maxAttempts;
    }

    /**
     * Calculates the delay before an attempt, ignoring the attempt cap.
     *
     * @param attempt attempt number (1-based)
     * @return the backoff delay
     */
    public Duration calculateDelay(int attempt)
    {
        if (attempt < 1)
        {
            throw new IllegalArgumentException("Attempt must be positive: " + attempt);
        }

        int shift = Math.min(attempt - 1, MAX_SHIFT);
        long delayMs = baseDelay.toMillis() << shift;
        if (delayMs <= 0 || delayMs > maxDelay.toMillis())
        {
            return maxDelay;
        }
        return Duration.ofMillis(delayMs);
    }

    /**
     * Returns the delay before an attempt, or empty once attempts are exhausted.
     *
     * @param attempt attempt number (1-based)
     * @return the delay, or empty if the attempt is not allowed
     */
    public Optional<Duration> delayFor(int attempt)
    {
        if (!allows(attempt))
        {
            return Optional.empty();
        }
        return Optional.of(calculateDelay(attempt));
    }

    public Duration getBaseDelay()
    {
        return baseDelay;
    }

    public Duration getMaxDelay()
    {
        return maxDelay;
    }

    public int getMaxAttempts()
    {
        return maxAttempts;
    }

    @Override
    public String toString()
    {
        return "ReconnectPolicy[base=" + baseDelay.toMillis() + "ms, max=" + maxDelay.toMillis()
                + "ms, attempts=" + maxAttempts + "]";
    }
}
