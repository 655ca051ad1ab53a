package org.abstractica.chat.impl.reliability;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ReconnectPolicy}.
 */
class ReconnectPolicyTest
{
    @Test
    void delayFor_defaultPolicy_doublesUpToCap()
    {
        ReconnectPolicy policy = new ReconnectPolicy();

        assertEquals(Optional.of(Duration.ofSeconds(2)), policy.delayFor(1));
        assertEquals(Optional.of(Duration.ofSeconds(4)), policy.delayFor(2));
        assertEquals(Optional.of(Duration.ofSeconds(8)), policy.delayFor(3));
        assertEquals(Optional.of(Duration.ofSeconds(16)), policy.delayFor(4));
        assertEquals(Optional.of(Duration.ofSeconds(30)), policy.delayFor(5));
    }

    @Test
    void delayFor_beyondMaxAttempts_isEmpty()
    {
        ReconnectPolicy policy = new ReconnectPolicy();

        assertTrue(policy.delayFor(6).isEmpty());
        assertFalse(policy.allows(6));
        assertFalse(policy.allows(0));
    }

    @Test
    void calculateDelay_largeAttempt_staysAtCap()
    {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(2), Duration.ofSeconds(30), 100);

        assertEquals(Duration.ofSeconds(30), policy.calculateDelay(40));
        assertEquals(Duration.ofSeconds(30), policy.calculateDelay(Integer.MAX_VALUE));
    }

    @Test
    void calculateDelay_invalidAttempt_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy().calculateDelay(0));
    }

    @Test
    void constructor_invalidArguments_throw()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ZERO, Duration.ofSeconds(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), -1));
    }

    @Test
    void zeroAttempts_neverReconnects()
    {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0);

        assertTrue(policy.delayFor(1).isEmpty());
    }
}
