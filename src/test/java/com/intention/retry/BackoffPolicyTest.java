package com.intention.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackoffPolicy.
 */
class BackoffPolicyTest {

    @Test
    void testExponentialWithoutJitter() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.0);

        assertEquals(Duration.ofMillis(100), policy.delayFor(0));
        assertEquals(Duration.ofMillis(200), policy.delayFor(1));
        assertEquals(Duration.ofMillis(400), policy.delayFor(2));
        assertEquals(Duration.ofMillis(800), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(1), policy.delayFor(4));
        assertEquals(Duration.ofSeconds(1), policy.delayFor(80));
    }

    @Test
    void testJitterBounds() {
        BackoffPolicy low = new BackoffPolicy(Duration.ofMillis(1000), Duration.ofSeconds(60), 0.2, () -> 0.0);
        BackoffPolicy mid = new BackoffPolicy(Duration.ofMillis(1000), Duration.ofSeconds(60), 0.2, () -> 0.5);
        BackoffPolicy high = new BackoffPolicy(Duration.ofMillis(1000), Duration.ofSeconds(60), 0.2, () -> 0.999999);

        assertEquals(Duration.ofMillis(800), low.delayFor(0));
        assertEquals(Duration.ofMillis(1000), mid.delayFor(0));
        assertEquals(Duration.ofMillis(1200), high.delayFor(0));
    }

    @Test
    void testJitterNeverExceedsMax() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(2), 1.0, () -> 0.999);

        for (int i = 0; i < 10; i++) {
            assertTrue(policy.delayFor(i).compareTo(Duration.ofSeconds(2)) <= 0);
        }
    }

    @Test
    void testRandomJitterStaysInRange() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(1000), Duration.ofSeconds(60), 0.2);

        for (int i = 0; i < 200; i++) {
            long ms = policy.delayFor(1).toMillis();
            assertTrue(ms >= 1600 && ms <= 2400, "delay " + ms);
        }
    }

    @Test
    void testRetryAfterHintWins() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.0);

        assertEquals(Duration.ofSeconds(7), policy.delayFor(0, Duration.ofSeconds(7)));
        assertEquals(Duration.ofMillis(200), policy.delayFor(1, null));
    }

    @Test
    void testRejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), 0.1));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 0.1));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), 1.5));
    }
}
