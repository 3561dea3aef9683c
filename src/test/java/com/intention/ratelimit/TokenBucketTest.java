package com.intention.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenBucket.
 */
class TokenBucketTest {

    private AtomicLong nanos;
    private Ticker ticker;

    @BeforeEach
    void setUp() {
        nanos = new AtomicLong(1_000_000_000L);
        ticker = nanos::get;
    }

    @Test
    void testCapacityAdmissionsSucceedThenNextFails() {
        TokenBucket bucket = new TokenBucket("openai", 5, 1, ticker);

        for (int i = 0; i < 5; i++) {
            assertTrue(bucket.tryAcquire(1), "admission " + i);
        }
        assertFalse(bucket.tryAcquire(1));
    }

    @Test
    void testRefillIsProportionalToElapsedTime() {
        TokenBucket bucket = new TokenBucket("openai", 10, 2, ticker);
        assertTrue(bucket.tryAcquire(10));

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(1500));

        assertEquals(3.0, bucket.availableTokens(), 1e-9);
        assertTrue(bucket.tryAcquire(3));
        assertFalse(bucket.tryAcquire(1));
    }

    @Test
    void testRefillNeverExceedsCapacity() {
        TokenBucket bucket = new TokenBucket("openai", 3, 100, ticker);

        nanos.addAndGet(TimeUnit.HOURS.toNanos(1));

        assertEquals(3.0, bucket.availableTokens(), 1e-9);
    }

    @Test
    void testTickerGoingBackwardsRefillsNothing() {
        TokenBucket bucket = new TokenBucket("openai", 4, 1, ticker);
        assertTrue(bucket.tryAcquire(4));

        nanos.addAndGet(-TimeUnit.SECONDS.toNanos(10));
        assertEquals(0.0, bucket.availableTokens(), 1e-9);

        // Back at the original reading nothing has elapsed either
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(10));
        assertEquals(0.0, bucket.availableTokens(), 1e-9);
    }

    @Test
    void testWeightedCost() {
        TokenBucket bucket = new TokenBucket("openai", 10, 1, ticker);

        assertTrue(bucket.tryAcquire(7.5));
        assertFalse(bucket.tryAcquire(3));
        assertTrue(bucket.tryAcquire(2.5));
    }

    @Test
    void testAcquireTimesOutWhenEmpty() throws InterruptedException {
        TokenBucket bucket = new TokenBucket("openai", 1, 0.001, ticker);
        assertTrue(bucket.tryAcquire(1));

        long start = System.nanoTime();
        assertFalse(bucket.acquire(1, 50, TimeUnit.MILLISECONDS));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(45));
    }

    @Test
    void testNextAdmissionBlocksUntilRefill() throws InterruptedException {
        // 20 tokens/s: one token every 50ms of real time
        TokenBucket bucket = new TokenBucket("openai", 2, 20, Ticker.systemTicker());
        assertTrue(bucket.tryAcquire(1));
        assertTrue(bucket.tryAcquire(1));

        long start = System.nanoTime();
        assertTrue(bucket.acquire(1, 2, TimeUnit.SECONDS));
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(waitedMs >= 40, "waited only " + waitedMs + "ms");
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("x", 0, 1, ticker));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket("x", 1, 0, ticker));
        TokenBucket bucket = new TokenBucket("x", 1, 1, ticker);
        assertThrows(IllegalArgumentException.class, () -> bucket.tryAcquire(0));
    }
}
