package com.intention.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket for one provider.
 *
 * <p>Tokens refill continuously at {@code refillRate} per second up to {@code capacity}.
 * Refill is computed lazily from elapsed ticker time on each access; there is no timer.
 * All state is guarded by a fair lock, so waiters are served roughly in arrival order.</p>
 *
 * <p>Token count never increases by more than the elapsed time justifies: a ticker that
 * stands still or steps backwards refills nothing.</p>
 */
public class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final String providerId;
    private final double capacity;
    private final double refillRate;
    private final Ticker ticker;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition tokensChanged = lock.newCondition();

    private double tokens;
    private long lastRefillNanos;

    /**
     * Bucket starting full.
     *
     * @param capacity   maximum tokens, positive
     * @param refillRate tokens per second, positive
     * @param ticker     monotonic nanosecond source
     */
    public TokenBucket(String providerId, double capacity, double refillRate, Ticker ticker) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be positive (current: " + refillRate + ")");
        }
        this.providerId = providerId;
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.ticker = ticker;
        this.tokens = capacity;
        this.lastRefillNanos = ticker.read();
    }

    /**
     * Debit {@code cost} tokens if available, without waiting.
     */
    public boolean tryAcquire(double cost) {
        checkCost(cost);
        lock.lock();
        try {
            refill();
            if (tokens >= cost) {
                tokens -= cost;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Debit {@code cost} tokens, waiting up to {@code timeout} for them to accumulate.
     *
     * @return true if admitted, false if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean acquire(double cost, long timeout, TimeUnit unit) throws InterruptedException {
        checkCost(cost);
        long timeoutNanos = unit.toNanos(timeout);
        long waitStart = System.nanoTime();

        lock.lockInterruptibly();
        try {
            while (true) {
                refill();
                if (tokens >= cost) {
                    tokens -= cost;
                    return true;
                }

                long remaining = timeoutNanos - (System.nanoTime() - waitStart);
                if (remaining <= 0) {
                    return false;
                }

                long untilEnough = nanosUntil(cost);
                tokensChanged.awaitNanos(Math.min(untilEnough, remaining));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current token count after refill.
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public String getProviderId() {
        return providerId;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getRefillRate() {
        return refillRate;
    }

    private void refill() {
        long now = ticker.read();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed * refillRate / NANOS_PER_SECOND);
        lastRefillNanos = now;
    }

    private long nanosUntil(double cost) {
        double deficit = cost - tokens;
        // Round up, and never spin with a zero wait
        return Math.max(1L, (long) Math.ceil(deficit / refillRate * NANOS_PER_SECOND));
    }

    private void checkCost(double cost) {
        if (cost <= 0) {
            throw new IllegalArgumentException("cost must be positive (current: " + cost + ")");
        }
    }
}
