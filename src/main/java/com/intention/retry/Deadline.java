package com.intention.retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Point in time after which a caller no longer waits. Measured on the monotonic clock.
 *
 * <p>A deadline can be pushed later with {@link #extendTo(Deadline)}, never earlier.</p>
 */
public final class Deadline {

    private final AtomicLong deadlineNanos;
    private final Duration timeout;

    private Deadline(Duration timeout) {
        this.timeout = timeout;
        this.deadlineNanos = new AtomicLong(System.nanoTime() + saturatedNanos(timeout));
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        return new Deadline(timeout);
    }

    /**
     * @return time left, never negative
     */
    public Duration remaining() {
        long left = deadlineNanos.get() - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean isExpired() {
        return deadlineNanos.get() - System.nanoTime() <= 0;
    }

    /**
     * Move this deadline to {@code other}'s if that one ends later.
     *
     * @return true if this deadline moved
     */
    public boolean extendTo(Deadline other) {
        long target = other.deadlineNanos.get();
        long previous = deadlineNanos.getAndAccumulate(target, (current, candidate) -> candidate - current > 0 ? candidate : current);
        return target - previous > 0;
    }

    /**
     * The timeout this deadline was created with, before any extension.
     */
    public Duration getTimeout() {
        return timeout;
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }

    @Override
    public String toString() {
        return "Deadline[timeout=" + timeout + ", remaining=" + remaining() + "]";
    }
}
