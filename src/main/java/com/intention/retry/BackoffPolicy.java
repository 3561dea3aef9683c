package com.intention.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * <pre>
 * exponential = min(baseDelay * 2^retryIndex, maxDelay)
 * delay       = exponential * (1 + jitterFactor * u),  u uniform in [-1, 1)
 * </pre>
 *
 * <p>With baseDelay=500ms and jitterFactor=0.2: index 0 gives 400-600ms, index 1 gives
 * 800-1200ms, index 2 gives 1600-2400ms. The result never exceeds maxDelay.</p>
 */
public class BackoffPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1)
     * @throws IllegalArgumentException on a non-positive base, a max below base or a jitter outside [0, 1]
     */
    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be positive (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * @param retryIndex zero for the first retry
     */
    public Duration delayFor(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must not be negative (current: " + retryIndex + ")");
        }
        long baseMs = baseDelay.toMillis();
        long maxMs = maxDelay.toMillis();

        // shift saturates well before 2^62
        long exponential = retryIndex >= 62 ? maxMs : Math.min(multiplyCapped(baseMs, 1L << retryIndex), maxMs);

        double spread = jitterFactor * (2.0 * random.getAsDouble() - 1.0);
        long jittered = Math.round(exponential * (1.0 + spread));
        return Duration.ofMillis(Math.max(0, Math.min(jittered, maxMs)));
    }

    /**
     * Delay for a rate-limited failure: the provider's hint when present, else the normal schedule.
     */
    public Duration delayFor(int retryIndex, Duration retryAfter) {
        if (retryAfter != null && !retryAfter.isNegative()) {
            return retryAfter;
        }
        return delayFor(retryIndex);
    }

    private static long multiplyCapped(long a, long b) {
        long result = a * b;
        return (a != 0 && result / a != b) ? Long.MAX_VALUE : result;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
