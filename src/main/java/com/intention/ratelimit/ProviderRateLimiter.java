package com.intention.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;
import com.intention.config.IntentionProperties;
import com.intention.exception.RateLimitTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-provider token bucket rate limiting for outbound calls.
 *
 * <p>Each provider has its own bucket and lock; callers of different providers never
 * contend. Providers without a positive configured capacity are not limited.</p>
 */
@Slf4j
public class ProviderRateLimiter {

    private final Map<String, IntentionProperties.ProviderConfig> providerConfigs;
    private final Ticker ticker;
    private final Map<String, Optional<TokenBucket>> buckets = new ConcurrentHashMap<>();

    public ProviderRateLimiter(Map<String, IntentionProperties.ProviderConfig> providerConfigs, Ticker ticker) {
        this.providerConfigs = providerConfigs;
        this.ticker = ticker;
    }

    /**
     * Admit one call of weight {@code cost}, blocking up to {@code timeout}.
     *
     * @throws RateLimitTimeoutException if no admission within the timeout, if the cost can
     *                                   never fit the bucket, or if the wait is interrupted
     */
    public void acquire(String providerId, double cost, Duration timeout) {
        Optional<TokenBucket> bucket = bucketFor(providerId);
        if (bucket.isEmpty()) {
            return;
        }
        TokenBucket tokenBucket = bucket.get();

        if (cost > tokenBucket.getCapacity()) {
            throw new RateLimitTimeoutException(providerId, Duration.ZERO, String.format(
                    "Cost %.2f exceeds bucket capacity %.2f for provider '%s'",
                    cost, tokenBucket.getCapacity(), providerId));
        }

        long timeoutNanos = timeout == null || timeout.isNegative() ? 0 : saturatedNanos(timeout);
        try {
            if (!tokenBucket.acquire(cost, timeoutNanos, TimeUnit.NANOSECONDS)) {
                log.warn("Rate limit admission timed out for provider '{}' after {}", providerId, timeout);
                throw new RateLimitTimeoutException(providerId, timeout,
                        "Rate limit admission timed out for provider '" + providerId + "' after " + timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateLimitTimeoutException(providerId, timeout,
                    "Interrupted while waiting for rate limit admission on provider '" + providerId + "'", e);
        }
        log.debug("Admitted call to provider '{}' (cost={})", providerId, cost);
    }

    public void acquire(String providerId, Duration timeout) {
        acquire(providerId, 1, timeout);
    }

    /**
     * Non-blocking admission.
     */
    public boolean tryAcquire(String providerId, double cost) {
        return bucketFor(providerId)
                .map(bucket -> cost <= bucket.getCapacity() && bucket.tryAcquire(cost))
                .orElse(true);
    }

    /**
     * Tokens currently available, or empty if the provider is not limited.
     */
    public Optional<Double> availableTokens(String providerId) {
        return bucketFor(providerId).map(TokenBucket::availableTokens);
    }

    private Optional<TokenBucket> bucketFor(String providerId) {
        return buckets.computeIfAbsent(providerId, id -> {
            IntentionProperties.ProviderConfig config = providerConfigs.get(id);
            if (config == null || config.getCapacity() <= 0) {
                log.debug("No rate limit configured for provider '{}'", id);
                return Optional.empty();
            }
            log.info("Created token bucket for provider '{}' (capacity={}, refillRate={}/s)",
                    id, config.getCapacity(), config.getRefillRate());
            return Optional.of(new TokenBucket(id, config.getCapacity(), config.getRefillRate(), ticker));
        });
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
