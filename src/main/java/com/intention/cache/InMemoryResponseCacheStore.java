package com.intention.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.intention.fingerprint.RequestFingerprint;
import com.intention.model.CacheEntry;
import com.intention.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process response cache backed by Caffeine.
 *
 * <p>Caffeine provides the size bound (approximately least-recently-used); expiry is
 * checked against the injected {@link Clock} on every read.</p>
 */
@Slf4j
public class InMemoryResponseCacheStore implements ResponseCacheStore {

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong invalidated = new AtomicLong();

    /**
     * @param maxSize maximum entries; zero or negative for unbounded
     */
    public InMemoryResponseCacheStore(long maxSize, Clock clock) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                // Run maintenance on the calling thread so size bounds apply immediately
                .executor(Runnable::run);
        if (maxSize > 0) {
            builder.maximumSize(maxSize);
        }
        this.cache = builder.build();
        this.clock = clock;
        log.info("Initialized in-memory response cache (max size: {})", maxSize > 0 ? maxSize : "unbounded");
    }

    @Override
    public Optional<CacheEntry> get(RequestFingerprint fingerprint) {
        String key = fingerprint.getValue();
        CacheEntry entry = cache.getIfPresent(key);

        if (entry == null) {
            misses.incrementAndGet();
            log.debug("Cache MISS: {}", key);
            return Optional.empty();
        }

        if (entry.isExpiredAt(clock.instant())) {
            // Only remove the exact entry we saw; a concurrent put may have replaced it
            if (cache.asMap().remove(key, entry)) {
                expired.incrementAndGet();
            }
            misses.incrementAndGet();
            log.debug("Cache MISS (expired at {}): {}", entry.getExpiresAt(), key);
            return Optional.empty();
        }

        hits.incrementAndGet();
        log.debug("Cache HIT: {}, version={}", key, entry.getVersion());
        return Optional.of(entry);
    }

    @Override
    public CacheEntry put(RequestFingerprint fingerprint, JsonNode response, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        String key = fingerprint.getValue();
        Instant now = clock.instant();

        JsonNode copy = response.deepCopy();
        CacheEntry stored = cache.asMap().compute(key, (k, previous) -> CacheEntry.builder()
                .fingerprint(k)
                .response(copy)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .version(previous == null ? 1 : previous.getVersion() + 1)
                .build());

        log.debug("Stored in cache: key={}, ttl={}, version={}", key, ttl, stored.getVersion());
        return stored;
    }

    @Override
    public boolean invalidate(RequestFingerprint fingerprint) {
        boolean removed = cache.asMap().remove(fingerprint.getValue()) != null;
        if (removed) {
            invalidated.incrementAndGet();
            log.debug("Invalidated cache entry: {}", fingerprint);
        }
        return removed;
    }

    @Override
    public int invalidatePrefix(String prefix) {
        AtomicInteger removed = new AtomicInteger();
        cache.asMap().keySet().removeIf(key -> {
            if (key.startsWith(prefix)) {
                removed.incrementAndGet();
                return true;
            }
            return false;
        });
        invalidated.addAndGet(removed.get());
        log.info("Invalidated {} cache entries with prefix '{}'", removed.get(), prefix);
        return removed.get();
    }

    @Override
    public void clear() {
        long sizeBefore = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Cache cleared, removed ~{} entries", sizeBefore);
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        cache.asMap().values().removeIf(entry -> {
            if (entry.isExpiredAt(now)) {
                removed.incrementAndGet();
                return true;
            }
            return false;
        });
        expired.addAndGet(removed.get());
        return removed.get();
    }

    @Override
    public CacheStatistics stats() {
        cache.cleanUp();
        return CacheStatistics.builder()
                .backend("memory")
                .entries(cache.estimatedSize())
                .hits(hits.get())
                .misses(misses.get())
                .expired(expired.get())
                .invalidated(invalidated.get())
                .build();
    }
}
