package com.intention.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intention.fingerprint.RequestFingerprint;
import com.intention.model.CacheEntry;
import com.intention.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed response cache with gzip compression, shared between service instances.
 * Key pattern: intention:cache:{provider}:{namespace}:{sha256}
 *
 * <p>Redis TTL removes entries on its own; {@code expiresAt} is still checked on read
 * so expiry never depends on server eviction timing. Backend failures are logged and
 * treated as misses or skipped writes: a broken cache must not break requests.</p>
 */
@Slf4j
public class RedisResponseCacheStore implements ResponseCacheStore {

    static final String KEY_PREFIX = "intention:cache:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong invalidated = new AtomicLong();

    public RedisResponseCacheStore(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(RequestFingerprint fingerprint) {
        String redisKey = buildKey(fingerprint.getValue());
        try {
            byte[] compressed = redisTemplate.opsForValue().get(redisKey);

            if (compressed == null) {
                misses.incrementAndGet();
                log.debug("Redis cache miss: {}", redisKey);
                return Optional.empty();
            }

            CacheEntry entry = decompress(compressed);
            if (entry.isExpiredAt(clock.instant())) {
                redisTemplate.delete(redisKey);
                expired.incrementAndGet();
                misses.incrementAndGet();
                log.debug("Redis cache miss (expired at {}): {}", entry.getExpiresAt(), redisKey);
                return Optional.empty();
            }

            hits.incrementAndGet();
            log.debug("Redis cache hit: {}, version={}", redisKey, entry.getVersion());
            return Optional.of(entry);

        } catch (Exception e) {
            misses.incrementAndGet();
            log.error("Error retrieving from Redis cache: key={}", redisKey, e);
            return Optional.empty();
        }
    }

    @Override
    public CacheEntry put(RequestFingerprint fingerprint, JsonNode response, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        String redisKey = buildKey(fingerprint.getValue());
        Instant now = clock.instant();

        CacheEntry entry = CacheEntry.builder()
                .fingerprint(fingerprint.getValue())
                .response(response)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .version(previousVersion(redisKey) + 1)
                .build();

        try {
            byte[] compressed = compress(entry);
            redisTemplate.opsForValue().set(redisKey, compressed, ttl);

            log.debug("Stored in Redis cache: key={}, ttl={}, size={}B", redisKey, ttl, compressed.length);
        } catch (Exception e) {
            log.error("Error storing to Redis cache: key={}", redisKey, e);
        }
        return entry;
    }

    @Override
    public boolean invalidate(RequestFingerprint fingerprint) {
        String redisKey = buildKey(fingerprint.getValue());
        try {
            boolean removed = Boolean.TRUE.equals(redisTemplate.delete(redisKey));
            if (removed) {
                invalidated.incrementAndGet();
                log.debug("Deleted from Redis cache: {}", redisKey);
            }
            return removed;
        } catch (Exception e) {
            log.error("Error deleting from Redis cache: key={}", redisKey, e);
            return false;
        }
    }

    @Override
    public int invalidatePrefix(String prefix) {
        try {
            Set<String> keys = redisTemplate.keys(KEY_PREFIX + escapeGlob(prefix) + "*");
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            int removed = deleted == null ? 0 : deleted.intValue();
            invalidated.addAndGet(removed);
            log.info("Invalidated {} Redis cache entries with prefix '{}'", removed, prefix);
            return removed;
        } catch (Exception e) {
            log.error("Error invalidating Redis cache prefix: {}", prefix, e);
            return 0;
        }
    }

    @Override
    public void clear() {
        try {
            Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.info("Cleared {} entries from Redis cache", keys.size());
            }
        } catch (Exception e) {
            log.error("Error clearing Redis cache", e);
        }
    }

    @Override
    public CacheStatistics stats() {
        long entries = -1;
        try {
            Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
            entries = keys == null ? 0 : keys.size();
        } catch (Exception e) {
            log.warn("Could not count Redis cache entries", e);
        }
        return CacheStatistics.builder()
                .backend("redis")
                .entries(entries)
                .hits(hits.get())
                .misses(misses.get())
                .expired(expired.get())
                .invalidated(invalidated.get())
                .build();
    }

    private long previousVersion(String redisKey) {
        try {
            byte[] existing = redisTemplate.opsForValue().get(redisKey);
            return existing == null ? 0 : decompress(existing).getVersion();
        } catch (Exception e) {
            log.warn("Could not read previous version of {}", redisKey, e);
            return 0;
        }
    }

    private String buildKey(String fingerprint) {
        return KEY_PREFIX + fingerprint;
    }

    /**
     * Escape Redis glob metacharacters so a prefix matches literally.
     */
    static String escapeGlob(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length());
        for (char c : prefix.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private byte[] compress(CacheEntry entry) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(objectMapper.writeValueAsBytes(entry));
            }
            return baos.toByteArray();
        }
    }

    private CacheEntry decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CacheEntry.class);
        }
    }
}
