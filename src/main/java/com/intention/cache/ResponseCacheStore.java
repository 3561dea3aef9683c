package com.intention.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.intention.fingerprint.RequestFingerprint;
import com.intention.model.CacheEntry;
import com.intention.model.dto.CacheStatistics;

import java.time.Duration;
import java.util.Optional;

/**
 * Fingerprint → response store with per-entry TTL.
 *
 * <p>Expired entries are never returned: a read past {@code expiresAt} is a miss and
 * evicts the entry. Implementations decide their own consistency; the in-process store
 * is linearizable, the Redis store is read-your-writes for a single writer.</p>
 */
public interface ResponseCacheStore {

    Optional<CacheEntry> get(RequestFingerprint fingerprint);

    /**
     * Store or overwrite; {@code expiresAt = now + ttl}.
     *
     * @return the entry as stored, with its new version
     */
    CacheEntry put(RequestFingerprint fingerprint, JsonNode response, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    boolean invalidate(RequestFingerprint fingerprint);

    /**
     * Remove every entry whose fingerprint value starts with {@code prefix}.
     *
     * @return number of entries removed
     */
    int invalidatePrefix(String prefix);

    void clear();

    CacheStatistics stats();

    /**
     * Drop entries already past expiry. Optional housekeeping; reads never depend on it.
     *
     * @return number of entries removed
     */
    default int evictExpired() {
        return 0;
    }
}
