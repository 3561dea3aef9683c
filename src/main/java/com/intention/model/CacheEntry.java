package com.intention.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cached response owned by a {@code ResponseCacheStore}. Immutable; the store replaces
 * the whole entry on overwrite.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CacheEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    String fingerprint;

    JsonNode response;

    Instant createdAt;

    Instant expiresAt;

    /**
     * Incremented each time the same fingerprint is overwritten.
     */
    long version;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
