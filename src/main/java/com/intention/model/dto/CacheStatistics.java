package com.intention.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of response cache activity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * "memory" or "redis".
     */
    private String backend;

    /**
     * Entries currently held; approximate for both backends.
     */
    private long entries;

    private long hits;

    private long misses;

    /**
     * Entries dropped because they were read or swept after expiry.
     */
    private long expired;

    /**
     * Entries dropped by explicit or prefix invalidation.
     */
    private long invalidated;

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
