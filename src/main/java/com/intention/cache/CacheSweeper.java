package com.intention.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically drops expired entries. Reads never rely on it; it only reclaims memory.
 */
@Slf4j
public class CacheSweeper {

    private final ResponseCacheStore store;

    public CacheSweeper(ResponseCacheStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${intention.cache.sweep-interval}")
    public void sweep() {
        int removed = store.evictExpired();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
    }
}
