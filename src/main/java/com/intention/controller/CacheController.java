package com.intention.controller;

import com.intention.cache.ResponseCacheStore;
import com.intention.exception.TemplateException;
import com.intention.fingerprint.RequestFingerprint;
import com.intention.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cache management controller.
 * Provides statistics and invalidation for the response cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCacheStore cacheStore;

    public CacheController(ResponseCacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        CacheStatistics stats = cacheStore.stats();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("backend", stats.getBackend());
        body.put("entries", stats.getEntries());
        body.put("hits", stats.getHits());
        body.put("misses", stats.getMisses());
        body.put("hit_rate", stats.getHitRate());
        body.put("expired", stats.getExpired());
        body.put("invalidated", stats.getInvalidated());
        body.put("status", "healthy");
        return ResponseEntity.ok(body);
    }

    /**
     * Invalidate one entry by its full fingerprint.
     */
    @DeleteMapping("/{fingerprint}")
    public ResponseEntity<Map<String, Object>> invalidate(@PathVariable String fingerprint) {
        RequestFingerprint parsed;
        try {
            parsed = RequestFingerprint.parse(fingerprint);
        } catch (IllegalArgumentException e) {
            throw new TemplateException("Invalid fingerprint: " + e.getMessage(), e);
        }
        boolean removed = cacheStore.invalidate(parsed);
        log.info("Cache invalidation for {}: removed={}", fingerprint, removed);

        if (!removed) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "success", "removed", 1));
    }

    /**
     * Invalidate every entry whose fingerprint starts with {@code prefix},
     * e.g. {@code openai:} or {@code openai:product_search@1.0.0:}.
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> invalidatePrefix(@RequestParam String prefix) {
        if (prefix.isBlank()) {
            throw new TemplateException("Prefix must not be blank; use POST /v1/cache/clear to drop everything");
        }
        int removed = cacheStore.invalidatePrefix(prefix);
        log.info("Cache prefix invalidation for '{}': removed={}", prefix, removed);

        return ResponseEntity.ok(Map.of("status", "success", "removed", removed));
    }

    /**
     * Clear the cache.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        cacheStore.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache cleared"
        ));
    }
}
