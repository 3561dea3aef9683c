package com.intention.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Per-call options for {@code RequestCoordinator.execute}.
 */
@Data
@Builder
public class ExecuteOptions {

    /**
     * Overall deadline. {@code null} falls back to the coordinator default.
     */
    private Duration timeout;

    /**
     * Neither read from nor write to the cache.
     */
    @Builder.Default
    private boolean bypassCache = false;

    /**
     * Skip the cache read but store the fresh response.
     */
    @Builder.Default
    private boolean forceRefresh = false;

    /**
     * Provider override; {@code null} uses the template's or the default provider.
     */
    private String provider;

    public static ExecuteOptions defaults() {
        return ExecuteOptions.builder().build();
    }

    public boolean shouldLookup() {
        return !bypassCache && !forceRefresh;
    }

    public boolean shouldStore() {
        return !bypassCache;
    }
}
