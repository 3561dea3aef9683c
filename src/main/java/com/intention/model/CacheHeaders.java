package com.intention.model;

/**
 * HTTP headers for per-request options and cache provenance.
 */
public final class CacheHeaders {

    // ========== Request Headers ==========

    /**
     * Budget scope charged for the call (tenant, session...).
     *
     * Example: x-budget-scope: tenant-42
     */
    public static final String BUDGET_SCOPE = "x-budget-scope";

    /**
     * Skip the cache entirely, neither reading nor storing.
     * Value: "true" or "false"
     */
    public static final String CACHE_BYPASS = "x-cache-bypass";

    /**
     * Skip the cache read but store the fresh response.
     * Value: "true" or "false"
     */
    public static final String CACHE_REFRESH = "x-cache-refresh";

    /**
     * Overall deadline, as ISO-8601 duration (PT5S) or milliseconds.
     */
    public static final String REQUEST_TIMEOUT = "x-request-timeout";

    /**
     * Provider override.
     */
    public static final String PROVIDER = "x-provider";

    // ========== Response Headers ==========

    public static final String CACHE_HIT = "x-cache-hit";

    public static final String FINGERPRINT = "x-fingerprint";

    public static final String COST = "x-cost";

    public static final String ATTEMPTS = "x-attempts";

    private CacheHeaders() {
    }
}
