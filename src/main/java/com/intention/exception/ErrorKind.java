package com.intention.exception;

/**
 * Classification tag carried by every {@link IntentionException}.
 */
public enum ErrorKind {

    /**
     * Action did not match its template (missing field, wrong type, unknown template).
     */
    TEMPLATE_ERROR(false),

    /**
     * Network failure, timeout or 5xx from the provider.
     */
    PROVIDER_TRANSIENT(true),

    /**
     * Provider signalled that we are calling it too often.
     */
    PROVIDER_RATE_LIMITED(true),

    /**
     * Authentication failure or invalid request. Never retried.
     */
    PROVIDER_FATAL(false),

    /**
     * Dispatch refused because the scope has no budget left.
     */
    BUDGET_EXCEEDED(false),

    /**
     * Local rate limiter admission wait ran out.
     */
    RATE_LIMIT_TIMEOUT(false),

    /**
     * Provider kept returning output that did not satisfy the response schema.
     */
    REPAIR_FAILED(false),

    /**
     * Caller deadline elapsed while waiting for the result.
     */
    TIMEOUT(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
