package com.intention.exception;

import java.time.Duration;

/**
 * Failure reported by a provider adapter, already classified.
 */
public class ProviderException extends IntentionException {

    private final String providerId;
    private final Integer statusCode;
    private final Duration retryAfter;

    public ProviderException(ErrorKind kind, String providerId, String message,
                             Integer statusCode, Duration retryAfter, Throwable cause) {
        super(kind, message, cause);
        if (kind != ErrorKind.PROVIDER_TRANSIENT
                && kind != ErrorKind.PROVIDER_RATE_LIMITED
                && kind != ErrorKind.PROVIDER_FATAL) {
            throw new IllegalArgumentException("Not a provider error kind: " + kind);
        }
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public static ProviderException transientFailure(String providerId, String message, Throwable cause) {
        return new ProviderException(ErrorKind.PROVIDER_TRANSIENT, providerId, message, null, null, cause);
    }

    public static ProviderException transientFailure(String providerId, String message, int statusCode) {
        return new ProviderException(ErrorKind.PROVIDER_TRANSIENT, providerId, message, statusCode, null, null);
    }

    public static ProviderException rateLimited(String providerId, String message, Duration retryAfter) {
        return new ProviderException(ErrorKind.PROVIDER_RATE_LIMITED, providerId, message, 429, retryAfter, null);
    }

    public static ProviderException fatal(String providerId, String message) {
        return new ProviderException(ErrorKind.PROVIDER_FATAL, providerId, message, null, null, null);
    }

    public static ProviderException fatal(String providerId, String message, int statusCode) {
        return new ProviderException(ErrorKind.PROVIDER_FATAL, providerId, message, statusCode, null, null);
    }

    public String getProviderId() {
        return providerId;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Provider-supplied hint for the next attempt, or {@code null} when absent.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isRetryable() {
        return getKind().isRetryable();
    }
}
