package com.intention.exception;

import java.time.Duration;

/**
 * Local admission wait for a provider's token bucket ran out. The caller may retry later.
 */
public class RateLimitTimeoutException extends IntentionException {

    private final String providerId;
    private final Duration waited;

    public RateLimitTimeoutException(String providerId, Duration waited, String message) {
        super(ErrorKind.RATE_LIMIT_TIMEOUT, message);
        this.providerId = providerId;
        this.waited = waited;
    }

    public RateLimitTimeoutException(String providerId, Duration waited, String message, Throwable cause) {
        super(ErrorKind.RATE_LIMIT_TIMEOUT, message, cause);
        this.providerId = providerId;
        this.waited = waited;
    }

    public String getProviderId() {
        return providerId;
    }

    public Duration getWaited() {
        return waited;
    }
}
