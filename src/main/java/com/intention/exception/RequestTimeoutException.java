package com.intention.exception;

import java.time.Duration;

/**
 * Caller's overall deadline elapsed before a result was published.
 * The in-flight dispatch, if any, keeps running and still caches its result.
 */
public class RequestTimeoutException extends IntentionException {

    private final Duration timeout;

    public RequestTimeoutException(String message, Duration timeout) {
        super(ErrorKind.TIMEOUT, message);
        this.timeout = timeout;
    }

    public RequestTimeoutException(String message, Duration timeout, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
