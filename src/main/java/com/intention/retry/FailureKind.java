package com.intention.retry;

import com.intention.exception.ErrorKind;
import com.intention.exception.ProviderException;

/**
 * How the orchestrator reacts to a failed attempt.
 */
public enum FailureKind {

    /**
     * Network, timeout or 5xx. Retried with backoff.
     */
    TRANSIENT,

    /**
     * Provider asked us to slow down. Retried honoring its retry-after hint.
     */
    RATE_LIMITED,

    /**
     * Answer failed schema validation. Repaired, not retried.
     */
    MALFORMED_RESPONSE,

    /**
     * Never retried.
     */
    FATAL;

    public static FailureKind of(ProviderException e) {
        ErrorKind kind = e.getKind();
        if (kind == ErrorKind.PROVIDER_TRANSIENT) {
            return TRANSIENT;
        }
        if (kind == ErrorKind.PROVIDER_RATE_LIMITED) {
            return RATE_LIMITED;
        }
        return FATAL;
    }
}
