package com.intention.retry;

import lombok.Builder;
import lombok.Value;

/**
 * Attempt limits for one dispatch.
 */
@Value
@Builder
public class RetryPolicy {

    /**
     * Retries after transient or rate-limited failures; the first call is not counted.
     */
    int maxRetries;

    /**
     * Re-asks after malformed responses.
     */
    int maxRepairAttempts;

    public RetryPolicy(int maxRetries, int maxRepairAttempts) {
        if (maxRetries < 0 || maxRepairAttempts < 0) {
            throw new IllegalArgumentException("Retry limits must not be negative: maxRetries="
                    + maxRetries + ", maxRepairAttempts=" + maxRepairAttempts);
        }
        this.maxRetries = maxRetries;
        this.maxRepairAttempts = maxRepairAttempts;
    }
}
