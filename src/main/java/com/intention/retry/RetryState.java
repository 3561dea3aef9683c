package com.intention.retry;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Progress of one dispatch through the retry loop. Confined to the dispatching thread.
 */
@Getter
@ToString
public class RetryState {

    /**
     * Provider calls started so far.
     */
    private int attemptNumber;

    /**
     * Retries spent on transient or rate-limited failures.
     */
    private int retries;

    /**
     * Re-asks spent on malformed responses.
     */
    private int repairs;

    private FailureKind lastErrorKind;

    private Duration nextBackoff;

    /**
     * Sum of the costs of every attempt that reached the provider and got an answer.
     */
    private BigDecimal accumulatedCost = BigDecimal.ZERO;

    void startAttempt() {
        attemptNumber++;
        nextBackoff = null;
    }

    void recordFailure(FailureKind kind) {
        lastErrorKind = kind;
    }

    void scheduleRetry(Duration delay) {
        retries++;
        nextBackoff = delay;
    }

    void scheduleRepair() {
        repairs++;
        nextBackoff = Duration.ZERO;
    }

    void addCost(BigDecimal cost) {
        if (cost != null) {
            accumulatedCost = accumulatedCost.add(cost);
        }
    }
}
