package com.intention.retry;

import com.intention.exception.IntentionException;

/**
 * Admission check run before every provider call, retries and repairs included.
 */
@FunctionalInterface
public interface AttemptGate {

    AttemptGate OPEN = attemptNumber -> { };

    /**
     * @param attemptNumber one-based number of the call about to be made
     * @throws IntentionException to stop the dispatch; the failure is terminal
     */
    void beforeAttempt(int attemptNumber);
}
