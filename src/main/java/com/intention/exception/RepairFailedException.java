package com.intention.exception;

import java.util.List;

/**
 * The provider kept returning output that failed schema validation after every repair attempt.
 * The last raw response is attached for diagnostics.
 */
public class RepairFailedException extends IntentionException {

    private final String lastRawResponse;
    private final List<String> violations;

    public RepairFailedException(String message, String lastRawResponse, List<String> violations) {
        super(ErrorKind.REPAIR_FAILED, message);
        this.lastRawResponse = lastRawResponse;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public String getLastRawResponse() {
        return lastRawResponse;
    }

    public List<String> getViolations() {
        return violations;
    }
}
