package com.intention.exception;

/**
 * Base exception for all classified failures surfaced by the coordinator.
 */
public class IntentionException extends RuntimeException {

    private final ErrorKind kind;

    public IntentionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IntentionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
