package com.intention.coordinator;

/**
 * Stages of a dispatch after a cache miss.
 */
public enum DispatchState {
    LOOKUP,
    ADMITTING,
    DISPATCHING,
    STORING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
