package com.example.renderflow.util;

/**
 * Lifecycle of a render job, in pipeline order. {@code FAILED} is reachable from every
 * non-terminal state.
 */
public enum JobState {
    QUEUED,
    PREPARING,
    DOWNLOADING,
    ENCODING,
    FINALIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /** Claimed by a worker and not yet terminal. */
    public boolean isActive() {
        return !isTerminal() && this != QUEUED;
    }
}
