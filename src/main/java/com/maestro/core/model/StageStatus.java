package com.maestro.core.model;

/**
 * Per-stage progress status.
 */
public enum StageStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    SKIPPED,
    FAILED;   // retry ladder exhausted, pipeline paused

    /** Completed or explicitly skipped. Satisfies prerequisites. */
    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED;
    }
}
