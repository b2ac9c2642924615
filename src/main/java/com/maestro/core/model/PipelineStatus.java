package com.maestro.core.model;

/**
 * Lifecycle status of the pipeline as a whole.
 */
public enum PipelineStatus {
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED
}
