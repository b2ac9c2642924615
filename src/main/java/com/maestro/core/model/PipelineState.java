package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;

/**
 * Singleton pipeline state for a project. Mutated only by the pipeline state machine.
 *
 * @param currentStage a valid stage id, or {@link #COMPLETE}
 * @param status       pipeline lifecycle status
 * @param retryState   retry bookkeeping for the current stage (nullable)
 * @param pauseReason  the unmet condition that paused the pipeline (nullable)
 * @param updatedAt    last transition time
 */
public record PipelineState(
        String currentStage,
        PipelineStatus status,
        RetryState retryState,
        String pauseReason,
        Instant updatedAt
) implements Serializable {

    /** Terminal stage marker once every stage is completed or skipped. */
    public static final String COMPLETE = "complete";

    public static PipelineState initial(String firstStage, Instant at) {
        return new PipelineState(firstStage, PipelineStatus.RUNNING, null, null, at);
    }

    @JsonIgnore
    public boolean isComplete() {
        return COMPLETE.equals(currentStage);
    }

    public PipelineState withStatus(PipelineStatus newStatus, String reason) {
        return new PipelineState(currentStage, newStatus, retryState, reason, updatedAt);
    }

    public PipelineState withCurrentStage(String stageId) {
        return new PipelineState(stageId, status, null, pauseReason, updatedAt);
    }

    public PipelineState withRetryState(RetryState retry) {
        return new PipelineState(currentStage, status, retry, pauseReason, updatedAt);
    }

    public PipelineState touched(Instant at) {
        return new PipelineState(currentStage, status, retryState, pauseReason, at);
    }
}
