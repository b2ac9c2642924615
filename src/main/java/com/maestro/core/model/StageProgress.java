package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Progress record for a single stage.
 */
public record StageProgress(
        StageStatus status,
        Instant startedAt,
        Instant completedAt,
        String checkpointId
) implements Serializable {

    public static StageProgress pending() {
        return new StageProgress(StageStatus.PENDING, null, null, null);
    }

    public StageProgress start(Instant now) {
        return new StageProgress(StageStatus.IN_PROGRESS, startedAt != null ? startedAt : now, null, checkpointId);
    }

    public StageProgress complete(Instant now) {
        return new StageProgress(StageStatus.COMPLETED, startedAt, now, checkpointId);
    }

    public StageProgress skip(Instant now) {
        return new StageProgress(StageStatus.SKIPPED, startedAt, now, checkpointId);
    }

    public StageProgress fail() {
        return new StageProgress(StageStatus.FAILED, startedAt, null, checkpointId);
    }

    public StageProgress withCheckpoint(String id) {
        return new StageProgress(status, startedAt, completedAt, id);
    }
}
