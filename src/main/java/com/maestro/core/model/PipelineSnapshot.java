package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Everything the state store persists for a project, read and written as one unit.
 */
public record PipelineSnapshot(PipelineState pipeline, Progress progress) implements Serializable {

    public PipelineSnapshot withPipeline(PipelineState state) {
        return new PipelineSnapshot(state, progress);
    }

    public PipelineSnapshot withProgress(Progress newProgress) {
        return new PipelineSnapshot(pipeline, newProgress);
    }

    /** Stamps both records with the time of the transition that produced them. */
    public PipelineSnapshot touched(Instant at) {
        return new PipelineSnapshot(pipeline.touched(at), progress.touched(at));
    }
}
