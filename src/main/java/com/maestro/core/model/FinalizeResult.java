package com.maestro.core.model;

import java.io.Serializable;

/**
 * Outcome of finalizing a stage.
 *
 * @param success          validation passed and the stage is completed
 * @param validation       the validator's verdict
 * @param nextStage        next stage id, or null when the pipeline completed or on failure
 * @param pipelineComplete true when every stage is now completed or skipped
 */
public record FinalizeResult(
        boolean success,
        ValidationResult validation,
        String nextStage,
        boolean pipelineComplete
) implements Serializable {}
