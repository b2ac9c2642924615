package com.maestro.core.handoff;

import com.maestro.core.model.Stage;
import com.maestro.core.model.StageOutcome;

import java.nio.file.Path;

/**
 * Writes the summary handed from a finished stage to the next one.
 */
public interface HandoffGenerator {

    /**
     * @param stage     the completed stage
     * @param outcome   how the stage was executed (nullable when unknown)
     * @param nextStage the next stage, or null at the end of the pipeline
     * @return the written handoff file, or null when no handoff could be produced
     */
    Path generate(Stage stage, StageOutcome outcome, Stage nextStage);

    /** Minimal handoff for a skipped stage, noting the omission. */
    Path generateSkipped(Stage stage, Stage nextStage, String reason);
}
