package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A recorded move of the current stage back to an earlier stage.
 */
public record LoopBack(
        String fromStage,
        String toStage,
        String reason,
        Instant at
) implements Serializable {}
