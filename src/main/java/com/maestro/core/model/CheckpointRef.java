package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Lightweight reference to a checkpoint, recorded in {@link Progress}.
 */
public record CheckpointRef(
        String id,
        String stage,
        Instant createdAt,
        String description
) implements Serializable {}
