package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable metadata of a stored checkpoint, written once as {@code metadata.json}.
 *
 * @param id          stage id plus creation timestamp
 * @param stage       stage the checkpoint was taken in
 * @param createdAt   creation time
 * @param description optional free text; "milestone" marks stage-completion checkpoints
 * @param includes    path segments captured: "stages", "state", "config"
 */
public record Checkpoint(
        String id,
        String stage,
        Instant createdAt,
        String description,
        List<String> includes
) implements Serializable {

    public static final String MILESTONE_MARKER = "milestone";

    public Checkpoint {
        includes = includes == null ? List.of() : List.copyOf(includes);
    }

    public boolean milestone() {
        return description != null && description.contains(MILESTONE_MARKER);
    }

    public CheckpointRef toRef() {
        return new CheckpointRef(id, stage, createdAt, description);
    }
}
