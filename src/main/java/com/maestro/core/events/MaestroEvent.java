package com.maestro.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the pipeline runs, consumed by CLI watch output and metrics.
 *
 * @param eventType event type (e.g. "stage.started", "debate.round.completed", "checkpoint.created")
 * @param stageId   the stage this event relates to (nullable for pipeline-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record MaestroEvent(
    String eventType,
    String stageId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static MaestroEvent of(String eventType, String stageId, Map<String, Object> payload) {
        return new MaestroEvent(eventType, stageId, payload == null ? Map.of() : payload, Instant.now());
    }
}
