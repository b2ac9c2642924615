package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Append-only audit entry proving that a stage was executed through a protocol.
 *
 * @param stage      stage id
 * @param type       debate, sequential or single-agent fallback
 * @param rounds     debate rounds or sequential steps executed
 * @param agentCount agents that produced at least one artifact
 * @param scores     contention score per evaluated round
 * @param timestamp  when the execution finished
 */
public record ExecutionEvent(
        String stage,
        ExecutionType type,
        int rounds,
        int agentCount,
        List<Double> scores,
        Instant timestamp
) implements Serializable {

    public ExecutionEvent {
        scores = scores == null ? List.of() : List.copyOf(scores);
    }
}
