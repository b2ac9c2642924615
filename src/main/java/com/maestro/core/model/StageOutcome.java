package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Result of executing one stage's protocol, before validation.
 *
 * @param stageId      executed stage
 * @param type         protocol actually used
 * @param finalArtifact synthesized (debate) or last-step (sequential) output
 * @param rounds       debate rounds, empty for sequential stages
 * @param stepOutputs  sequential step outputs in order, empty for debate stages
 * @param agentCount   agents that produced output
 * @param gatePassed   build/test gate verdict for code-producing sequential stages (true otherwise)
 * @param gateFailure  why the build/test gate failed (nullable)
 */
public record StageOutcome(
        String stageId,
        ExecutionType type,
        String finalArtifact,
        List<DebateRound> rounds,
        List<String> stepOutputs,
        int agentCount,
        boolean gatePassed,
        String gateFailure
) implements Serializable {

    public StageOutcome {
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
        stepOutputs = stepOutputs == null ? List.of() : List.copyOf(stepOutputs);
    }

    public List<Double> scores() {
        return rounds.stream()
                .filter(r -> r.contention() != null)
                .map(r -> r.contention().score())
                .toList();
    }

    public ExecutionEvent toEvent(Instant at) {
        int count = type == ExecutionType.SEQUENTIAL ? stepOutputs.size() : Math.max(1, rounds.size());
        return new ExecutionEvent(stageId, type, count, agentCount, scores(), at);
    }
}
