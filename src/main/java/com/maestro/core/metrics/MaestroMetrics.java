package com.maestro.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class MaestroMetrics {

    private final MeterRegistry registry;

    public MaestroMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stageId, String executionType, long ms) {
        Timer.builder("maestro.stage.duration")
                .tag("stage", stageId)
                .tag("type", executionType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDebateRounds(String stageId, int rounds) {
        DistributionSummary.builder("maestro.debate.rounds")
                .tag("stage", stageId)
                .register(registry)
                .record(rounds);
    }

    /**
     * Records the contention score of one evaluated round.
     *
     * @param score value in [0.0, 1.0]
     */
    public void recordContention(String stageId, double score) {
        DistributionSummary.builder("maestro.debate.contention")
                .description("Inter-agent disagreement per evaluated round")
                .tag("stage", stageId)
                .register(registry)
                .record(score);
    }

    public void recordStageRetry(String stageId, int attempt) {
        Counter.builder("maestro.stage.retries")
                .tag("stage", stageId)
                .tag("attempt", String.valueOf(attempt))
                .register(registry)
                .increment();
    }

    /**
     * Records checkpoint lifecycle operations.
     *
     * @param operation "create", "restore", "delete" or "cleanup"
     * @param success   whether the operation succeeded
     */
    public void recordCheckpointOperation(String operation, boolean success) {
        Counter.builder("maestro.checkpoint.operations")
                .description("Checkpoint lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordAgentInvocation(String tier, boolean success) {
        Counter.builder("maestro.agent.invocations")
                .tag("tier", tier)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}
