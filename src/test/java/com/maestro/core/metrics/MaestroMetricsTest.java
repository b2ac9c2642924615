package com.maestro.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MaestroMetricsTest {

    private SimpleMeterRegistry registry;
    private MaestroMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MaestroMetrics(registry);
    }

    @Test
    @DisplayName("recordStageDuration creates a timer tagged by stage and type")
    void recordStageDuration() {
        metrics.recordStageDuration("03-planning", "debate", 1500);
        var timer = registry.find("maestro.stage.duration").tag("stage", "03-planning").tag("type", "debate").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordContention records the score distribution")
    void recordContention() {
        metrics.recordContention("01-brainstorm", 0.9);
        metrics.recordContention("01-brainstorm", 0.1);
        var summary = registry.find("maestro.debate.contention").tag("stage", "01-brainstorm").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(1.0, summary.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordCheckpointOperation counts by operation and outcome")
    void recordCheckpointOperation() {
        metrics.recordCheckpointOperation("create", true);
        metrics.recordCheckpointOperation("create", true);
        metrics.recordCheckpointOperation("restore", false);

        assertEquals(2.0, registry.find("maestro.checkpoint.operations")
                .tag("operation", "create").tag("success", "true").counter().count());
        assertEquals(1.0, registry.find("maestro.checkpoint.operations")
                .tag("operation", "restore").tag("success", "false").counter().count());
    }

    @Test
    @DisplayName("recordStageRetry and recordAgentInvocation increment counters")
    void counters() {
        metrics.recordStageRetry("06-implementation", 1);
        metrics.recordAgentInvocation("opus", false);
        assertNotNull(registry.find("maestro.stage.retries").tag("attempt", "1").counter());
        assertEquals(1.0, registry.find("maestro.agent.invocations").tag("tier", "opus").counter().count());
    }

    @Test
    @DisplayName("recordDebateRounds records a summary")
    void recordDebateRounds() {
        metrics.recordDebateRounds("01-brainstorm", 3);
        assertEquals(3.0, registry.find("maestro.debate.rounds").summary().totalAmount(), 1e-9);
    }
}
