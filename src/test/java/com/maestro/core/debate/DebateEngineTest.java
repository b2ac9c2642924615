package com.maestro.core.debate;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.events.EventBus;
import com.maestro.core.events.MaestroEvent;
import com.maestro.core.exception.ConfigurationException;
import com.maestro.core.exception.StagePausedException;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.DebateSettings;
import com.maestro.core.model.ExecutionType;
import com.maestro.core.model.Intensity;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.PipelineSnapshot;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.PipelineStatus;
import com.maestro.core.model.Progress;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageDirective;
import com.maestro.core.model.StageOutcome;
import com.maestro.core.models.ModelTierResolver;
import com.maestro.core.state.InMemoryStateStore;
import com.maestro.core.state.JsonSupport;
import com.maestro.core.state.PauseSignal;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class DebateEngineTest {

    private static final PipelineDefinition COMPACT = PipelineDefinition.of("compact", Map.of());

    @TempDir
    Path root;

    private ExecutorService pool;
    private ScriptedAgent agent;
    private DebateEngine engine;
    private ProjectLayout layout;
    private InMemoryStateStore stateStore;
    private final List<MaestroEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(3);
        agent = new ScriptedAgent();
        layout = new ProjectLayout(root);
        stateStore = new InMemoryStateStore();
        var eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        var evaluator = new ContentionEvaluator(agent, JsonSupport.newMapper(), ScriptedAgent.SYNTHESIZER, 0.5);
        engine = new DebateEngine(agent, evaluator, new ModelTierResolver(COMPACT, List.of()),
                new DebateArtifactStore(layout), pool, eventBus, new MaestroMetrics(new SimpleMeterRegistry()),
                new PauseSignal(stateStore), ScriptedAgent.SYNTHESIZER, 20_000, root);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static StageDirective directive(Stage stage) {
        return new StageDirective(stage, "# Stage " + stage.id(), ModelTier.BALANCED, 0);
    }

    private void storeStatus(PipelineStatus status) {
        Instant at = Instant.parse("2025-06-01T09:00:00Z");
        stateStore.save(new PipelineSnapshot(PipelineState.initial("01-planning", at).withStatus(status, null),
                Progress.initial("todo-app", "compact", COMPACT.stageIds(), at)));
    }

    private static Stage planning(Intensity intensity) {
        return COMPACT.stage("01-planning").withIntensity(intensity);
    }

    @Nested
    @DisplayName("round structure")
    class Rounds {

        @Test
        @DisplayName("light intensity runs one round without contention scoring")
        void light() throws IOException {
            Stage stage = planning(Intensity.LIGHT);

            StageOutcome outcome = engine.run(directive(stage)).orElseThrow();

            assertEquals(1, outcome.rounds().size());
            assertEquals(0, agent.contentionCalls());
            assertEquals(2, agent.roundCalls(1).size());
            assertEquals(ExecutionType.DEBATE, outcome.type());
            String written = Files.readString(layout.outputsDir(stage.id()).resolve(stage.primaryOutput()));
            assertTrue(written.startsWith("# Final by Synthesizer"));
            assertTrue(written.contains("## Debate Notes"));
        }

        @Test
        @DisplayName("full intensity extends while contention is high and stops when it drops")
        void fullConverges() {
            agent.scores(0.9, 0.9, 0.1);

            StageOutcome outcome = engine.run(directive(planning(Intensity.FULL))).orElseThrow();

            assertEquals(3, outcome.rounds().size());
            assertEquals(List.of(0.9, 0.9, 0.1), outcome.scores());
            assertEquals(3, agent.roundCalls(2).size());
            assertTrue(agent.roundCalls(3).get(0).directive().contains("error handling strategy"));
        }

        @Test
        @DisplayName("full intensity always runs the minimum of two rounds")
        void minimumRounds() {
            agent.scores(0.0, 0.0);

            var outcome = engine.run(directive(planning(Intensity.FULL))).orElseThrow();

            assertEquals(2, outcome.rounds().size());
        }

        @Test
        @DisplayName("standard intensity may synthesize after round one")
        void standardEarlyStop() {
            agent.scores(0.2);

            var outcome = engine.run(directive(planning(Intensity.STANDARD))).orElseThrow();

            assertEquals(1, outcome.rounds().size());
        }

        @Test
        @DisplayName("the round count never exceeds the maximum")
        void maxRounds() {
            agent.scores(0.95, 0.95, 0.95, 0.95, 0.95, 0.95);

            var outcome = engine.run(directive(planning(Intensity.FULL))).orElseThrow();

            assertEquals(4, outcome.rounds().size());
            assertTrue(agent.roundCalls(5).isEmpty());
        }

        @Test
        @DisplayName("round files are written per role")
        void roundFiles() {
            agent.scores(0.0, 0.0);
            Stage stage = planning(Intensity.FULL);

            engine.run(directive(stage));

            Path round1 = layout.debateDir(stage.id()).resolve("round-1");
            assertTrue(Files.exists(round1.resolve("architect.md")));
            assertTrue(Files.exists(round1.resolve("risk-analyst.md")));
        }
    }

    @Nested
    @DisplayName("agent failures")
    class Failures {

        @Test
        @DisplayName("every round-one agent failing returns empty")
        void allFail() {
            agent.failWhen(r -> r.round() == 1 && !r.role().equals(ScriptedAgent.SYNTHESIZER));

            assertTrue(engine.run(directive(planning(Intensity.FULL))).isEmpty());
        }

        @Test
        @DisplayName("a failed role drops out of later rounds")
        void partialFailure() {
            agent.scores(0.9, 0.1).failWhen(r -> r.role().equals("Pragmatist"));

            var outcome = engine.run(directive(planning(Intensity.FULL))).orElseThrow();

            assertEquals(List.of("Pragmatist"), outcome.rounds().get(0).failedRoles());
            assertEquals(2, agent.roundCalls(2).size());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals("agent.failed")));
        }

        @Test
        @DisplayName("every round-two agent failing synthesizes from round one")
        void roundTwoFails() {
            agent.scores(0.9).failWhen(r -> r.round() == 2 && !r.role().equals(ScriptedAgent.SYNTHESIZER));

            var outcome = engine.run(directive(planning(Intensity.FULL))).orElseThrow();

            assertEquals(1, outcome.rounds().size());
            assertTrue(outcome.finalArtifact().startsWith("# Final by Synthesizer"));
        }

        @Test
        @DisplayName("synthesis falls back to the lead role, then to a merge")
        void synthesisFallback() {
            Stage stage = planning(Intensity.LIGHT);
            agent.failWhen(r -> r.round() == 0 && r.role().equals(ScriptedAgent.SYNTHESIZER));

            var lead = engine.run(directive(stage)).orElseThrow();
            assertTrue(lead.finalArtifact().startsWith("# Final by Architect"));

            agent.failWhen(r -> r.round() == 0);
            var merged = engine.run(directive(stage)).orElseThrow();
            assertTrue(merged.finalArtifact().contains("Merged without synthesis"));
            assertTrue(merged.finalArtifact().contains("## Debate Notes"));
        }
    }

    @Nested
    @DisplayName("pause")
    class Pause {

        @Test
        @DisplayName("a pause stored during round one stops before contention scoring and round two")
        void pauseDuringRoundOne() {
            storeStatus(PipelineStatus.RUNNING);
            agent.scores(0.9, 0.9).onInvoke(r -> {
                if (r.round() == 1) {
                    storeStatus(PipelineStatus.PAUSED);
                }
            });
            Stage stage = planning(Intensity.FULL);

            var e = assertThrows(StagePausedException.class, () -> engine.run(directive(stage)));

            assertEquals("01-planning", e.stageId());
            assertEquals(3, agent.roundCalls(1).size());
            assertTrue(agent.roundCalls(2).isEmpty());
            assertEquals(0, agent.contentionCalls());
            assertTrue(Files.exists(layout.debateDir(stage.id()).resolve("round-1").resolve("architect.md")));
            assertFalse(Files.exists(layout.outputsDir(stage.id()).resolve(stage.primaryOutput())));
        }

        @Test
        @DisplayName("a running pipeline status lets the debate finish")
        void running() {
            storeStatus(PipelineStatus.RUNNING);
            agent.scores(0.0, 0.0);

            var outcome = engine.run(directive(planning(Intensity.FULL))).orElseThrow();

            assertEquals(2, outcome.rounds().size());
        }
    }

    @Nested
    @DisplayName("settings")
    class Settings {

        @Test
        @DisplayName("light intensity with more than one round is rejected")
        void badLight() {
            Stage stage = planning(Intensity.LIGHT).withDebate(new DebateSettings(2, 1, 2));

            assertThrows(ConfigurationException.class, () -> engine.run(directive(stage)));
            assertTrue(agent.requests().isEmpty());
        }

        @Test
        @DisplayName("more agents than roles is rejected")
        void tooManyAgents() {
            Stage stage = planning(Intensity.FULL).withDebate(new DebateSettings(5, 2, 4));

            assertThrows(ConfigurationException.class, () -> DebateEngine.checkSettings(stage));
        }
    }
}
