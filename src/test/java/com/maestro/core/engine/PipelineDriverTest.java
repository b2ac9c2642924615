package com.maestro.core.engine;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.debate.StageExecutor;
import com.maestro.core.exception.AgentInvocationException;
import com.maestro.core.exception.StagePausedException;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.ExecutionType;
import com.maestro.core.model.FinalizeResult;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.PipelineSnapshot;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.PipelineStatus;
import com.maestro.core.model.Progress;
import com.maestro.core.model.RetryState;
import com.maestro.core.model.StageDirective;
import com.maestro.core.model.StageOutcome;
import com.maestro.core.model.ValidationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PipelineDriverTest {

    private static final Instant STARTED = Instant.parse("2025-06-01T09:00:00Z");

    private static final PipelineDefinition COMPACT = PipelineDefinition.of("compact", Map.of());

    private final PipelineStateMachine stateMachine = mock(PipelineStateMachine.class);
    private final StageExecutor stageExecutor = mock(StageExecutor.class);
    private PipelineDriver driver;

    @BeforeEach
    void setUp() {
        driver = new PipelineDriver(stateMachine, stageExecutor, new MaestroMetrics(new SimpleMeterRegistry()));
        when(stateMachine.prepareStageExecution(anyString())).thenAnswer(inv -> new StageDirective(
                COMPACT.stage(inv.getArgument(0)), "directive", ModelTier.BALANCED, 0));
        when(stageExecutor.execute(any())).thenAnswer(inv -> outcome(((StageDirective) inv.getArgument(0)).stage().id()));
    }

    private static StageOutcome outcome(String stageId) {
        return new StageOutcome(stageId, ExecutionType.DEBATE, "x", List.of(), List.of(), 3, true, null);
    }

    private static PipelineSnapshot at(String stageId, PipelineStatus status) {
        return new PipelineSnapshot(PipelineState.initial(stageId, STARTED).withStatus(status, null),
                Progress.initial("p", "compact", COMPACT.stageIds(), STARTED));
    }

    private static FinalizeResult passed(String next) {
        return new FinalizeResult(true, ValidationResult.of("x", List.of()), next, next == null);
    }

    private static FinalizeResult failed(String message) {
        return new FinalizeResult(false, ValidationResult.failure("x", message), null, false);
    }

    private static RetryLadder.Decision decision(int attempt) {
        var previous = attempt == 1 ? null : new RetryState("01-planning", attempt - 1, List.of("f"), STARTED);
        return RetryLadder.onFailure(previous, "01-planning", List.of("f"), STARTED);
    }

    @Test
    @DisplayName("a stage that never validates is attempted exactly three times")
    void threeAttempts() {
        when(stateMachine.snapshot()).thenReturn(at("01-planning", PipelineStatus.RUNNING));
        when(stateMachine.finalizeStage(eq("01-planning"), any())).thenReturn(failed("Missing architecture.md"));
        when(stateMachine.recordFailedAttempt(eq("01-planning"), anyList()))
                .thenReturn(decision(1), decision(2), decision(3));

        assertFalse(driver.runStage("01-planning"));

        verify(stageExecutor, times(3)).execute(any());
        verify(stateMachine, times(3)).prepareStageExecution("01-planning");
        verify(stateMachine, times(3)).recordFailedAttempt("01-planning", List.of("Missing architecture.md"));
    }

    @Test
    @DisplayName("an agent failure counts as a failed attempt")
    void agentFailure() {
        when(stateMachine.snapshot()).thenReturn(at("01-planning", PipelineStatus.RUNNING));
        doThrow(new AgentInvocationException("agent exited with code 2"))
                .doReturn(outcome("01-planning"))
                .when(stageExecutor).execute(any());
        when(stateMachine.recordFailedAttempt(eq("01-planning"), anyList())).thenReturn(decision(1));
        when(stateMachine.finalizeStage(eq("01-planning"), any())).thenReturn(passed("02-ui-ux"));

        assertTrue(driver.runStage("01-planning"));

        verify(stateMachine).recordFailedAttempt("01-planning",
                List.of("Agent execution failed: agent exited with code 2"));
        verify(stateMachine, times(1)).recordExecution(any());
    }

    @Test
    @DisplayName("run drives stages until the pipeline completes")
    void runToCompletion() {
        when(stateMachine.snapshot()).thenReturn(
                at("01-planning", PipelineStatus.RUNNING),
                at("02-ui-ux", PipelineStatus.RUNNING),
                at(PipelineState.COMPLETE, PipelineStatus.COMPLETED));
        when(stateMachine.finalizeStage(anyString(), any())).thenReturn(passed("02-ui-ux"), passed(null));

        PipelineSnapshot end = driver.run(0);

        assertTrue(end.pipeline().isComplete());
        verify(stageExecutor, times(2)).execute(any());
    }

    @Test
    @DisplayName("run stops after the requested number of stages")
    void maxStages() {
        when(stateMachine.snapshot()).thenReturn(
                at("01-planning", PipelineStatus.RUNNING),
                at("02-ui-ux", PipelineStatus.RUNNING));
        when(stateMachine.finalizeStage(anyString(), any())).thenReturn(passed("02-ui-ux"));

        PipelineSnapshot end = driver.run(1);

        assertEquals("02-ui-ux", end.pipeline().currentStage());
        verify(stageExecutor, times(1)).execute(any());
    }

    @Test
    @DisplayName("a paused pipeline is not driven")
    void paused() {
        when(stateMachine.snapshot()).thenReturn(at("01-planning", PipelineStatus.PAUSED));

        driver.run(0);

        verifyNoInteractions(stageExecutor);
    }

    @Test
    @DisplayName("a pause stored during a retry stops before the next attempt")
    void pauseDuringRetry() {
        when(stateMachine.snapshot()).thenReturn(at("01-planning", PipelineStatus.PAUSED));
        when(stateMachine.finalizeStage(eq("01-planning"), any())).thenReturn(failed("missing"));
        when(stateMachine.recordFailedAttempt(eq("01-planning"), anyList())).thenReturn(decision(1));

        assertFalse(driver.runStage("01-planning"));

        verify(stageExecutor, times(1)).execute(any());
        verify(stateMachine, never()).pause(anyString());
    }

    @Test
    @DisplayName("a protocol stopped by a pause is neither finalized nor counted as a failed attempt")
    void pausedMidStage() {
        when(stateMachine.snapshot()).thenReturn(at("01-planning", PipelineStatus.RUNNING),
                at("01-planning", PipelineStatus.PAUSED));
        doThrow(new StagePausedException("01-planning", "debate round 1")).when(stageExecutor).execute(any());

        PipelineSnapshot end = driver.run(0);

        assertEquals(PipelineStatus.PAUSED, end.pipeline().status());
        verify(stateMachine, never()).recordExecution(any());
        verify(stateMachine, never()).finalizeStage(anyString(), any());
        verify(stateMachine, never()).recordFailedAttempt(anyString(), anyList());
    }
}
