package com.maestro.core.engine;

import com.maestro.core.debate.StageExecutor;
import com.maestro.core.exception.AgentInvocationException;
import com.maestro.core.exception.StagePausedException;
import com.maestro.core.logging.MdcContext;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.FinalizeResult;
import com.maestro.core.model.PipelineSnapshot;
import com.maestro.core.model.PipelineStatus;
import com.maestro.core.model.StageDirective;
import com.maestro.core.model.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the pipeline one stage at a time until it completes or pauses.
 * <p>
 * Each stage is prepared, executed through its protocol, logged and finalized; validation
 * failures walk the retry ladder. Pause is cooperative: a paused status, written by this
 * process or by {@code maestro pause}, stops the stage protocol after its current round or step
 * and the driver before its next attempt.
 */
public class PipelineDriver {

    private static final Logger log = LoggerFactory.getLogger(PipelineDriver.class);

    private final PipelineStateMachine stateMachine;
    private final StageExecutor stageExecutor;
    private final MaestroMetrics metrics;

    public PipelineDriver(PipelineStateMachine stateMachine, StageExecutor stageExecutor, MaestroMetrics metrics) {
        this.stateMachine = stateMachine;
        this.stageExecutor = stageExecutor;
        this.metrics = metrics;
    }

    /**
     * Drives stages until the pipeline completes, pauses, or {@code maxStages} stages completed.
     *
     * @param maxStages stop after this many completed stages; 0 or less means no limit
     * @return the state the run ended in
     */
    public PipelineSnapshot run(int maxStages) {
        int completed = 0;
        while (true) {
            PipelineSnapshot snap = stateMachine.snapshot();
            if (snap.pipeline().isComplete() || snap.pipeline().status() == PipelineStatus.PAUSED) {
                return snap;
            }
            if (maxStages > 0 && completed >= maxStages) {
                return snap;
            }
            if (!runStage(snap.pipeline().currentStage())) {
                return stateMachine.snapshot();
            }
            completed++;
        }
    }

    /**
     * Runs one stage through the retry ladder.
     *
     * @return true when the stage completed
     */
    public boolean runStage(String stageId) {
        MdcContext.setStage(stageId);
        long startNanos = System.nanoTime();
        try {
            while (true) {
                StageDirective directive = stateMachine.prepareStageExecution(stageId);
                List<String> failures;
                try {
                    StageOutcome outcome = stageExecutor.execute(directive);
                    stateMachine.recordExecution(outcome);
                    FinalizeResult result = stateMachine.finalizeStage(stageId, outcome);
                    if (result.success()) {
                        metrics.recordStageDuration(stageId, outcome.type().name().toLowerCase(),
                                (System.nanoTime() - startNanos) / 1_000_000);
                        return true;
                    }
                    failures = result.validation().failedChecks();
                } catch (StagePausedException e) {
                    log.info("{}; stage stays in progress and reruns on resume", e.getMessage());
                    return false;
                } catch (AgentInvocationException e) {
                    log.warn("Stage {} produced no artifact: {}", stageId, e.getMessage());
                    failures = List.of("Agent execution failed: " + e.getMessage());
                }

                RetryLadder.Decision decision = stateMachine.recordFailedAttempt(stageId, failures);
                if (decision.paused()) {
                    return false;
                }
                if (stateMachine.snapshot().pipeline().status() == PipelineStatus.PAUSED) {
                    return false;
                }
            }
        } finally {
            MdcContext.clear();
        }
    }
}
