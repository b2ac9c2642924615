package com.maestro.core.engine;

import com.maestro.core.checkpoint.CheckpointManager;
import com.maestro.core.checkpoint.CheckpointOptions;
import com.maestro.core.checkpoint.RestoreOptions;
import com.maestro.core.config.MaestroProperties;
import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.events.EventBus;
import com.maestro.core.events.MaestroEvent;
import com.maestro.core.exception.CheckpointException;
import com.maestro.core.exception.ConfigurationException;
import com.maestro.core.exception.PipelineStateException;
import com.maestro.core.exception.StateStoreException;
import com.maestro.core.handoff.HandoffGenerator;
import com.maestro.core.metrics.MaestroMetrics;
import com.maestro.core.model.Checkpoint;
import com.maestro.core.model.CheckpointRef;
import com.maestro.core.model.FinalizeResult;
import com.maestro.core.model.IterationCounters;
import com.maestro.core.model.LoopBack;
import com.maestro.core.model.PipelineSnapshot;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.PipelineStatus;
import com.maestro.core.model.Progress;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageDirective;
import com.maestro.core.model.StageOutcome;
import com.maestro.core.model.StageProgress;
import com.maestro.core.model.StageStatus;
import com.maestro.core.model.ValidationCheck;
import com.maestro.core.model.ValidationResult;
import com.maestro.core.models.ModelTierResolver;
import com.maestro.core.state.ExecutionLog;
import com.maestro.core.state.StateStore;
import com.maestro.core.validation.OutputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owns every transition of {@link PipelineState} and {@link Progress}.
 * <p>
 * A stage moves {@code pending -> in_progress -> completed | skipped | failed}. Entering
 * {@code in_progress} requires every prerequisite to be settled; leaving it for
 * {@code completed} requires the validator to pass and a handoff to be written. Three failed
 * validations fail the stage and pause the pipeline. All public operations are serialized so
 * checkpoint create and restore never interleave with advancement.
 */
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final PipelineDefinition pipeline;
    private final ProjectLayout layout;
    private final StateStore store;
    private final ExecutionLog executionLog;
    private final StageDirectiveBuilder directiveBuilder;
    private final ModelTierResolver tierResolver;
    private final OutputValidator validator;
    private final HandoffGenerator handoffGenerator;
    private final CheckpointManager checkpointManager;
    private final MaestroProperties properties;
    private final EventBus eventBus;
    private final MaestroMetrics metrics;
    private final Clock clock;

    public PipelineStateMachine(PipelineDefinition pipeline,
                                ProjectLayout layout,
                                StateStore store,
                                ExecutionLog executionLog,
                                StageDirectiveBuilder directiveBuilder,
                                ModelTierResolver tierResolver,
                                OutputValidator validator,
                                HandoffGenerator handoffGenerator,
                                CheckpointManager checkpointManager,
                                MaestroProperties properties,
                                EventBus eventBus,
                                MaestroMetrics metrics,
                                Clock clock) {
        this.pipeline = pipeline;
        this.layout = layout;
        this.store = store;
        this.executionLog = executionLog;
        this.directiveBuilder = directiveBuilder;
        this.tierResolver = tierResolver;
        this.validator = validator;
        this.handoffGenerator = handoffGenerator;
        this.checkpointManager = checkpointManager;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ---- lifecycle ----

    /**
     * Creates the stage directories and a fresh pipeline state positioned at the first stage.
     *
     * @param force overwrite an existing state
     * @throws PipelineStateException when the project is already initialized and {@code force} is false
     */
    public synchronized PipelineSnapshot initialize(boolean force) {
        if (store.isInitialized() && !force) {
            throw new PipelineStateException("Project already initialized at " + layout.root()
                    + ". Use --force to start over");
        }
        try {
            for (Stage stage : pipeline.stages()) {
                Files.createDirectories(layout.outputsDir(stage.id()));
            }
            Files.createDirectories(layout.stateDir());
        } catch (IOException e) {
            throw new PipelineStateException("Failed to create project directories: " + e.getMessage(), e);
        }
        Instant now = clock.instant();
        var snapshot = new PipelineSnapshot(
                PipelineState.initial(pipeline.first().id(), now),
                Progress.initial(properties.resolvedProjectName(), pipeline.version(), pipeline.stageIds(), now));
        store.save(snapshot);
        log.info("Initialized {} pipeline ({} stages) for {}", pipeline.version(),
                pipeline.stages().size(), snapshot.progress().projectName());
        eventBus.publish(MaestroEvent.of("pipeline.initialized", null,
                Map.of("version", pipeline.version(), "stages", pipeline.stages().size())));
        return snapshot;
    }

    /**
     * @throws PipelineStateException when the project has not been initialized
     */
    public PipelineSnapshot snapshot() {
        return store.load().orElseThrow(() -> new PipelineStateException(
                "Project not initialized at " + layout.root() + ". Run 'maestro init' first"));
    }

    public PipelineDefinition pipeline() {
        return pipeline;
    }

    // ---- stage execution ----

    /**
     * Marks the current stage {@code in_progress} and assembles its directive, amended for the
     * next attempt when earlier attempts failed validation. Invokes no agent.
     *
     * @throws PipelineStateException when the pipeline is paused or complete, or the stage is not current
     * @throws ConfigurationException when a prerequisite is not settled; the pipeline is paused first
     */
    public synchronized StageDirective prepareStageExecution(String stageId) {
        PipelineSnapshot snap = snapshot();
        PipelineState state = snap.pipeline();
        if (state.isComplete()) {
            throw new PipelineStateException("Pipeline is already complete");
        }
        if (state.status() == PipelineStatus.PAUSED) {
            throw new PipelineStateException("Pipeline is paused at " + state.currentStage()
                    + (state.pauseReason() != null ? ": " + state.pauseReason() : "") + ". Resume it first");
        }
        Stage stage = pipeline.stage(stageId);
        if (!stageId.equals(state.currentStage())) {
            throw new PipelineStateException("Stage " + stageId + " is not the current stage ("
                    + state.currentStage() + ")");
        }
        StageStatus status = snap.progress().stage(stageId).status();
        if (status.isSettled()) {
            throw new PipelineStateException("Stage " + stageId + " is already " + status.name().toLowerCase());
        }

        List<String> unmet = stage.prerequisites().stream()
                .filter(p -> !snap.progress().stage(p).status().isSettled())
                .toList();
        if (!unmet.isEmpty()) {
            String reason = "Stage " + stageId + " requires " + String.join(", ", unmet)
                    + " to be completed or skipped";
            pause(reason);
            throw new ConfigurationException(reason);
        }

        Instant now = clock.instant();
        PipelineSnapshot updated = transition(s -> s
                .withProgress(s.progress().withStage(stageId, s.progress().stage(stageId).start(now)))
                .withPipeline(s.pipeline().withStatus(PipelineStatus.RUNNING, null)));

        StageDirective directive = directiveBuilder.build(stage, tierResolver.personaTier(stageId));
        var retry = updated.pipeline().retryState();
        if (retry != null && stageId.equals(retry.stageId()) && retry.attempt() > 0) {
            String amended = RetryLadder.amend(directive.text(), retry, validator.describeRequirements(stage));
            directive = directive.withText(amended, retry.attempt());
            log.info("Retrying stage {} (attempt {} of {})", stageId, retry.attempt() + 1, RetryLadder.MAX_ATTEMPTS);
        }
        eventBus.publish(MaestroEvent.of("stage.started", stageId,
                Map.of("attempt", directive.attempt() + 1, "model", directive.modelTier().roleName())));
        return directive;
    }

    /** Appends the protocol actually used to the execution log. */
    public void recordExecution(StageOutcome outcome) {
        executionLog.append(outcome.toEvent(clock.instant()));
    }

    /**
     * Validates the stage's outputs. On success writes the handoff, marks the stage completed and
     * advances; on failure nothing changes.
     *
     * @param outcome how the stage was executed (nullable when finalizing work done outside the driver)
     * @throws PipelineStateException when the stage is not in progress
     */
    public synchronized FinalizeResult finalizeStage(String stageId, StageOutcome outcome) {
        PipelineSnapshot snap = snapshot();
        Stage stage = pipeline.stage(stageId);
        StageStatus status = snap.progress().stage(stageId).status();
        if (status != StageStatus.IN_PROGRESS) {
            throw new PipelineStateException("Stage " + stageId + " is " + status.name().toLowerCase()
                    + ", not in progress");
        }

        ValidationResult validation = withGate(validator.validate(stage), outcome);
        if (!validation.requiredChecksPassed()) {
            log.warn("Stage {} failed validation: {}", stageId, validation.failedChecks());
            return new FinalizeResult(false, validation, null, false);
        }

        Stage next = pipeline.next(stageId).orElse(null);
        Path handoff = handoffGenerator.generate(stage, outcome, next);
        if (handoff == null) {
            var checks = new ArrayList<>(validation.checks());
            checks.add(ValidationCheck.required("Handoff", false, "Handoff summary could not be written"));
            return new FinalizeResult(false, ValidationResult.of(stageId, checks), null, false);
        }

        Instant now = clock.instant();
        PipelineSnapshot updated = transition(s -> {
            Progress progress = s.progress().withStage(stageId, s.progress().stage(stageId).complete(now));
            String nextId = next != null ? next.id() : PipelineState.COMPLETE;
            PipelineState state = s.pipeline().withCurrentStage(nextId);
            if (next == null) {
                state = state.withStatus(PipelineStatus.COMPLETED, null);
            }
            return new PipelineSnapshot(state, progress);
        });
        boolean complete = updated.pipeline().status() == PipelineStatus.COMPLETED;
        log.info("Stage {} completed{}", stageId, complete ? "; pipeline complete" : ", next " + next.id());
        eventBus.publish(MaestroEvent.of("stage.completed", stageId,
                Map.of("score", validation.score(), "next", next != null ? next.id() : PipelineState.COMPLETE)));

        if (properties.getCheckpoint().isAutoCheckpointOnComplete()) {
            milestoneCheckpoint(stageId);
        }
        if (complete) {
            List<String> missing = complianceReport();
            if (!missing.isEmpty()) {
                log.warn("Pipeline completed but stages never recorded an execution: {}", missing);
                eventBus.publish(MaestroEvent.of("compliance.violation", null, Map.of("stages", missing)));
            }
            eventBus.publish(MaestroEvent.of("pipeline.completed", null, Map.of("compliant", missing.isEmpty())));
        }
        return new FinalizeResult(true, validation, next != null ? next.id() : null, complete);
    }

    /**
     * Records one failed attempt of the current stage. The third failure fails the stage and
     * pauses the pipeline with the failures as the reason.
     */
    public synchronized RetryLadder.Decision recordFailedAttempt(String stageId, List<String> failures) {
        pipeline.stage(stageId);
        Instant now = clock.instant();
        var decision = new AtomicReference<RetryLadder.Decision>();
        transition(s -> {
            RetryLadder.Decision d = RetryLadder.onFailure(s.pipeline().retryState(), stageId, failures, now);
            decision.set(d);
            PipelineState state = s.pipeline().withRetryState(d.retry());
            Progress progress = s.progress();
            if (d.paused()) {
                progress = progress.withStage(stageId, progress.stage(stageId).fail());
                state = state.withStatus(PipelineStatus.PAUSED, "Stage " + stageId + " failed validation "
                        + RetryLadder.MAX_ATTEMPTS + " times: " + String.join("; ", failures));
            }
            return new PipelineSnapshot(state, progress);
        });
        RetryLadder.Decision d = decision.get();
        metrics.recordStageRetry(stageId, d.retry().attempt());
        if (d.paused()) {
            log.error("Stage {} failed after {} attempts; pipeline paused", stageId, RetryLadder.MAX_ATTEMPTS);
            eventBus.publish(MaestroEvent.of("stage.failed", stageId, Map.of("failures", failures)));
            eventBus.publish(MaestroEvent.of("pipeline.paused", stageId,
                    Map.of("reason", "validation failed " + RetryLadder.MAX_ATTEMPTS + " times")));
        } else {
            log.warn("Stage {} attempt {} failed validation; next: {}", stageId, d.retry().attempt(), d.action());
            eventBus.publish(MaestroEvent.of("stage.retry", stageId,
                    Map.of("attempt", d.retry().attempt(), "action", d.action().name())));
        }
        return d;
    }

    // ---- user-triggered transitions ----

    /**
     * @param reason the unmet condition or user request, reported by status
     */
    public synchronized PipelineSnapshot pause(String reason) {
        PipelineSnapshot snap = snapshot();
        if (snap.pipeline().isComplete()) {
            throw new PipelineStateException("Pipeline is already complete");
        }
        PipelineSnapshot updated = transition(s -> s.withPipeline(
                s.pipeline().withStatus(PipelineStatus.PAUSED, reason)));
        log.info("Pipeline paused at {}: {}", updated.pipeline().currentStage(), reason);
        eventBus.publish(MaestroEvent.of("pipeline.paused", updated.pipeline().currentStage(),
                Map.of("reason", reason != null ? reason : "")));
        return updated;
    }

    /**
     * Resumes a paused pipeline. A failed stage goes back to pending with its retry budget reset.
     */
    public synchronized PipelineSnapshot resume() {
        PipelineSnapshot snap = snapshot();
        if (snap.pipeline().isComplete()) {
            throw new PipelineStateException("Pipeline is already complete");
        }
        String current = snap.pipeline().currentStage();
        PipelineSnapshot updated = transition(s -> {
            Progress progress = s.progress();
            StageProgress sp = progress.stage(current);
            if (sp.status() == StageStatus.FAILED) {
                progress = progress.withStage(current,
                        new StageProgress(StageStatus.PENDING, sp.startedAt(), null, sp.checkpointId()));
            }
            PipelineState state = s.pipeline().withRetryState(null).withStatus(PipelineStatus.RUNNING, null);
            return new PipelineSnapshot(state, progress);
        });
        log.info("Pipeline resumed at {}", current);
        eventBus.publish(MaestroEvent.of("pipeline.resumed", current, Map.of()));
        return updated;
    }

    /**
     * Skips the current stage regardless of its outputs, writing a handoff that notes the omission.
     *
     * @return the next stage id, or {@link PipelineState#COMPLETE}
     */
    public synchronized String skipStage(String stageId, String reason) {
        PipelineSnapshot snap = snapshot();
        Stage stage = pipeline.stage(stageId);
        StageStatus status = snap.progress().stage(stageId).status();
        if (status.isSettled()) {
            throw new PipelineStateException("Stage " + stageId + " is already " + status.name().toLowerCase());
        }
        if (!stageId.equals(snap.pipeline().currentStage())) {
            throw new PipelineStateException("Only the current stage (" + snap.pipeline().currentStage()
                    + ") can be skipped");
        }
        Stage next = pipeline.next(stageId).orElse(null);
        String why = reason == null || reason.isBlank() ? "Skipped by user" : reason;
        if (handoffGenerator.generateSkipped(stage, next, why) == null) {
            log.warn("No handoff written for skipped stage {}", stageId);
        }
        Instant now = clock.instant();
        String nextId = next != null ? next.id() : PipelineState.COMPLETE;
        transition(s -> {
            Progress progress = s.progress().withStage(stageId, s.progress().stage(stageId).skip(now));
            PipelineState state = s.pipeline().withCurrentStage(nextId);
            state = next == null
                    ? state.withStatus(PipelineStatus.COMPLETED, null)
                    : state.withStatus(state.status() == PipelineStatus.PAUSED ? PipelineStatus.PAUSED : PipelineStatus.RUNNING,
                            state.pauseReason());
            return new PipelineSnapshot(state, progress);
        });
        log.info("Skipped stage {} ({}); current stage is now {}", stageId, why, nextId);
        eventBus.publish(MaestroEvent.of("stage.skipped", stageId, Map.of("reason", why, "next", nextId)));
        return nextId;
    }

    /**
     * Loops back to an earlier stage. The target and every later stage return to pending, and the
     * move is recorded in the loop-back history.
     */
    public synchronized PipelineSnapshot gotoStage(String targetId, String reason) {
        PipelineSnapshot snap = snapshot();
        pipeline.stage(targetId);
        String current = snap.pipeline().currentStage();
        int target = pipeline.indexOf(targetId);
        int from = snap.pipeline().isComplete() ? pipeline.stages().size() : pipeline.indexOf(current);
        if (target >= from) {
            throw new PipelineStateException("Can only go back to an earlier stage; " + targetId
                    + " is not before " + current);
        }
        var loopBack = new LoopBack(current, targetId, reason, clock.instant());
        PipelineSnapshot updated = transition(s -> {
            Progress progress = s.progress();
            for (Stage stage : pipeline.stages().subList(target, pipeline.stages().size())) {
                StageProgress sp = progress.stage(stage.id());
                progress = progress.withStage(stage.id(),
                        new StageProgress(StageStatus.PENDING, null, null, sp.checkpointId()));
            }
            progress = progress.withLoopBack(loopBack);
            PipelineState state = s.pipeline().withCurrentStage(targetId).withStatus(PipelineStatus.RUNNING, null);
            return new PipelineSnapshot(state, progress);
        });
        log.info("Looped back from {} to {}: {}", current, targetId, reason);
        eventBus.publish(MaestroEvent.of("pipeline.loopback", targetId,
                Map.of("from", current, "reason", reason != null ? reason : "")));
        return updated;
    }

    public synchronized IterationCounters advanceSprint() {
        IterationCounters counters = snapshot().progress().iteration();
        if (!counters.hasNextSprint()) {
            throw new PipelineStateException("Already at the last sprint (" + counters.currentSprint()
                    + " of " + counters.totalSprints() + ")");
        }
        return transition(s -> s.withProgress(s.progress().withIteration(counters.nextSprint())))
                .progress().iteration();
    }

    public synchronized IterationCounters advanceCycle() {
        IterationCounters counters = snapshot().progress().iteration();
        if (!counters.hasNextCycle()) {
            throw new PipelineStateException("Already at the last cycle (" + counters.currentCycle()
                    + " of " + counters.totalCycles() + ")");
        }
        return transition(s -> s.withProgress(s.progress().withIteration(counters.nextCycle())))
                .progress().iteration();
    }

    // ---- checkpoints ----

    /**
     * Snapshots the project trees and records a reference in progress.
     */
    public synchronized Checkpoint createCheckpoint(String description) {
        PipelineSnapshot snap = snapshot();
        String stageId = snap.pipeline().isComplete()
                ? pipeline.stages().get(pipeline.stages().size() - 1).id()
                : snap.pipeline().currentStage();
        return createCheckpoint(stageId, description);
    }

    private CheckpointOptions checkpointOptions() {
        return CheckpointOptions.defaults().withConfig(properties.getCheckpoint().isIncludeConfig());
    }

    private Checkpoint createCheckpoint(String stageId, String description) {
        var options = checkpointOptions();
        Checkpoint checkpoint;
        try {
            checkpoint = checkpointManager.create(stageId, description, options);
        } catch (CheckpointException e) {
            metrics.recordCheckpointOperation("create", false);
            throw e;
        }
        metrics.recordCheckpointOperation("create", true);
        transition(s -> {
            Progress progress = s.progress().withCheckpoint(checkpoint.toRef());
            progress = progress.withStage(stageId, progress.stage(stageId).withCheckpoint(checkpoint.id()));
            return s.withProgress(progress);
        });
        eventBus.publish(MaestroEvent.of("checkpoint.created", stageId, Map.of("id", checkpoint.id())));
        return checkpoint;
    }

    /**
     * Restores a checkpoint. Rejected while a stage is in progress. A full restore first takes a
     * safety checkpoint; restore is not transactional and on failure the safety checkpoint id is
     * reported so the user can restore it. Missing or corrupt state files do not block a restore.
     *
     * @throws PipelineStateException when a stage is in progress
     * @throws CheckpointException    when the checkpoint is missing or copying fails
     */
    public synchronized Checkpoint restoreCheckpoint(String checkpointId, RestoreOptions options) {
        Optional<PipelineSnapshot> current = readableState();
        List<String> running = current.map(snap -> snap.progress().stages().entrySet().stream()
                        .filter(e -> e.getValue().status() == StageStatus.IN_PROGRESS)
                        .map(Map.Entry::getKey)
                        .toList())
                .orElse(List.of());
        if (!running.isEmpty()) {
            throw new PipelineStateException("Cannot restore while stage " + String.join(", ", running)
                    + " is in progress. Pause and wait for it to finish first");
        }
        Checkpoint target = checkpointManager.get(checkpointId).orElse(null);
        if (target == null) {
            metrics.recordCheckpointOperation("restore", false);
            throw new CheckpointException("Checkpoint not found: " + checkpointId);
        }
        String safetyId = null;
        if (!options.isPartial()) {
            String description = "pre-restore safety copy before " + checkpointId;
            // without readable state the copy is not recorded in progress; reconciliation picks it up from disk
            safetyId = current.isPresent()
                    ? createCheckpoint(description).id()
                    : checkpointManager.create(target.stage(), description, checkpointOptions()).id();
        }
        Checkpoint restored;
        try {
            restored = checkpointManager.restore(checkpointId, options);
        } catch (CheckpointException e) {
            metrics.recordCheckpointOperation("restore", false);
            if (safetyId != null) {
                throw new CheckpointException(e.getMessage() + ". Project state may be inconsistent; restore "
                        + safetyId + " to return to the state before this restore", e);
            }
            throw e;
        }
        metrics.recordCheckpointOperation("restore", true);
        if (options.touchesState() && readableState().isPresent()) {
            reconcileAfterRestore();
        }
        log.info("Restored checkpoint {}{}", checkpointId, safetyId != null ? " (safety copy " + safetyId + ")" : "");
        eventBus.publish(MaestroEvent.of("checkpoint.restored", restored.stage(),
                Map.of("id", checkpointId, "partial", options.isPartial())));
        return restored;
    }

    /**
     * Stored state, or empty when it is missing or cannot be parsed. Restore must work in both cases.
     */
    private Optional<PipelineSnapshot> readableState() {
        try {
            return store.load();
        } catch (StateStoreException e) {
            log.warn("Pipeline state is unreadable, restoring without it: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Restored progress carries the checkpoint list of its own time. Rebuilds it from disk and
     * returns any stage captured mid-run to pending.
     */
    private void reconcileAfterRestore() {
        List<CheckpointRef> refs = new ArrayList<>(checkpointManager.list().stream().map(Checkpoint::toRef).toList());
        Collections.reverse(refs);
        transition(s -> {
            var stages = new LinkedHashMap<String, StageProgress>(s.progress().stages());
            stages.replaceAll((id, sp) -> sp.status() == StageStatus.IN_PROGRESS
                    ? new StageProgress(StageStatus.PENDING, sp.startedAt(), null, sp.checkpointId())
                    : sp);
            Progress p = s.progress();
            return s.withProgress(new Progress(p.projectName(), p.pipelineVersion(), p.startedAt(), clock.instant(),
                    stages, p.iteration(), refs, p.loopBacks()));
        });
    }

    public synchronized boolean deleteCheckpoint(String checkpointId) {
        boolean deleted;
        try {
            deleted = checkpointManager.delete(checkpointId);
        } catch (CheckpointException e) {
            metrics.recordCheckpointOperation("delete", false);
            throw e;
        }
        metrics.recordCheckpointOperation("delete", deleted);
        if (deleted && store.isInitialized()) {
            transition(s -> s.withProgress(s.progress().withoutCheckpoint(checkpointId)));
            eventBus.publish(MaestroEvent.of("checkpoint.deleted", null, Map.of("id", checkpointId)));
        }
        return deleted;
    }

    /**
     * Applies the configured retention policy.
     *
     * @return ids of the deleted checkpoints, oldest first
     */
    public synchronized List<String> cleanupCheckpoints() {
        var settings = properties.getCheckpoint();
        List<String> deleted = checkpointManager.cleanup(settings.getMaxRetention(), settings.isPreserveMilestones());
        metrics.recordCheckpointOperation("cleanup", true);
        if (!deleted.isEmpty() && store.isInitialized()) {
            transition(s -> {
                Progress p = s.progress();
                for (String id : deleted) {
                    p = p.withoutCheckpoint(id);
                }
                return s.withProgress(p);
            });
        }
        return deleted;
    }

    public List<Checkpoint> listCheckpoints() {
        return checkpointManager.list();
    }

    // ---- compliance ----

    /**
     * Completed stages that never recorded an execution event, in pipeline order. Skipped stages
     * are exempt.
     */
    public List<String> complianceReport() {
        Progress progress = snapshot().progress();
        List<String> completed = pipeline.stageIds().stream()
                .filter(id -> progress.stage(id).status() == StageStatus.COMPLETED)
                .toList();
        return executionLog.missingStages(completed);
    }

    private void milestoneCheckpoint(String stageId) {
        try {
            createCheckpoint(stageId, "Stage " + stageId + " completed (" + Checkpoint.MILESTONE_MARKER + ")");
            List<String> removed = cleanupCheckpoints();
            if (!removed.isEmpty()) {
                log.info("Retention removed {} checkpoint(s)", removed.size());
            }
        } catch (CheckpointException e) {
            log.warn("Milestone checkpoint for {} failed; stage stays completed: {}", stageId, e.getMessage(), e);
            eventBus.publish(MaestroEvent.of("checkpoint.failed", stageId, Map.of("error", String.valueOf(e.getMessage()))));
        }
    }

    private PipelineSnapshot transition(UnaryOperator<PipelineSnapshot> change) {
        return store.transition(s -> change.apply(s).touched(clock.instant()));
    }

    private static ValidationResult withGate(ValidationResult validation, StageOutcome outcome) {
        if (outcome == null || outcome.gatePassed()) {
            return validation;
        }
        var checks = new ArrayList<>(validation.checks());
        checks.add(ValidationCheck.required("Build gate", false,
                outcome.gateFailure() != null ? outcome.gateFailure() : "Build/test gate failed"));
        return ValidationResult.of(validation.stageId(), checks);
    }
}
