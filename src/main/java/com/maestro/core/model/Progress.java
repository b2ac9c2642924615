package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable per-project progress: per-stage status records in pipeline order,
 * sprint/cycle counters, checkpoint references and loop-back history.
 */
public record Progress(
        String projectName,
        String pipelineVersion,
        Instant startedAt,
        Instant lastUpdated,
        Map<String, StageProgress> stages,
        IterationCounters iteration,
        List<CheckpointRef> checkpoints,
        List<LoopBack> loopBacks
) implements Serializable {

    public Progress {
        stages = stages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        iteration = iteration == null ? IterationCounters.initial() : iteration;
        checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
        loopBacks = loopBacks == null ? List.of() : List.copyOf(loopBacks);
    }

    public static Progress initial(String projectName, String pipelineVersion, List<String> stageIds,
                                   Instant now) {
        var stages = new LinkedHashMap<String, StageProgress>();
        for (String id : stageIds) {
            stages.put(id, StageProgress.pending());
        }
        return new Progress(projectName, pipelineVersion, now, now, stages,
                IterationCounters.initial(), List.of(), List.of());
    }

    public StageProgress stage(String stageId) {
        StageProgress p = stages.get(stageId);
        return p != null ? p : StageProgress.pending();
    }

    public Progress withStage(String stageId, StageProgress stageProgress) {
        var copy = new LinkedHashMap<>(stages);
        copy.put(stageId, stageProgress);
        return new Progress(projectName, pipelineVersion, startedAt, lastUpdated, copy,
                iteration, checkpoints, loopBacks);
    }

    public Progress withCheckpoint(CheckpointRef ref) {
        var refs = new ArrayList<>(checkpoints);
        refs.add(ref);
        return new Progress(projectName, pipelineVersion, startedAt, lastUpdated, stages,
                iteration, refs, loopBacks);
    }

    public Progress withoutCheckpoint(String checkpointId) {
        var refs = new ArrayList<>(checkpoints);
        refs.removeIf(r -> r.id().equals(checkpointId));
        return new Progress(projectName, pipelineVersion, startedAt, lastUpdated, stages,
                iteration, refs, loopBacks);
    }

    public Progress withIteration(IterationCounters counters) {
        return new Progress(projectName, pipelineVersion, startedAt, lastUpdated, stages,
                counters, checkpoints, loopBacks);
    }

    public Progress withLoopBack(LoopBack loopBack) {
        var history = new ArrayList<>(loopBacks);
        history.add(loopBack);
        return new Progress(projectName, pipelineVersion, startedAt, lastUpdated, stages,
                iteration, checkpoints, history);
    }

    public Progress touched(Instant at) {
        return new Progress(projectName, pipelineVersion, startedAt, at, stages, iteration, checkpoints, loopBacks);
    }

    /** Percentage of stages that are completed or skipped. */
    public int percentComplete() {
        if (stages.isEmpty()) return 0;
        long settled = stages.values().stream().filter(s -> s.status().isSettled()).count();
        return (int) Math.round(settled * 100.0 / stages.size());
    }

    public boolean allSettled() {
        return !stages.isEmpty() && stages.values().stream().allMatch(s -> s.status().isSettled());
    }
}
