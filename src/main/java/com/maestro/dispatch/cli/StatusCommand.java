package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineStateMachine;
import com.maestro.core.model.CheckpointRef;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageProgress;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: maestro status
 * <p>
 * Displays pipeline status, per-stage progress, recent checkpoints and the compliance report.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show pipeline progress")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--checkpoints", "-c"}, description = "Number of recent checkpoints to show (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int recentCheckpoints;

    private final PipelineStateMachine stateMachine;

    public StatusCommand(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var snapshot = stateMachine.snapshot();
        var progress = snapshot.progress();
        PipelineState state = snapshot.pipeline();

        System.out.println();
        System.out.println("PROJECT " + progress.projectName());
        System.out.println("Pipeline: " + progress.pipelineVersion() + " | Progress: " + progress.percentComplete() + "%");
        ConsoleOutput.status(state.status());
        ConsoleOutput.info("Current stage: " + state.currentStage());
        if (state.pauseReason() != null) {
            ConsoleOutput.warn("Paused: " + state.pauseReason());
        }
        if (state.retryState() != null && state.retryState().attempt() > 0) {
            ConsoleOutput.warn("Failed attempts on " + state.retryState().stageId() + ": " + state.retryState().attempt());
        }
        var iteration = progress.iteration();
        ConsoleOutput.info(String.format("Sprint %d/%d | Cycle %d/%d",
                iteration.currentSprint(), iteration.totalSprints(),
                iteration.currentCycle(), iteration.totalCycles()));

        System.out.println();
        System.out.printf("  %-20s %-10s %-10s %-12s %s%n", "STAGE", "MODE", "INTENSITY", "STATUS", "CHECKPOINT");
        System.out.println("  " + "-".repeat(76));
        for (Stage stage : stateMachine.pipeline().stages()) {
            StageProgress sp = progress.stage(stage.id());
            String marker = stage.id().equals(state.currentStage()) ? ">" : " ";
            System.out.printf("%s %-20s %-10s %-10s %-12s %s%n", marker, stage.id(),
                    stage.mode().name().toLowerCase(),
                    stage.isDebate() ? stage.intensity().name().toLowerCase() : "-",
                    ConsoleOutput.stageStatus(sp.status()),
                    ConsoleOutput.truncate(sp.checkpointId(), 32));
        }

        List<CheckpointRef> refs = progress.checkpoints();
        if (!refs.isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Checkpoints (" + refs.size() + "), most recent:");
            refs.subList(Math.max(0, refs.size() - recentCheckpoints), refs.size()).stream()
                    .sorted((a, b) -> b.createdAt().compareTo(a.createdAt()))
                    .forEach(r -> System.out.println("  " + r.id() + "  " + ConsoleOutput.truncate(r.description(), 40)));
        }

        if (!progress.loopBacks().isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Loop-backs:");
            progress.loopBacks().forEach(l -> System.out.println("  " + l.fromStage() + " -> " + l.toStage()
                    + "  " + ConsoleOutput.truncate(l.reason(), 40)));
        }

        System.out.println();
        List<String> missing = stateMachine.complianceReport();
        if (missing.isEmpty()) {
            ConsoleOutput.success("Compliance: every completed stage has a recorded execution");
        } else {
            ConsoleOutput.error("Compliance: no recorded execution for " + String.join(", ", missing));
        }
        return 0;
    }
}
