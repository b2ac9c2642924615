package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineStateMachine;
import com.maestro.core.model.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro skip [stage]
 */
@Command(name = "skip", mixinStandardHelpOptions = true,
        description = "Skip the current stage regardless of its outputs")
@Component
public class SkipCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Stage id (default: current stage)")
    private String stageId;

    @Option(names = {"--reason"}, description = "Why the stage is skipped", defaultValue = "Skipped by user")
    private String reason;

    private final PipelineStateMachine stateMachine;

    public SkipCommand(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        String target = stageId != null ? stageId : stateMachine.snapshot().pipeline().currentStage();
        String next = stateMachine.skipStage(target, reason);
        ConsoleOutput.success("Skipped " + target);
        ConsoleOutput.info(PipelineState.COMPLETE.equals(next) ? "Pipeline complete" : "Current stage: " + next);
        return 0;
    }
}
