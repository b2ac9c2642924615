package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineStateMachine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro pause
 * <p>
 * A running pipeline notices the pause once its current debate round or step settles.
 */
@Command(name = "pause", mixinStandardHelpOptions = true, description = "Pause the pipeline")
@Component
public class PauseCommand implements Callable<Integer> {

    @Option(names = {"--reason"}, description = "Why the pipeline is paused", defaultValue = "Paused by user")
    private String reason;

    private final PipelineStateMachine stateMachine;

    public PauseCommand(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        var snapshot = stateMachine.pause(reason);
        ConsoleOutput.warn("Pipeline paused at " + snapshot.pipeline().currentStage() + ": " + reason);
        return 0;
    }
}
