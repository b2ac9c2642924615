package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineStateMachine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro init
 * <p>
 * Creates the stage directories and a fresh pipeline state at the first stage.
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "Initialize the pipeline for a project")
@Component
public class InitCommand implements Callable<Integer> {

    @Option(names = {"--force", "-f"}, description = "Discard existing pipeline state")
    private boolean force;

    private final PipelineStateMachine stateMachine;

    public InitCommand(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        var snapshot = stateMachine.initialize(force);
        ConsoleOutput.success("Initialized " + snapshot.progress().projectName() + " ("
                + snapshot.progress().pipelineVersion() + " pipeline, "
                + snapshot.progress().stages().size() + " stages)");
        ConsoleOutput.info("Current stage: " + snapshot.pipeline().currentStage());
        return 0;
    }
}
