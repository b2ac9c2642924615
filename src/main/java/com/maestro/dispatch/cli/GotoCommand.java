package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineStateMachine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro goto &lt;stage&gt;
 * <p>
 * Loops back to an earlier stage; it and every later stage return to pending.
 */
@Command(name = "goto", mixinStandardHelpOptions = true, description = "Loop back to an earlier stage")
@Component
public class GotoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Stage id to return to")
    private String stageId;

    @Option(names = {"--reason"}, description = "Why the pipeline loops back", defaultValue = "Requested by user")
    private String reason;

    private final PipelineStateMachine stateMachine;

    public GotoCommand(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        var snapshot = stateMachine.gotoStage(stageId, reason);
        ConsoleOutput.success("Current stage: " + snapshot.pipeline().currentStage());
        return 0;
    }
}
