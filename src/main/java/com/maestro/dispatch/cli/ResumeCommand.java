package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineDriver;
import com.maestro.core.engine.PipelineStateMachine;
import com.maestro.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro resume
 * <p>
 * Clears a pause. A stage that exhausted its retries gets a fresh retry budget.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a paused pipeline")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Option(names = {"--run", "-r"}, description = "Continue running the pipeline after resuming")
    private boolean run;

    private final PipelineStateMachine stateMachine;
    private final PipelineDriver driver;
    private final EventBus eventBus;

    public ResumeCommand(PipelineStateMachine stateMachine, PipelineDriver driver, EventBus eventBus) {
        this.stateMachine = stateMachine;
        this.driver = driver;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        var snapshot = stateMachine.resume();
        ConsoleOutput.success("Resumed at " + snapshot.pipeline().currentStage());
        if (!run) {
            return 0;
        }
        return StartCommand.runAndReport(driver, eventBus, 0);
    }
}
