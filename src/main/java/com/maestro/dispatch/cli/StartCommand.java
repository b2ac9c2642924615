package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineDriver;
import com.maestro.core.events.EventBus;
import com.maestro.core.model.PipelineSnapshot;
import com.maestro.core.model.PipelineStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro start
 * <p>
 * Runs the pipeline from the current stage until it completes or pauses, printing pipeline
 * events as they happen.
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Run the pipeline from the current stage")
@Component
public class StartCommand implements Callable<Integer> {

    @Option(names = {"--stages", "-n"},
            description = "Stop after this many completed stages (0 = run to the end, default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private int stages;

    private final PipelineDriver driver;
    private final EventBus eventBus;

    public StartCommand(PipelineDriver driver, EventBus eventBus) {
        this.driver = driver;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        return runAndReport(driver, eventBus, stages);
    }

    static int runAndReport(PipelineDriver driver, EventBus eventBus, int stages) {
        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        PipelineSnapshot result;
        try {
            result = driver.run(stages);
        } finally {
            subscription.unsubscribe();
        }
        System.out.println();
        var state = result.pipeline();
        if (state.isComplete()) {
            ConsoleOutput.success("Pipeline complete (" + result.progress().percentComplete() + "%)");
            return 0;
        }
        if (state.status() == PipelineStatus.PAUSED) {
            ConsoleOutput.warn("Paused at " + state.currentStage()
                    + (state.pauseReason() != null ? ": " + state.pauseReason() : ""));
            ConsoleOutput.info("Fix the problem, then run: maestro resume");
            return 1;
        }
        ConsoleOutput.info("Stopped at " + state.currentStage() + " (" + result.progress().percentComplete() + "%)");
        return 0;
    }
}
