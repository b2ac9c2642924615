package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineStateMachine;
import com.maestro.core.model.IterationCounters;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro advance sprint|cycle
 */
@Command(name = "advance", mixinStandardHelpOptions = true, description = "Move to the next sprint or epic cycle")
@Component
public class AdvanceCommand implements Callable<Integer> {

    enum Counter { sprint, cycle }

    @Parameters(index = "0", description = "What to advance: ${COMPLETION-CANDIDATES}")
    private Counter counter;

    private final PipelineStateMachine stateMachine;

    public AdvanceCommand(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        IterationCounters counters = counter == Counter.sprint
                ? stateMachine.advanceSprint()
                : stateMachine.advanceCycle();
        ConsoleOutput.success(String.format("Sprint %d/%d, cycle %d/%d",
                counters.currentSprint(), counters.totalSprints(),
                counters.currentCycle(), counters.totalCycles()));
        return 0;
    }
}
