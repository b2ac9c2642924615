package com.maestro.dispatch.cli;

import com.maestro.core.engine.PipelineStateMachine;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.Stage;
import com.maestro.core.model.ValidationCheck;
import com.maestro.core.model.ValidationResult;
import com.maestro.core.validation.OutputValidator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: maestro validate [stage]
 * <p>
 * Exit code 0 when every check passed, 1 when a critical check failed, 2 when only high or
 * medium findings remain.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a stage's outputs")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Stage id (default: current stage)")
    private String stageId;

    private final PipelineStateMachine stateMachine;
    private final OutputValidator validator;

    public ValidateCommand(PipelineStateMachine stateMachine, OutputValidator validator) {
        this.stateMachine = stateMachine;
        this.validator = validator;
    }

    @Override
    public Integer call() {
        String target = stageId;
        if (target == null) {
            target = stateMachine.snapshot().pipeline().currentStage();
            if (PipelineState.COMPLETE.equals(target)) {
                ConsoleOutput.info("Pipeline complete; name a stage to validate.");
                return 0;
            }
        }
        Stage stage = stateMachine.pipeline().stage(target);
        ValidationResult result = validator.validate(stage);
        ConsoleOutput.info("Validating " + stage.id() + " (" + stage.name() + ")");
        for (ValidationCheck check : result.checks()) {
            ConsoleOutput.check(check);
        }
        System.out.println();
        int exit = result.exitCode();
        String score = String.format("%.0f%%", result.score() * 100);
        switch (exit) {
            case 0 -> ConsoleOutput.success("All checks passed (" + score + ")");
            case 1 -> ConsoleOutput.error("Critical checks failed (" + score + ")");
            default -> ConsoleOutput.warn("Required checks passed with findings (" + score + ")");
        }
        return exit;
    }
}
