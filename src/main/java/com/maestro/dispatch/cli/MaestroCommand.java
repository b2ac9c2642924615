package com.maestro.dispatch.cli;

import com.maestro.core.exception.MaestroException;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Maestro.
 * Routes to the pipeline, checkpoint, validation and model subcommands.
 */
@Command(
        name = "maestro",
        mixinStandardHelpOptions = true,
        version = "Maestro 0.1.0",
        description = "Multi-stage agent pipeline with debate rounds and checkpoints",
        subcommands = {
                InitCommand.class,
                StartCommand.class,
                ResumeCommand.class,
                PauseCommand.class,
                SkipCommand.class,
                GotoCommand.class,
                AdvanceCommand.class,
                StatusCommand.class,
                CheckpointCommand.class,
                ValidateCommand.class,
                ModelsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MaestroCommand implements Runnable {

    /** Exit code for failures reported as {@link MaestroException}. */
    public static final int EXIT_ERROR = 1;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }

    /**
     * Builds the command line with the shared error handler: {@link MaestroException}s are printed
     * and mapped to {@link #EXIT_ERROR}; anything else propagates to picocli.
     */
    public static CommandLine commandLine(MaestroCommand command, CommandLine.IFactory factory) {
        var commandLine = new CommandLine(command, factory);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof MaestroException) {
                ConsoleOutput.error(ex.getMessage());
                return EXIT_ERROR;
            }
            throw ex;
        });
        return commandLine;
    }
}
