package com.maestro.dispatch.cli;

import com.maestro.core.checkpoint.RestoreOptions;
import com.maestro.core.engine.PipelineStateMachine;
import com.maestro.core.model.Checkpoint;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command group: maestro checkpoint create|list|restore|delete|cleanup
 */
@Command(name = "checkpoint", mixinStandardHelpOptions = true, description = "Manage project checkpoints")
@Component
public class CheckpointCommand implements Runnable {

    private final PipelineStateMachine stateMachine;

    public CheckpointCommand(PipelineStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "create", description = "Snapshot stages, state and (optionally) config")
    public int create(@Option(names = {"--description", "-d"}, defaultValue = "Manual checkpoint",
                       description = "Free text; include 'milestone' to protect it from cleanup")
               String description) {
        Checkpoint checkpoint = stateMachine.createCheckpoint(description);
        ConsoleOutput.success("Created checkpoint " + checkpoint.id()
                + " (" + String.join(", ", checkpoint.includes()) + ")");
        return 0;
    }

    @Command(name = "list", description = "List checkpoints, newest first")
    public int list() {
        List<Checkpoint> checkpoints = stateMachine.listCheckpoints();
        if (checkpoints.isEmpty()) {
            ConsoleOutput.info("No checkpoints.");
            return 0;
        }
        System.out.printf("  %-36s %-20s %-10s %s%n", "ID", "STAGE", "MILESTONE", "DESCRIPTION");
        System.out.println("  " + "-".repeat(90));
        for (Checkpoint cp : checkpoints) {
            System.out.printf("  %-36s %-20s %-10s %s%n", cp.id(), cp.stage(),
                    cp.milestone() ? "yes" : "", ConsoleOutput.truncate(cp.description(), 40));
        }
        return 0;
    }

    @Command(name = "restore", description = "Restore a checkpoint (refused while a stage is in progress)")
    public int restore(@Parameters(index = "0", description = "Checkpoint id") String id,
                @Option(names = {"--file", "-f"}, description = "Restore only these paths (relative to the project root)")
                List<String> files) {
        var options = files == null || files.isEmpty() ? RestoreOptions.full() : RestoreOptions.partial(files);
        Checkpoint restored = stateMachine.restoreCheckpoint(id, options);
        ConsoleOutput.success("Restored " + restored.id() + (options.isPartial()
                ? " (" + files.size() + " path" + (files.size() != 1 ? "s" : "") + ")" : ""));
        return 0;
    }

    @Command(name = "delete", description = "Delete a checkpoint")
    public int delete(@Parameters(index = "0", description = "Checkpoint id") String id) {
        if (!stateMachine.deleteCheckpoint(id)) {
            ConsoleOutput.error("Checkpoint not found: " + id);
            return 1;
        }
        ConsoleOutput.success("Deleted " + id);
        return 0;
    }

    @Command(name = "cleanup", description = "Apply the retention policy")
    public int cleanup() {
        List<String> deleted = stateMachine.cleanupCheckpoints();
        if (deleted.isEmpty()) {
            ConsoleOutput.info("Nothing to clean up.");
        } else {
            deleted.forEach(id -> ConsoleOutput.success("Deleted " + id));
        }
        return 0;
    }
}
