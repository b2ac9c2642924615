package com.maestro.dispatch.cli;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.model.ModelAssignment;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.Stage;
import com.maestro.core.models.ModelTierResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.concurrent.Callable;

/**
 * CLI command: maestro models
 * <p>
 * Prints where model availability came from and the tier assigned to each stage role.
 */
@Command(name = "models", mixinStandardHelpOptions = true, description = "Show model availability and assignments")
@Component
public class ModelsCommand implements Callable<Integer> {

    @Option(names = {"--refresh"}, description = "Re-read availability instead of using the cached assignment")
    private boolean refresh;

    private final ModelTierResolver resolver;
    private final PipelineDefinition pipeline;

    public ModelsCommand(ModelTierResolver resolver, PipelineDefinition pipeline) {
        this.resolver = resolver;
        this.pipeline = pipeline;
    }

    @Override
    public Integer call() {
        ModelAssignment assignment = refresh ? resolver.refresh() : resolver.assignment();
        var basis = assignment.basis();
        ConsoleOutput.info("Source: " + basis.source() + " (" + basis.timestamp() + ")");
        for (ModelTier tier : ModelTier.values()) {
            String line = String.format("  %-10s %-32s %s", tier.roleName(),
                    ConsoleOutput.truncate(basis.modelId(tier), 32),
                    basis.isAvailable(tier) ? "available" : "unavailable");
            System.out.println(line);
        }
        System.out.println();
        System.out.printf("  %-20s %-10s %s%n", "STAGE", "PERSONA", "ROLES");
        System.out.println("  " + "-".repeat(76));
        for (Stage stage : pipeline.stages()) {
            var roles = new ArrayList<String>();
            for (int i = 0; i < stage.roles().size(); i++) {
                roles.add(stage.roles().get(i) + "=" + assignment.roleFor(stage.id(), i).roleName());
            }
            System.out.printf("  %-20s %-10s %s%n", stage.id(),
                    assignment.personaFor(stage.id()).roleName(), String.join(", ", roles));
        }
        return 0;
    }
}
