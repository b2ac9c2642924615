package com.maestro.core.handoff;

import com.maestro.core.config.ProjectLayout;
import com.maestro.core.debate.DebatePrompts;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

/**
 * Writes {@code stages/<id>/HANDOFF.md}: completed stage, timestamp, produced outputs,
 * a debate notes summary and the next stage.
 */
public class MarkdownHandoffGenerator implements HandoffGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownHandoffGenerator.class);

    private final ProjectLayout layout;
    private final Clock clock;

    public MarkdownHandoffGenerator(ProjectLayout layout, Clock clock) {
        this.layout = layout;
        this.clock = clock;
    }

    @Override
    public Path generate(Stage stage, StageOutcome outcome, Stage nextStage) {
        var sb = new StringBuilder();
        sb.append("# Handoff: ").append(stage.name()).append(" (").append(stage.id()).append(")\n\n");
        sb.append("- Completed: ").append(clock.instant()).append("\n");
        if (outcome != null) {
            sb.append("- Execution: ").append(outcome.type().name().toLowerCase()).append(", ")
              .append(outcome.agentCount()).append(" agent(s)\n");
        }
        sb.append("- Next stage: ").append(nextStage != null ? nextStage.id() + " (" + nextStage.name() + ")" : "none, pipeline complete")
          .append("\n\n");

        sb.append("## Outputs\n\n");
        List<String> outputs = listOutputs(stage.id());
        if (outputs.isEmpty()) {
            sb.append("_No output files._\n");
        } else {
            outputs.forEach(o -> sb.append("- `").append(o).append("`\n"));
        }
        sb.append("\n");

        if (outcome != null && !outcome.rounds().isEmpty()) {
            sb.append(DebatePrompts.debateNotes(outcome.rounds())).append("\n");
        }
        if (outcome != null && !outcome.stepOutputs().isEmpty()) {
            sb.append("## Steps\n\n");
            for (int i = 0; i < outcome.stepOutputs().size(); i++) {
                sb.append(i + 1).append(". ").append(stage.roles().get(i)).append("\n");
            }
            sb.append("\n");
        }
        if (nextStage != null) {
            sb.append("## For ").append(nextStage.name()).append("\n\n")
              .append("Start from the outputs above. Focus: ").append(nextStage.focus()).append(".\n");
        }
        return write(stage, sb.toString());
    }

    @Override
    public Path generateSkipped(Stage stage, Stage nextStage, String reason) {
        var sb = new StringBuilder();
        sb.append("# Handoff: ").append(stage.name()).append(" (").append(stage.id()).append(") SKIPPED\n\n");
        sb.append("- Skipped: ").append(clock.instant()).append("\n");
        sb.append("- Reason: ").append(reason == null || reason.isBlank() ? "not given" : reason).append("\n");
        sb.append("- Next stage: ").append(nextStage != null ? nextStage.id() : "none, pipeline complete").append("\n\n");
        sb.append("This stage produced no validated outputs. Later stages must not assume its artifacts exist.\n");
        return write(stage, sb.toString());
    }

    private Path write(Stage stage, String content) {
        Path target = layout.stageHandoff(stage.id());
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
            log.info("Wrote handoff for {}", stage.id());
            return target;
        } catch (IOException e) {
            log.error("Failed to write handoff for {}: {}", stage.id(), e.getMessage(), e);
            return null;
        }
    }

    private List<String> listOutputs(String stageId) {
        Path dir = layout.outputsDir(stageId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> layout.root().relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list outputs of {}: {}", stageId, e.getMessage());
            return List.of();
        }
    }
}
