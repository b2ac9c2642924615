package com.maestro.core.engine;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.Stage;
import com.maestro.core.model.StageDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Assembles a stage's execution directive from the project tree: stage instructions, persona,
 * the previous stage's handoff, reference files, the project brief (first stage only) and the
 * output directory.
 */
public class StageDirectiveBuilder {

    private static final Logger log = LoggerFactory.getLogger(StageDirectiveBuilder.class);

    static final long MAX_REFERENCE_BYTES = 50 * 1024;

    static final Set<String> TEXT_EXTENSIONS = Set.of(
            "md", "txt", "json", "jsonc", "yaml", "yml", "toml", "csv", "xml", "html", "css",
            "js", "ts", "tsx", "jsx", "py", "java", "kt", "go", "rs", "sql", "sh");

    private final ProjectLayout layout;
    private final PipelineDefinition pipeline;

    public StageDirectiveBuilder(ProjectLayout layout, PipelineDefinition pipeline) {
        this.layout = layout;
        this.pipeline = pipeline;
    }

    public StageDirective build(Stage stage, ModelTier personaTier) {
        var sb = new StringBuilder();
        sb.append("# Stage ").append(stage.id()).append(": ").append(stage.name()).append("\n\n");

        sb.append("## Instructions\n\n");
        sb.append(read(layout.instructions(stage.id()))
                .orElse("Complete the " + stage.name() + " stage and write its outputs."))
          .append("\n\n");

        sb.append("## Persona\n\n");
        sb.append("- Role: ").append(stage.name()).append(" team (")
          .append(String.join(", ", stage.roles())).append(")\n");
        sb.append("- Focus: ").append(stage.focus()).append("\n");
        sb.append("- Model: ").append(personaTier.roleName()).append("\n\n");

        handoff(stage).ifPresent(h -> sb.append("## Previous Stage Handoff\n\n").append(h.strip()).append("\n\n"));

        String references = references(stage.id());
        if (!references.isEmpty()) {
            sb.append("## References\n\n").append(references);
        }

        if (pipeline.indexOf(stage.id()) == 0) {
            read(layout.brief()).ifPresent(b -> sb.append("## Project Brief\n\n").append(b.strip()).append("\n\n"));
        }

        sb.append("## Output\n\n");
        sb.append("Write all outputs to `")
          .append(layout.root().relativize(layout.outputsDir(stage.id())).toString().replace('\\', '/'))
          .append("/`. The primary output is `").append(stage.primaryOutput()).append("`.\n");

        return new StageDirective(stage, sb.toString(), personaTier, 0);
    }

    private Optional<String> handoff(Stage stage) {
        var previous = pipeline.previous(stage.id());
        if (previous.isPresent()) {
            var text = read(layout.stageHandoff(previous.get().id()));
            if (text.isPresent()) {
                return text;
            }
        }
        return read(layout.rootHandoff());
    }

    private String references(String stageId) {
        Path dir = layout.referencesDir(stageId);
        if (!Files.isDirectory(dir)) {
            return "";
        }
        var sb = new StringBuilder();
        try (Stream<Path> files = Files.walk(dir)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                if (!isText(file) || Files.size(file) >= MAX_REFERENCE_BYTES) {
                    log.debug("Skipping reference {}", file.getFileName());
                    continue;
                }
                sb.append("### ").append(dir.relativize(file).toString().replace('\\', '/')).append("\n\n");
                sb.append(Files.readString(file, StandardCharsets.UTF_8).strip()).append("\n\n");
            }
        } catch (IOException e) {
            log.warn("Could not read references for {}: {}", stageId, e.getMessage());
        }
        return sb.toString();
    }

    private static boolean isText(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && TEXT_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static Optional<String> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            return text.isBlank() ? Optional.empty() : Optional.of(text);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
