package com.maestro.core.engine;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.StageDirective;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StageDirectiveBuilderTest {

    private static final PipelineDefinition COMPACT = PipelineDefinition.of("compact", Map.of());

    @TempDir
    Path root;

    private ProjectLayout layout;
    private StageDirectiveBuilder builder;

    @BeforeEach
    void setUp() {
        layout = new ProjectLayout(root);
        builder = new StageDirectiveBuilder(layout, COMPACT);
    }

    private void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("first stage gets instructions, persona, brief and output location")
    void firstStage() throws IOException {
        write(layout.instructions("01-planning"), "Plan the system.");
        write(layout.brief(), "A todo app for teams.");

        StageDirective directive = builder.build(COMPACT.stage("01-planning"), ModelTier.REASONING);
        String text = directive.text();

        assertTrue(text.startsWith("# Stage 01-planning: Planning"));
        assertTrue(text.contains("Plan the system."));
        assertTrue(text.contains("Architect, Risk Analyst, Pragmatist"));
        assertTrue(text.contains("- Model: reasoning"));
        assertTrue(text.contains("## Project Brief\n\nA todo app for teams."));
        assertTrue(text.contains("`stages/01-planning/outputs/`"));
        assertTrue(text.contains("`architecture.md`"));
        assertEquals(ModelTier.REASONING, directive.modelTier());
        assertEquals(0, directive.attempt());
    }

    @Test
    @DisplayName("missing instructions get a default line and later stages get no brief")
    void defaults() throws IOException {
        write(layout.brief(), "brief");

        String text = builder.build(COMPACT.stage("02-ui-ux"), ModelTier.BALANCED).text();

        assertTrue(text.contains("Complete the UI/UX Design stage and write its outputs."));
        assertFalse(text.contains("## Project Brief"));
    }

    @Test
    @DisplayName("previous stage handoff wins over the root handoff")
    void handoff() throws IOException {
        write(layout.rootHandoff(), "root handoff");
        write(layout.stageHandoff("01-planning"), "planning handoff");

        String second = builder.build(COMPACT.stage("02-ui-ux"), ModelTier.BALANCED).text();
        String third = builder.build(COMPACT.stage("03-implementation"), ModelTier.BALANCED).text();

        assertTrue(second.contains("## Previous Stage Handoff\n\nplanning handoff"));
        assertTrue(third.contains("root handoff"));
    }

    @Test
    @DisplayName("references include small text files only, sorted")
    void references() throws IOException {
        Path refs = layout.referencesDir("01-planning");
        write(refs.resolve("b-notes.md"), "second");
        write(refs.resolve("a-api.json"), "{\"first\": true}");
        write(refs.resolve("logo.png"), "binary");
        write(refs.resolve("huge.txt"), "x".repeat((int) StageDirectiveBuilder.MAX_REFERENCE_BYTES + 1));

        String text = builder.build(COMPACT.stage("01-planning"), ModelTier.REASONING).text();

        assertTrue(text.contains("## References"));
        assertTrue(text.indexOf("### a-api.json") < text.indexOf("### b-notes.md"));
        assertFalse(text.contains("logo.png"));
        assertFalse(text.contains("huge.txt"));
    }
}
