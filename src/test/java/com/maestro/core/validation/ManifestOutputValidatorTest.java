package com.maestro.core.validation;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.config.ProjectLayout;
import com.maestro.core.model.Severity;
import com.maestro.core.model.Stage;
import com.maestro.core.model.ValidationCheck;
import com.maestro.core.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ManifestOutputValidatorTest {

    private static final PipelineDefinition CLASSIC = PipelineDefinition.of("classic", Map.of());
    private static final PipelineDefinition COMPACT = PipelineDefinition.of("compact", Map.of());

    @TempDir
    Path root;

    private ProjectLayout layout;
    private final BuildRunner buildRunner = mock(BuildRunner.class);
    private ManifestOutputValidator validator;

    @BeforeEach
    void setUp() {
        layout = new ProjectLayout(root);
        validator = new ManifestOutputValidator(layout, buildRunner, 5);
    }

    private void output(Stage stage, String file, String content) throws IOException {
        Path p = layout.outputsDir(stage.id()).resolve(file);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content);
    }

    @Nested
    @DisplayName("document stages")
    class Documents {

        @Test
        @DisplayName("missing primary output fails the required checks")
        void missingPrimary() {
            Stage stage = COMPACT.stage("01-planning");

            ValidationResult result = validator.validate(stage);

            assertFalse(result.requiredChecksPassed());
            assertEquals(1, result.failedChecks().size());
            assertTrue(result.failedChecks().get(0).contains("architecture.md"));
            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("primary output alone passes, with recommended files reported as findings")
        void primaryOnly() throws IOException {
            Stage stage = COMPACT.stage("01-planning");
            output(stage, "architecture.md", "# Architecture\n");

            var result = validator.validate(stage);

            assertTrue(result.requiredChecksPassed());
            assertEquals(2, result.exitCode());
            assertTrue(result.checks().stream()
                    .anyMatch(c -> !c.passed() && c.severity() == Severity.HIGH && c.name().contains("tech_stack.md")));
            assertTrue(result.score() > 0.0 && result.score() < 1.0);
        }

        @Test
        @DisplayName("size and section requirements are reported as medium findings")
        void sizeAndSections() throws IOException {
            Stage stage = CLASSIC.stage("01-brainstorm");
            output(stage, "ideas.md", "short");
            output(stage, "requirements_analysis.md", "# Functional requirements\n\nLogin.\n");

            var result = validator.validate(stage);

            List<ValidationCheck> failed = result.checks().stream().filter(c -> !c.passed()).toList();
            assertTrue(failed.stream().anyMatch(c -> c.name().equals("Size ideas.md")));
            assertTrue(failed.stream().anyMatch(c -> c.name().equals("Section Non-functional")));
            assertTrue(result.checks().stream()
                    .anyMatch(c -> c.passed() && c.name().equals("Section Functional")));
            failed.forEach(c -> assertNotEquals(Severity.CRITICAL, c.severity()));
        }

        @Test
        @DisplayName("everything present scores 1.0 and exits 0")
        void complete() throws IOException {
            Stage stage = COMPACT.stage("01-planning");
            output(stage, "architecture.md", "# Architecture\n");
            output(stage, "tech_stack.md", "# Stack\n");
            output(stage, "project_plan.md", "# Plan\n");

            var result = validator.validate(stage);

            assertEquals(1.0, result.score());
            assertEquals(0, result.exitCode());
            verifyNoInteractions(buildRunner);
        }
    }

    @Nested
    @DisplayName("code-producing stages")
    class Code {

        private final Stage implementation = COMPACT.stage("03-implementation");

        @Test
        @DisplayName("too few source files and no manifest fail")
        void noProject() throws IOException {
            output(implementation, implementation.primaryOutput(), "log");
            when(buildRunner.countSourceFiles(any())).thenReturn(2);
            when(buildRunner.detect(any())).thenReturn(Optional.empty());

            var result = validator.validate(implementation);

            assertFalse(result.requiredChecksPassed());
            assertTrue(result.failedChecks().stream().anyMatch(m -> m.contains("Only 2 source files")));
            assertTrue(result.failedChecks().stream().anyMatch(m -> m.contains("No project manifest")));
            verify(buildRunner, never()).buildAndTest(any(), any());
        }

        @Test
        @DisplayName("a failing test run fails validation with the output tail")
        void failingTests() throws IOException {
            output(implementation, implementation.primaryOutput(), "log");
            when(buildRunner.countSourceFiles(any())).thenReturn(12);
            when(buildRunner.detect(any())).thenReturn(Optional.of(ProjectType.MAVEN));
            when(buildRunner.buildAndTest(any(), eq(ProjectType.MAVEN))).thenReturn(List.of(
                    new BuildRunner.CommandResult("build", true, ""),
                    new BuildRunner.CommandResult("test", false, "line1\nTests run: 4, Failures: 1")));

            var result = validator.validate(implementation);

            assertFalse(result.requiredChecksPassed());
            assertEquals(List.of("test failed: line1 | Tests run: 4, Failures: 1"), result.failedChecks());
        }

        @Test
        @DisplayName("requirements describe the build gate")
        void describe() {
            List<String> lines = validator.describeRequirements(implementation);

            assertEquals("stages/03-implementation/outputs/implementation_log.md (required)", lines.get(0));
            assertTrue(lines.contains("At least 5 source files in the project"));
        }
    }
}
