package com.maestro.core.validation;

import com.maestro.core.config.ProjectLayout;
import com.maestro.core.model.Severity;
import com.maestro.core.model.Stage;
import com.maestro.core.model.ValidationCheck;
import com.maestro.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link OutputValidator} driven by a per-stage manifest of expected output files.
 * <p>
 * The stage's primary output is always required. Further files, minimum sizes and markdown
 * sections come from the manifest keyed by stage slug. Missing optional files are reported as
 * {@link Severity#HIGH}, thin or incomplete files as {@link Severity#MEDIUM}.
 * Code-producing stages additionally need a minimum number of source files, a recognized
 * project manifest, and passing build and test commands.
 */
public class ManifestOutputValidator implements OutputValidator {

    private static final Logger log = LoggerFactory.getLogger(ManifestOutputValidator.class);

    private static final Map<String, List<OutputRequirement>> MANIFEST = Map.of(
            "brainstorm", List.of(
                    OutputRequirement.optional("ideas.md").minBytes(500),
                    OutputRequirement.optional("requirements_analysis.md").sections("Functional", "Non-functional")),
            "research", List.of(
                    OutputRequirement.optional("tech_research.md").minBytes(2000),
                    OutputRequirement.optional("feasibility_report.md")),
            "planning", List.of(
                    OutputRequirement.optional("tech_stack.md"),
                    OutputRequirement.optional("project_plan.md")),
            "ui-ux", List.of(OutputRequirement.optional("design_system.md")),
            "implementation", List.of(OutputRequirement.optional("test_summary.md")),
            "qa", List.of(OutputRequirement.optional("bug_list.md")),
            "testing", List.of(OutputRequirement.optional("coverage_report.md")),
            "deployment", List.of(OutputRequirement.optional("ci_config.yaml"))
    );

    private final ProjectLayout layout;
    private final BuildRunner buildRunner;
    private final int minSourceFiles;

    public ManifestOutputValidator(ProjectLayout layout, BuildRunner buildRunner, int minSourceFiles) {
        this.layout = layout;
        this.buildRunner = buildRunner;
        this.minSourceFiles = minSourceFiles;
    }

    public List<OutputRequirement> requirements(Stage stage) {
        var reqs = new ArrayList<OutputRequirement>();
        reqs.add(OutputRequirement.required(stage.primaryOutput()));
        for (OutputRequirement r : MANIFEST.getOrDefault(stage.slug(), List.of())) {
            if (r.file().equals(stage.primaryOutput())) {
                reqs.set(0, new OutputRequirement(r.file(), true, r.minBytes(), r.sections()));
            } else {
                reqs.add(r);
            }
        }
        return reqs;
    }

    @Override
    public List<String> describeRequirements(Stage stage) {
        var lines = new ArrayList<String>();
        for (OutputRequirement r : requirements(stage)) {
            var sb = new StringBuilder("stages/").append(stage.id()).append("/outputs/").append(r.file());
            sb.append(r.required() ? " (required)" : " (recommended)");
            if (r.minBytes() > 0) {
                sb.append(", at least ").append(r.minBytes()).append(" bytes");
            }
            if (!r.sections().isEmpty()) {
                sb.append(", with sections: ").append(String.join(", ", r.sections()));
            }
            lines.add(sb.toString());
        }
        if (stage.codeProducing()) {
            lines.add("At least " + minSourceFiles + " source files in the project");
            lines.add("A project manifest (pom.xml, build.gradle, package.json, pyproject.toml, Cargo.toml or go.mod)");
            lines.add("A build and test run that both pass");
        }
        return lines;
    }

    @Override
    public ValidationResult validate(Stage stage) {
        var checks = new ArrayList<ValidationCheck>();
        Path outputs = layout.outputsDir(stage.id());
        for (OutputRequirement req : requirements(stage)) {
            checkFile(checks, outputs.resolve(req.file()), req);
        }
        if (stage.codeProducing()) {
            checkCode(checks);
        }
        var result = ValidationResult.of(stage.id(), checks);
        log.info("Validated {}: required checks {}, score {}", stage.id(),
                result.requiredChecksPassed() ? "passed" : "FAILED",
                String.format(Locale.ROOT, "%.2f", result.score()));
        return result;
    }

    private void checkFile(List<ValidationCheck> checks, Path file, OutputRequirement req) {
        String rel = layout.root().relativize(file).toString().replace('\\', '/');
        boolean exists = Files.isRegularFile(file);
        if (req.required()) {
            checks.add(ValidationCheck.required("Output " + req.file(), exists,
                    exists ? rel + " exists" : "Missing required output " + rel));
        } else {
            checks.add(ValidationCheck.optional("Output " + req.file(), exists,
                    exists ? rel + " exists" : "Missing recommended output " + rel, Severity.HIGH));
        }
        if (!exists) {
            return;
        }
        try {
            if (req.minBytes() > 0) {
                long size = Files.size(file);
                checks.add(ValidationCheck.optional("Size " + req.file(), size >= req.minBytes(),
                        size >= req.minBytes()
                                ? rel + " size met (" + size + " bytes >= " + req.minBytes() + ")"
                                : rel + " size insufficient (" + size + " bytes < " + req.minBytes() + ")",
                        Severity.MEDIUM));
            }
            if (!req.sections().isEmpty()) {
                String content = Files.readString(file, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
                for (String section : req.sections()) {
                    boolean found = content.lines()
                            .anyMatch(l -> l.startsWith("#") && l.contains(section.toLowerCase(Locale.ROOT)));
                    checks.add(ValidationCheck.optional("Section " + section, found,
                            found ? rel + " has section '" + section + "'"
                                    : rel + " is missing section '" + section + "'",
                            Severity.MEDIUM));
                }
            }
        } catch (IOException e) {
            checks.add(ValidationCheck.required("Read " + req.file(), false,
                    "Could not read " + rel + ": " + e.getMessage()));
        }
    }

    private void checkCode(List<ValidationCheck> checks) {
        Path root = layout.root();
        int sources = buildRunner.countSourceFiles(root);
        boolean enough = sources >= minSourceFiles;
        checks.add(ValidationCheck.required("Source file count", enough,
                enough ? "Found " + sources + " source files (>= " + minSourceFiles + " required)"
                        : "Only " + sources + " source files found (minimum " + minSourceFiles + " required)"));

        var type = buildRunner.detect(root);
        checks.add(ValidationCheck.required("Project manifest", type.isPresent(),
                type.map(t -> "Detected " + t.displayName() + " project")
                        .orElse("No project manifest found (pom.xml, build.gradle, package.json, *.csproj, "
                                + "pyproject.toml, Cargo.toml, go.mod)")));
        if (type.isEmpty()) {
            return;
        }
        for (BuildRunner.CommandResult r : buildRunner.buildAndTest(root, type.get())) {
            checks.add(ValidationCheck.required(capitalize(r.name()), r.passed(),
                    r.passed() ? r.name() + " passed" : r.name() + " failed" + tail(r.summary())));
        }
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static String tail(String summary) {
        if (summary == null || summary.isBlank()) {
            return "";
        }
        var lines = summary.lines().toList();
        return ": " + String.join(" | ", lines.subList(Math.max(0, lines.size() - 3), lines.size()));
    }
}
