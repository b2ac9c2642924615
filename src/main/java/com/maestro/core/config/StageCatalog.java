package com.maestro.core.config;

import com.maestro.core.exception.ConfigurationException;
import com.maestro.core.model.DebateSettings;
import com.maestro.core.model.ExecutionMode;
import com.maestro.core.model.Intensity;
import com.maestro.core.model.Stage;

import java.util.List;
import java.util.Locale;

/**
 * Built-in stage layouts for the supported pipeline versions.
 */
public final class StageCatalog {

    public static final String CLASSIC = "classic";
    public static final String COMPACT = "compact";

    private StageCatalog() {}

    public static List<String> versions() {
        return List.of(CLASSIC, COMPACT);
    }

    public static List<Stage> forVersion(String version) {
        String v = version == null ? CLASSIC : version.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case CLASSIC -> classic();
            case COMPACT -> compact();
            default -> throw new ConfigurationException(
                    "Unknown pipeline version '" + version + "' (expected one of " + versions() + ")");
        };
    }

    static List<Stage> classic() {
        return List.of(
                debate("01-brainstorm", "Brainstorming", Intensity.FULL,
                        List.of("Visionary", "Skeptic", "Integrator"), List.of(), false,
                        "ideas.md", "Divergent ideation and requirement discovery"),
                debate("02-research", "Research", Intensity.STANDARD,
                        List.of("Deep Diver", "Contrarian", "Analyst"), List.of("01-brainstorm"), false,
                        "tech_research.md", "Technology research and feasibility"),
                debate("03-planning", "Planning", Intensity.FULL,
                        List.of("Architect", "Risk Analyst", "Pragmatist"), List.of("01-brainstorm"), false,
                        "architecture.md", "System architecture and project plan"),
                debate("04-ui-ux", "UI/UX Design", Intensity.STANDARD,
                        List.of("UX Advocate", "Visual Designer", "Dev Liaison"), List.of("03-planning"), false,
                        "wireframes.md", "User flows, wireframes and design system"),
                sequential("05-task-management", "Task Management",
                        List.of("Decomposer", "Dependency Mapper"), List.of("03-planning"), false,
                        "tasks.md", "Breaking the plan into ordered, estimable tasks"),
                sequential("06-implementation", "Implementation",
                        List.of("Coder", "Reviewer", "Tester"), List.of("03-planning", "05-task-management"), true,
                        "implementation_log.md", "Writing working, tested code for the planned tasks"),
                debate("07-refactoring", "Refactoring", Intensity.STANDARD,
                        List.of("Performance Engineer", "Clean Code Advocate", "Regression Guardian"),
                        List.of("06-implementation"), true,
                        "refactoring_report.md", "Improving structure without changing behavior"),
                debate("08-qa", "Quality Assurance", Intensity.STANDARD,
                        List.of("Security Auditor", "Accessibility Reviewer", "Edge Case Hunter"),
                        List.of("06-implementation"), false,
                        "qa_report.md", "Finding defects, security and accessibility issues"),
                sequential("09-testing", "Testing",
                        List.of("Coverage Analyst", "Chaos Tester", "Integration Tester"),
                        List.of("06-implementation"), true,
                        "test_report.md", "Test coverage, resilience and integration"),
                debate("10-deployment", "Deployment", Intensity.LIGHT,
                        List.of("Infra Engineer", "Security Ops"), List.of("09-testing"), false,
                        "deployment_guide.md", "Release packaging, CI/CD and operations")
        );
    }

    static List<Stage> compact() {
        return List.of(
                debate("01-planning", "Planning", Intensity.FULL,
                        List.of("Architect", "Risk Analyst", "Pragmatist"), List.of(), false,
                        "architecture.md", "System architecture and project plan"),
                debate("02-ui-ux", "UI/UX Design", Intensity.STANDARD,
                        List.of("UX Advocate", "Visual Designer", "Dev Liaison"), List.of("01-planning"), false,
                        "wireframes.md", "User flows, wireframes and design system"),
                sequential("03-implementation", "Implementation",
                        List.of("Coder", "Reviewer", "Tester"), List.of("01-planning"), true,
                        "implementation_log.md", "Writing working, tested code for the planned tasks"),
                debate("04-qa", "Quality Assurance", Intensity.STANDARD,
                        List.of("Security Auditor", "Accessibility Reviewer", "Edge Case Hunter"),
                        List.of("03-implementation"), false,
                        "qa_report.md", "Finding defects, security and accessibility issues"),
                debate("05-deployment", "Deployment", Intensity.LIGHT,
                        List.of("Infra Engineer", "Security Ops"), List.of("04-qa"), false,
                        "deployment_guide.md", "Release packaging, CI/CD and operations")
        );
    }

    private static Stage debate(String id, String name, Intensity intensity, List<String> roles,
                                List<String> prerequisites, boolean codeProducing,
                                String primaryOutput, String focus) {
        return new Stage(id, name, ExecutionMode.DEBATE, intensity, DebateSettings.of(intensity, roles.size()),
                roles, prerequisites, codeProducing, primaryOutput, focus);
    }

    private static Stage sequential(String id, String name, List<String> steps, List<String> prerequisites,
                                    boolean codeProducing, String primaryOutput, String focus) {
        return new Stage(id, name, ExecutionMode.SEQUENTIAL, Intensity.STANDARD, new DebateSettings(1, 1, 1),
                steps, prerequisites, codeProducing, primaryOutput, focus);
    }
}
