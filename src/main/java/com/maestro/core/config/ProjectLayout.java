package com.maestro.core.config;

import java.nio.file.Path;

/**
 * Directory layout of a pipeline project.
 * <pre>
 * &lt;root&gt;/
 *   PROJECT_BRIEF.md
 *   HANDOFF.md                      fallback handoff
 *   config/                         optional, captured by checkpoints on request
 *   references/&lt;stage&gt;/            reference material injected into directives
 *   stages/&lt;stage&gt;/CLAUDE.md        stage instructions
 *   stages/&lt;stage&gt;/HANDOFF.md       handoff written at completion
 *   stages/&lt;stage&gt;/outputs/         stage artifacts
 *   state/progress.json, state/pipeline.json, state/execution_log.jsonl
 *   state/debates/&lt;stage&gt;/round-&lt;n&gt;/&lt;role&gt;.md
 *   state/checkpoints/&lt;id&gt;/
 * </pre>
 */
public record ProjectLayout(Path root) {

    public static final String STAGES = "stages";
    public static final String STATE = "state";
    public static final String CONFIG = "config";
    public static final String CHECKPOINTS = "checkpoints";
    public static final String HANDOFF = "HANDOFF.md";
    public static final String INSTRUCTIONS = "CLAUDE.md";
    public static final String BRIEF = "PROJECT_BRIEF.md";

    public ProjectLayout {
        root = root.toAbsolutePath().normalize();
    }

    public static ProjectLayout of(MaestroProperties properties) {
        return new ProjectLayout(properties.projectRootPath());
    }

    public Path stagesDir() {
        return root.resolve(STAGES);
    }

    public Path stageDir(String stageId) {
        return stagesDir().resolve(stageId);
    }

    public Path outputsDir(String stageId) {
        return stageDir(stageId).resolve("outputs");
    }

    public Path instructions(String stageId) {
        return stageDir(stageId).resolve(INSTRUCTIONS);
    }

    public Path stageHandoff(String stageId) {
        return stageDir(stageId).resolve(HANDOFF);
    }

    public Path rootHandoff() {
        return root.resolve(HANDOFF);
    }

    public Path brief() {
        return root.resolve(BRIEF);
    }

    public Path referencesDir(String stageId) {
        return root.resolve("references").resolve(stageId);
    }

    public Path configDir() {
        return root.resolve(CONFIG);
    }

    public Path stateDir() {
        return root.resolve(STATE);
    }

    public Path progressFile() {
        return stateDir().resolve("progress.json");
    }

    public Path pipelineFile() {
        return stateDir().resolve("pipeline.json");
    }

    public Path executionLog() {
        return stateDir().resolve("execution_log.jsonl");
    }

    public Path debateDir(String stageId) {
        return stateDir().resolve("debates").resolve(stageId);
    }

    public Path stepsDir(String stageId) {
        return stateDir().resolve("steps").resolve(stageId);
    }

    /** Checkpoints live inside the state tree and are excluded from state snapshots. */
    public Path checkpointsDir() {
        return stateDir().resolve(CHECKPOINTS);
    }
}
