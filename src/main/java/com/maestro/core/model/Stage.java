package com.maestro.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;

/**
 * One ordered unit of the pipeline.
 *
 * @param id             stage identifier, e.g. "03-planning"
 * @param name           human-readable name
 * @param mode           debate or sequential execution
 * @param intensity      debate intensity profile (ignored for sequential stages)
 * @param debate         effective agent count and round bounds
 * @param roles          debate role names, or sequential step names, in role-index order
 * @param prerequisites  stage ids that must be completed or skipped before this stage starts
 * @param codeProducing  whether the stage must pass the build/test gate
 * @param primaryOutput  file name under {@code stages/<id>/outputs/} receiving the final artifact
 * @param focus          persona focus line used in the stage directive
 */
public record Stage(
        String id,
        String name,
        ExecutionMode mode,
        Intensity intensity,
        DebateSettings debate,
        List<String> roles,
        List<String> prerequisites,
        boolean codeProducing,
        String primaryOutput,
        String focus
) implements Serializable {

    /** Stage id without its numeric ordering prefix ("03-planning" becomes "planning"). */
    public String slug() {
        return id.replaceFirst("^\\d+-", "");
    }

    @JsonIgnore
    public boolean isDebate() {
        return mode == ExecutionMode.DEBATE;
    }

    public Stage withIntensity(Intensity newIntensity) {
        return new Stage(id, name, mode, newIntensity, DebateSettings.of(newIntensity, roles.size()),
                roles, prerequisites, codeProducing, primaryOutput, focus);
    }

    public Stage withDebate(DebateSettings settings) {
        return new Stage(id, name, mode, intensity, settings, roles, prerequisites,
                codeProducing, primaryOutput, focus);
    }
}
