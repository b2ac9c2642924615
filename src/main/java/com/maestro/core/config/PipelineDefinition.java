package com.maestro.core.config;

import com.maestro.core.exception.ConfigurationException;
import com.maestro.core.model.Intensity;
import com.maestro.core.model.PipelineState;
import com.maestro.core.model.Stage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The selected pipeline version's ordered, immutable stage list.
 * Built once at startup and passed through the component graph.
 */
public record PipelineDefinition(String version, List<Stage> stages) {

    public PipelineDefinition {
        stages = List.copyOf(stages);
    }

    /**
     * Builds the definition for a version, applies per-stage intensity overrides and validates it.
     *
     * @throws ConfigurationException when the version, an override or the resulting layout is invalid
     */
    public static PipelineDefinition of(String version, Map<String, String> intensityOverrides) {
        String normalized = version == null ? StageCatalog.CLASSIC : version.trim().toLowerCase(Locale.ROOT);
        var stages = new ArrayList<>(StageCatalog.forVersion(normalized));
        if (intensityOverrides != null) {
            intensityOverrides.forEach((stageId, value) -> {
                int idx = indexIn(stages, stageId);
                if (idx < 0) {
                    throw new ConfigurationException("Intensity override for unknown stage: " + stageId);
                }
                Intensity intensity;
                try {
                    intensity = Intensity.valueOf(value.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("Invalid intensity '" + value + "' for stage " + stageId, e);
                }
                stages.set(idx, stages.get(idx).withIntensity(intensity));
            });
        }
        var definition = new PipelineDefinition(normalized, stages);
        definition.validate();
        return definition;
    }

    /**
     * Rejects duplicate ids, unknown or forward prerequisites, empty role lists and invalid round bounds.
     */
    public void validate() {
        if (stages.isEmpty()) {
            throw new ConfigurationException("Pipeline '" + version + "' has no stages");
        }
        Set<String> seen = new HashSet<>();
        for (Stage stage : stages) {
            if (PipelineState.COMPLETE.equals(stage.id()) || !seen.add(stage.id())) {
                throw new ConfigurationException("Duplicate or reserved stage id: " + stage.id());
            }
            for (String prereq : stage.prerequisites()) {
                if (!seen.contains(prereq) || prereq.equals(stage.id())) {
                    throw new ConfigurationException("Stage " + stage.id()
                            + " declares prerequisite '" + prereq + "' that is unknown or not earlier in the pipeline");
                }
            }
            if (stage.roles().isEmpty()) {
                throw new ConfigurationException("Stage " + stage.id() + " has no roles or steps");
            }
            if (stage.isDebate()) {
                validateDebate(stage);
            }
        }
    }

    private static void validateDebate(Stage stage) {
        var d = stage.debate();
        if (d.agents() < 1 || d.agents() > stage.roles().size()) {
            throw new ConfigurationException("Stage " + stage.id() + ": agent count " + d.agents()
                    + " must be between 1 and " + stage.roles().size());
        }
        if (d.minRounds() < 1 || d.maxRounds() < d.minRounds()) {
            throw new ConfigurationException("Stage " + stage.id() + ": invalid round bounds min="
                    + d.minRounds() + " max=" + d.maxRounds());
        }
        if (stage.intensity() == Intensity.LIGHT && (d.minRounds() != 1 || d.maxRounds() != 1)) {
            throw new ConfigurationException("Stage " + stage.id()
                    + ": light intensity runs exactly one round (min_rounds = max_rounds = 1)");
        }
    }

    public Stage first() {
        return stages.get(0);
    }

    public Optional<Stage> find(String stageId) {
        return stages.stream().filter(s -> s.id().equals(stageId)).findFirst();
    }

    /**
     * @throws ConfigurationException when the id is not a stage of this pipeline
     */
    public Stage stage(String stageId) {
        return find(stageId).orElseThrow(() -> new ConfigurationException(
                "Unknown stage '" + stageId + "' for pipeline " + version));
    }

    public int indexOf(String stageId) {
        return indexIn(stages, stageId);
    }

    /** The stage after the given one, or empty at the end of the pipeline. */
    public Optional<Stage> next(String stageId) {
        int idx = indexOf(stageId);
        if (idx < 0 || idx + 1 >= stages.size()) {
            return Optional.empty();
        }
        return Optional.of(stages.get(idx + 1));
    }

    public Optional<Stage> previous(String stageId) {
        int idx = indexOf(stageId);
        return idx > 0 ? Optional.of(stages.get(idx - 1)) : Optional.empty();
    }

    public List<String> stageIds() {
        return stages.stream().map(Stage::id).toList();
    }

    private static int indexIn(List<Stage> stages, String stageId) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).id().equals(stageId)) {
                return i;
            }
        }
        return -1;
    }
}
