package com.maestro.core.models;

import com.maestro.core.config.PipelineDefinition;
import com.maestro.core.fallback.FallbackChain;
import com.maestro.core.model.ModelAssignment;
import com.maestro.core.model.ModelTier;
import com.maestro.core.model.ResolvedModels;
import com.maestro.core.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves abstract model tiers for every stage role, stage default and stage persona.
 * <p>
 * Availability is read once per run through a fallback chain of sources ending in the
 * built-in registry; the resulting {@link ModelAssignment} is memoized until {@link #refresh()}.
 */
public class ModelTierResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelTierResolver.class);

    private final PipelineDefinition pipeline;
    private final List<ModelAvailabilitySource> sources;

    private ModelAssignment assignment;

    /**
     * @param sources availability sources in priority order; the built-in registry is always appended
     */
    public ModelTierResolver(PipelineDefinition pipeline, List<ModelAvailabilitySource> sources) {
        this.pipeline = pipeline;
        this.sources = List.copyOf(sources);
    }

    public synchronized ModelAssignment assignment() {
        if (assignment == null) {
            assignment = assign(resolveAvailability());
        }
        return assignment;
    }

    /** Drops the memoized assignment so the next call re-reads availability. */
    public synchronized ModelAssignment refresh() {
        assignment = null;
        return assignment();
    }

    public ModelTier tierFor(String stageId, int roleIndex) {
        return assignment().roleFor(stageId, roleIndex);
    }

    public ModelTier personaTier(String stageId) {
        return assignment().personaFor(stageId);
    }

    ResolvedModels resolveAvailability() {
        var builder = FallbackChain.<ResolvedModels>named("model-availability");
        for (ModelAvailabilitySource source : sources) {
            builder.then(source.name(), source::fetch);
        }
        var resolution = builder.orElse(ResolvedModels.SOURCE_BUILTIN, ModelCatalog::builtin).resolve();
        log.info("Model availability resolved from {} (timestamp {})",
                resolution.value().source(), resolution.value().timestamp());
        return resolution.value();
    }

    /**
     * Maps every stage of the pipeline to tiers under one availability snapshot.
     */
    public ModelAssignment assign(ResolvedModels resolved) {
        Map<String, List<ModelTier>> stageRoles = new HashMap<>();
        Map<String, ModelTier> stageDefaults = new HashMap<>();
        Map<String, ModelTier> personas = new HashMap<>();

        for (Stage stage : pipeline.stages()) {
            List<ModelTier> ideals = ModelCatalog.idealRoleTiers(stage.slug());
            var tiers = new ArrayList<ModelTier>();
            for (int i = 0; i < stage.roles().size(); i++) {
                ModelTier ideal = i < ideals.size() ? ideals.get(i) : ModelCatalog.idealStageTier(stage.slug());
                tiers.add(resolveTier(ideal, resolved));
            }
            stageRoles.put(stage.id(), tiers);
            ModelTier stageTier = resolveTier(ModelCatalog.idealStageTier(stage.slug()), resolved);
            stageDefaults.put(stage.id(), stageTier);
            personas.put(stage.id(), stageTier);
        }
        return new ModelAssignment(stageRoles, stageDefaults, personas, resolved);
    }

    /**
     * Ideal tier if available, else the mid tier if available, else the mid tier regardless.
     */
    public static ModelTier resolveTier(ModelTier ideal, ResolvedModels resolved) {
        return FallbackChain.<ModelTier>named("tier")
                .when("ideal", resolved.isAvailable(ideal), () -> ideal)
                .when("mid", resolved.isAvailable(ModelTier.mid()), ModelTier::mid)
                .orElse("mid-unchecked", ModelTier::mid)
                .resolve()
                .value();
    }
}
