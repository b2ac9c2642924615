package com.maestro.core.models;

import com.maestro.core.model.ModelTier;
import com.maestro.core.model.ResolvedModels;
import com.maestro.core.model.TierInfo;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static model tables: the offline availability registry and the ideal tier of every
 * (stage, role-index) pair and every stage. Ideal tiers are keyed by stage slug so the
 * same table serves every pipeline version.
 */
public final class ModelCatalog {

    private ModelCatalog() {}

    public static final String BUILTIN_TIMESTAMP = "2025-05-01";

    private static final Map<ModelTier, TierInfo> BUILTIN_TIERS = Map.of(
            ModelTier.REASONING, new TierInfo("claude-opus-4-5-20251101", true),
            ModelTier.BALANCED, new TierInfo("claude-sonnet-4-20250514", true),
            ModelTier.FAST, new TierInfo("claude-haiku-4-20250414", true)
    );

    private static final Map<String, List<ModelTier>> ROLE_IDEAL_TIERS = Map.of(
            "brainstorm", List.of(ModelTier.REASONING, ModelTier.BALANCED, ModelTier.BALANCED),
            "research", List.of(ModelTier.BALANCED, ModelTier.BALANCED, ModelTier.BALANCED),
            "planning", List.of(ModelTier.REASONING, ModelTier.REASONING, ModelTier.BALANCED),
            "ui-ux", List.of(ModelTier.BALANCED, ModelTier.BALANCED, ModelTier.FAST),
            "task-management", List.of(ModelTier.FAST, ModelTier.FAST),
            "implementation", List.of(ModelTier.BALANCED, ModelTier.REASONING, ModelTier.BALANCED),
            "refactoring", List.of(ModelTier.REASONING, ModelTier.BALANCED, ModelTier.FAST),
            "qa", List.of(ModelTier.REASONING, ModelTier.BALANCED, ModelTier.BALANCED),
            "testing", List.of(ModelTier.BALANCED, ModelTier.BALANCED, ModelTier.BALANCED),
            "deployment", List.of(ModelTier.FAST, ModelTier.BALANCED)
    );

    private static final Map<String, ModelTier> STAGE_IDEAL_TIERS = Map.of(
            "brainstorm", ModelTier.REASONING,
            "research", ModelTier.BALANCED,
            "planning", ModelTier.REASONING,
            "ui-ux", ModelTier.BALANCED,
            "task-management", ModelTier.FAST,
            "implementation", ModelTier.BALANCED,
            "refactoring", ModelTier.REASONING,
            "qa", ModelTier.BALANCED,
            "testing", ModelTier.BALANCED,
            "deployment", ModelTier.FAST
    );

    /** The offline registry; always succeeds. */
    public static ResolvedModels builtin() {
        return new ResolvedModels(ResolvedModels.SOURCE_BUILTIN, new EnumMap<>(BUILTIN_TIERS), BUILTIN_TIMESTAMP);
    }

    public static List<ModelTier> idealRoleTiers(String stageSlug) {
        return ROLE_IDEAL_TIERS.getOrDefault(stageSlug, List.of());
    }

    public static ModelTier idealStageTier(String stageSlug) {
        return STAGE_IDEAL_TIERS.getOrDefault(stageSlug, ModelTier.mid());
    }
}
