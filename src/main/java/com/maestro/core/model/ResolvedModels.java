package com.maestro.core.model;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.Map;

/**
 * Availability snapshot of every model tier.
 *
 * @param source    "manifest" or "builtin"
 * @param tiers     tier to concrete id and availability
 * @param timestamp manifest freshness stamp
 */
public record ResolvedModels(
        String source,
        Map<ModelTier, TierInfo> tiers,
        String timestamp
) implements Serializable {

    public static final String SOURCE_MANIFEST = "manifest";
    public static final String SOURCE_BUILTIN = "builtin";

    public ResolvedModels {
        tiers = tiers == null || tiers.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(tiers));
    }

    public boolean isAvailable(ModelTier tier) {
        TierInfo info = tiers.get(tier);
        return info != null && info.available();
    }

    public String modelId(ModelTier tier) {
        TierInfo info = tiers.get(tier);
        return info != null ? info.id() : null;
    }
}
