package com.maestro.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Resolved tier per (stage, role-index), per stage default and per stage persona.
 * Computed once per run from one {@link ResolvedModels} snapshot and never mutated.
 */
public record ModelAssignment(
        Map<String, List<ModelTier>> stageRoles,
        Map<String, ModelTier> stageDefaults,
        Map<String, ModelTier> personas,
        ResolvedModels basis
) implements Serializable {

    public ModelAssignment {
        stageRoles = Map.copyOf(stageRoles);
        stageDefaults = Map.copyOf(stageDefaults);
        personas = Map.copyOf(personas);
    }

    /** Tier for one role; indices beyond the table use the stage default. */
    public ModelTier roleFor(String stageId, int roleIndex) {
        List<ModelTier> roles = stageRoles.get(stageId);
        if (roles != null && roleIndex >= 0 && roleIndex < roles.size()) {
            return roles.get(roleIndex);
        }
        return defaultFor(stageId);
    }

    public ModelTier defaultFor(String stageId) {
        return stageDefaults.getOrDefault(stageId, ModelTier.mid());
    }

    public ModelTier personaFor(String stageId) {
        return personas.getOrDefault(stageId, defaultFor(stageId));
    }
}
