package com.maestro.core.models;

import com.maestro.core.model.ResolvedModels;

import java.util.Optional;

/**
 * Availability from the compiled-in registry.
 */
public class BuiltinAvailabilitySource implements ModelAvailabilitySource {

    @Override
    public String name() {
        return ResolvedModels.SOURCE_BUILTIN;
    }

    @Override
    public Optional<ResolvedModels> fetch() {
        return Optional.of(ModelCatalog.builtin());
    }
}
