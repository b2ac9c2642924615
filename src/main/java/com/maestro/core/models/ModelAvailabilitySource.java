package com.maestro.core.models;

import com.maestro.core.model.ResolvedModels;

import java.util.Optional;

/**
 * A provider of model-tier availability. Returning empty or throwing means "unknown, ask the next source".
 */
public interface ModelAvailabilitySource {

    String name();

    Optional<ResolvedModels> fetch();
}
