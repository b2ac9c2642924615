package com.maestro.core.state;

import com.maestro.core.model.PipelineSnapshot;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable storage for the pipeline state and per-stage progress of one project.
 * Only the pipeline state machine writes through this interface.
 */
public interface StateStore {

    /** Current snapshot, or empty when the project has not been initialized. */
    Optional<PipelineSnapshot> load();

    void save(PipelineSnapshot snapshot);

    /**
     * Atomically applies {@code change} to the stored snapshot and persists the result.
     *
     * @throws com.maestro.core.exception.PipelineStateException when the project is not initialized
     */
    PipelineSnapshot transition(UnaryOperator<PipelineSnapshot> change);

    default boolean isInitialized() {
        return load().isPresent();
    }
}
