package com.maestro.core.state;

import com.maestro.core.exception.PipelineStateException;
import com.maestro.core.model.PipelineSnapshot;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Non-durable {@link StateStore}, used for dry runs and tests.
 */
public class InMemoryStateStore implements StateStore {

    private PipelineSnapshot snapshot;

    @Override
    public synchronized Optional<PipelineSnapshot> load() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public synchronized void save(PipelineSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    @Override
    public synchronized PipelineSnapshot transition(UnaryOperator<PipelineSnapshot> change) {
        if (snapshot == null) {
            throw new PipelineStateException("Pipeline is not initialized");
        }
        snapshot = change.apply(snapshot);
        return snapshot;
    }
}
