package com.maestro.core.state;

import com.maestro.core.model.PipelineStatus;

/**
 * Lets a running stage protocol notice a pause written by {@code maestro pause} or by the
 * state machine. Protocols consult it at round and step boundaries.
 */
public class PauseSignal {

    private final StateStore store;

    public PauseSignal(StateStore store) {
        this.store = store;
    }

    /**
     * @throws com.maestro.core.exception.StateStoreException when the stored state cannot be read
     */
    public boolean isRequested() {
        return store.load()
                .map(s -> s.pipeline().status() == PipelineStatus.PAUSED)
                .orElse(false);
    }
}
