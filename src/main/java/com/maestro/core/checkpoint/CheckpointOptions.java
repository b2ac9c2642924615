package com.maestro.core.checkpoint;

/**
 * Which project trees a new checkpoint captures.
 */
public record CheckpointOptions(boolean includeStages, boolean includeState, boolean includeConfig) {

    public static CheckpointOptions defaults() {
        return new CheckpointOptions(true, true, false);
    }

    public CheckpointOptions withConfig(boolean include) {
        return new CheckpointOptions(includeStages, includeState, include);
    }
}
