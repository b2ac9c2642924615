package com.maestro.core.checkpoint;

import java.util.List;

/**
 * What a restore brings back.
 *
 * @param restoreStages replace {@code stages/} wholesale
 * @param restoreState  replace {@code state/} wholesale, except the checkpoints directory
 * @param restoreConfig replace {@code config/} wholesale
 * @param files         when non-empty, a partial restore of only these project-relative paths
 */
public record RestoreOptions(boolean restoreStages, boolean restoreState, boolean restoreConfig, List<String> files) {

    public RestoreOptions {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static RestoreOptions full() {
        return new RestoreOptions(true, true, false, List.of());
    }

    public static RestoreOptions partial(List<String> files) {
        return new RestoreOptions(false, false, false, files);
    }

    public boolean isPartial() {
        return !files.isEmpty();
    }

    /** Whether the restore rewrites {@code state/progress.json} or {@code state/pipeline.json}. */
    public boolean touchesState() {
        if (isPartial()) {
            return files.stream().anyMatch(f -> f.replace('\\', '/').startsWith("state"));
        }
        return restoreState;
    }
}
