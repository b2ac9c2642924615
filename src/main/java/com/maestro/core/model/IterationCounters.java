package com.maestro.core.model;

import java.io.Serializable;

/**
 * Sprint and epic-cycle counters tracked alongside stage progress.
 */
public record IterationCounters(
        int currentSprint,
        int totalSprints,
        int currentCycle,
        int totalCycles
) implements Serializable {

    public static IterationCounters initial() {
        return new IterationCounters(1, 3, 1, 1);
    }

    public boolean hasNextSprint() {
        return currentSprint < totalSprints;
    }

    public boolean hasNextCycle() {
        return currentCycle < totalCycles;
    }

    public IterationCounters nextSprint() {
        return new IterationCounters(currentSprint + 1, totalSprints, currentCycle, totalCycles);
    }

    public IterationCounters nextCycle() {
        return new IterationCounters(1, totalSprints, currentCycle + 1, totalCycles);
    }
}
