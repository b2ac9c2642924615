package com.maestro.core.model;

import java.io.Serializable;

/**
 * Effective agent count and round bounds for one debate stage.
 *
 * @param agents    number of concurrently invoked roles per round
 * @param minRounds mandatory minimum number of rounds
 * @param maxRounds hard upper bound on rounds
 */
public record DebateSettings(int agents, int minRounds, int maxRounds) implements Serializable {

    public static DebateSettings of(Intensity intensity, int availableRoles) {
        return new DebateSettings(
                Math.min(intensity.defaultAgents(), availableRoles),
                intensity.defaultMinRounds(),
                intensity.defaultMaxRounds());
    }
}
