package com.maestro.core.model;

/**
 * Debate intensity profile. Determines the default agent count and round bounds
 * for a debate stage, and whether cross-review and contention scoring run at all.
 */
public enum Intensity {
    FULL(3, 2, 4),
    STANDARD(3, 1, 3),
    LIGHT(2, 1, 1);

    private final int defaultAgents;
    private final int defaultMinRounds;
    private final int defaultMaxRounds;

    Intensity(int defaultAgents, int defaultMinRounds, int defaultMaxRounds) {
        this.defaultAgents = defaultAgents;
        this.defaultMinRounds = defaultMinRounds;
        this.defaultMaxRounds = defaultMaxRounds;
    }

    public int defaultAgents() {
        return defaultAgents;
    }

    public int defaultMinRounds() {
        return defaultMinRounds;
    }

    public int defaultMaxRounds() {
        return defaultMaxRounds;
    }

    /** Round 2 cross-review is skipped at light intensity. */
    public boolean crossReview() {
        return this != LIGHT;
    }

    /** Contention scoring only runs for full and standard intensity. */
    public boolean contentionEvaluation() {
        return this != LIGHT;
    }
}
