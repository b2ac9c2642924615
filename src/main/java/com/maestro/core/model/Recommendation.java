package com.maestro.core.model;

/**
 * Outcome of evaluating one debate round.
 */
public enum Recommendation {
    EXTEND,
    SYNTHESIZE
}
