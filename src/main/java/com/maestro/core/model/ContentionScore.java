package com.maestro.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Inter-agent disagreement measured for one round.
 *
 * @param score          disagreement in [0.0, 1.0]
 * @param recommendation whether to run another round or synthesize
 * @param unresolved     contention items carried into the next round when extending
 */
public record ContentionScore(
        double score,
        Recommendation recommendation,
        List<String> unresolved
) implements Serializable {

    public ContentionScore {
        if (Double.isNaN(score)) {
            score = 0.0;
        }
        score = Math.max(0.0, Math.min(1.0, score));
        unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
    }
}
