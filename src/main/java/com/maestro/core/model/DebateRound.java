package com.maestro.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One settled round of a stage debate. Rounds are append-only.
 *
 * @param number      1-based round number
 * @param artifacts   role name to produced artifact (round 1)
 * @param reviews     role name to review or rebuttal artifact (round 2 onward)
 * @param failedRoles roles whose invocation failed in this round
 * @param focus       unresolved contention items this round was asked to address
 * @param contention  evaluation of this round (nullable when not evaluated)
 */
public record DebateRound(
        int number,
        Map<String, String> artifacts,
        Map<String, String> reviews,
        List<String> failedRoles,
        List<String> focus,
        ContentionScore contention
) implements Serializable {

    public DebateRound {
        artifacts = artifacts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
        reviews = reviews == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(reviews));
        failedRoles = failedRoles == null ? List.of() : List.copyOf(failedRoles);
        focus = focus == null ? List.of() : List.copyOf(focus);
    }

    /** Whatever this round produced: artifacts in round 1, reviews afterwards. */
    public Map<String, String> outputs() {
        return number == 1 ? artifacts : reviews;
    }

    public DebateRound withContention(ContentionScore score) {
        return new DebateRound(number, artifacts, reviews, failedRoles, focus, score);
    }
}
