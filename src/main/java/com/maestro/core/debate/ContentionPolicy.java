package com.maestro.core.debate;

import com.maestro.core.model.DebateSettings;
import com.maestro.core.model.Recommendation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decision rules for extending a debate. Pure functions, no Spring dependencies.
 */
public final class ContentionPolicy {

    /** Default disagreement level at or above which a debate is extended. */
    public static final double DEFAULT_THRESHOLD = 0.5;

    /** Upper bound on contention items carried out of the first evaluated round. */
    public static final int MAX_FOCUS_ITEMS = 10;

    private ContentionPolicy() {}

    /**
     * Applied in this order: below the minimum round count always extend; at or above the
     * threshold extend while rounds remain; otherwise, or once the maximum is reached, synthesize.
     *
     * @param round     the round just completed (1-based)
     * @param score     contention score of that round
     * @param settings  round bounds of the stage
     * @param threshold extension threshold
     */
    public static Recommendation decide(int round, double score, DebateSettings settings, double threshold) {
        if (round >= settings.maxRounds()) {
            return Recommendation.SYNTHESIZE;
        }
        if (round < settings.minRounds()) {
            return Recommendation.EXTEND;
        }
        if (score >= threshold) {
            return Recommendation.EXTEND;
        }
        return Recommendation.SYNTHESIZE;
    }

    /**
     * Focus for the next round: only the unresolved items, de-duplicated, and never more
     * items than the previous round's focus.
     */
    public static List<String> narrowFocus(List<String> previousFocus, List<String> unresolved) {
        int limit = previousFocus == null || previousFocus.isEmpty() ? MAX_FOCUS_ITEMS : previousFocus.size();
        Set<String> distinct = new LinkedHashSet<>();
        for (String item : unresolved) {
            if (item != null && !item.isBlank()) {
                distinct.add(item.trim());
            }
        }
        var focus = new ArrayList<String>();
        for (String item : distinct) {
            if (focus.size() >= limit) break;
            focus.add(item);
        }
        return List.copyOf(focus);
    }
}
