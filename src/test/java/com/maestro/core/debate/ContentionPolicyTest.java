package com.maestro.core.debate;

import com.maestro.core.model.DebateSettings;
import com.maestro.core.model.Recommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentionPolicyTest {

    private static final double THRESHOLD = ContentionPolicy.DEFAULT_THRESHOLD;

    @Nested
    @DisplayName("decide")
    class Decide {

        private final DebateSettings full = new DebateSettings(3, 2, 4);

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 0.1, 0.49, 0.5, 1.0})
        @DisplayName("below min rounds always extends")
        void belowMinAlwaysExtends(double score) {
            assertEquals(Recommendation.EXTEND, ContentionPolicy.decide(1, score, full, THRESHOLD));
        }

        @Test
        @DisplayName("at min rounds the score decides")
        void atMinScoreDecides() {
            assertEquals(Recommendation.EXTEND, ContentionPolicy.decide(2, 0.5, full, THRESHOLD));
            assertEquals(Recommendation.SYNTHESIZE, ContentionPolicy.decide(2, 0.49, full, THRESHOLD));
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 0.9, 1.0})
        @DisplayName("reaching max rounds forces synthesis")
        void maxForcesSynthesis(double score) {
            assertEquals(Recommendation.SYNTHESIZE, ContentionPolicy.decide(4, score, full, THRESHOLD));
        }

        @Test
        @DisplayName("single-round bounds synthesize immediately")
        void singleRound() {
            var light = new DebateSettings(2, 1, 1);
            assertEquals(Recommendation.SYNTHESIZE, ContentionPolicy.decide(1, 1.0, light, THRESHOLD));
        }

        @Test
        @DisplayName("threshold is configurable")
        void configurableThreshold() {
            var standard = new DebateSettings(3, 1, 3);
            assertEquals(Recommendation.EXTEND, ContentionPolicy.decide(1, 0.6, standard, 0.5));
            assertEquals(Recommendation.SYNTHESIZE, ContentionPolicy.decide(1, 0.6, standard, 0.7));
        }
    }

    @Nested
    @DisplayName("narrowFocus")
    class NarrowFocus {

        @Test
        @DisplayName("keeps unresolved items, de-duplicated and trimmed")
        void deduplicates() {
            var focus = ContentionPolicy.narrowFocus(List.of(), List.of(" caching ", "caching", "auth", ""));
            assertEquals(List.of("caching", "auth"), focus);
        }

        @Test
        @DisplayName("never grows beyond the previous focus")
        void neverGrows() {
            var focus = ContentionPolicy.narrowFocus(List.of("a", "b"), List.of("x", "y", "z"));
            assertEquals(List.of("x", "y"), focus);
        }

        @Test
        @DisplayName("first focus is capped")
        void firstFocusCapped() {
            var many = Collections.nCopies(30, "item").stream()
                    .map(s -> s + Math.random())
                    .toList();
            assertEquals(ContentionPolicy.MAX_FOCUS_ITEMS, ContentionPolicy.narrowFocus(null, many).size());
        }
    }
}
