package com.maestro.core.engine;

import com.maestro.core.model.RetryState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryLadderTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    @Test
    @DisplayName("walks failures, requirements, pause")
    void ladderOrder() {
        var first = RetryLadder.onFailure(null, "03-planning", List.of("missing architecture.md"), NOW);
        assertEquals(RetryLadder.Action.RETRY_WITH_FAILURES, first.action());
        assertEquals(1, first.retry().attempt());

        var second = RetryLadder.onFailure(first.retry(), "03-planning", List.of("still missing"), NOW);
        assertEquals(RetryLadder.Action.RETRY_WITH_REQUIREMENTS, second.action());
        assertEquals(2, second.retry().attempt());

        var third = RetryLadder.onFailure(second.retry(), "03-planning", List.of("still missing"), NOW);
        assertTrue(third.paused());
        assertEquals(3, third.retry().attempt());
    }

    @Test
    @DisplayName("attempt count never exceeds the maximum")
    void bounded() {
        var exhausted = new RetryState("03-planning", RetryLadder.MAX_ATTEMPTS, List.of(), NOW);
        var again = RetryLadder.onFailure(exhausted, "03-planning", List.of("x"), NOW);
        assertEquals(RetryLadder.MAX_ATTEMPTS, again.retry().attempt());
        assertTrue(again.paused());
    }

    @Test
    @DisplayName("retry state of another stage is discarded")
    void otherStageReset() {
        var other = new RetryState("02-research", 2, List.of(), NOW);
        var decision = RetryLadder.onFailure(other, "03-planning", List.of("x"), NOW);
        assertEquals(1, decision.retry().attempt());
        assertEquals("03-planning", decision.retry().stageId());
    }

    @Test
    @DisplayName("first retry appends the failures to the directive")
    void amendWithFailures() {
        var retry = new RetryState("03-planning", 1, List.of("Missing section: ## Risks"), NOW);
        String amended = RetryLadder.amend("Original directive", retry, List.of("architecture.md"));

        assertTrue(amended.startsWith("Original directive"));
        assertTrue(amended.contains("- Missing section: ## Risks"));
    }

    @Test
    @DisplayName("second retry replaces the directive with the requirement list")
    void amendWithRequirements() {
        var retry = new RetryState("03-planning", 2, List.of("too small"), NOW);
        String amended = RetryLadder.amend("Original directive", retry,
                List.of("stages/03-planning/outputs/architecture.md", "stages/03-planning/outputs/plan.md"));

        assertFalse(amended.contains("Original directive"));
        assertTrue(amended.contains("1. stages/03-planning/outputs/architecture.md"));
        assertTrue(amended.contains("2. stages/03-planning/outputs/plan.md"));
        assertTrue(amended.contains("- too small"));
    }

    @Test
    @DisplayName("no retry leaves the directive unchanged")
    void amendNoRetry() {
        assertEquals("d", RetryLadder.amend("d", null, List.of()));
        assertEquals("d", RetryLadder.amend("d", new RetryState("x", 0, List.of(), NOW), List.of()));
    }
}
