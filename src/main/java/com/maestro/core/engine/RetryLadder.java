package com.maestro.core.engine;

import com.maestro.core.model.RetryState;

import java.time.Instant;
import java.util.List;

/**
 * Bounded retry policy for stages that fail validation.
 * <ol>
 *   <li>First failure: re-run with the specific failures appended to the directive.</li>
 *   <li>Second failure: re-run with the directive reduced to a file-by-file requirement list.</li>
 *   <li>Third failure: stop. The stage fails and the pipeline pauses.</li>
 * </ol>
 */
public final class RetryLadder {

    public static final int MAX_ATTEMPTS = 3;

    private RetryLadder() {}

    public enum Action {
        RETRY_WITH_FAILURES,
        RETRY_WITH_REQUIREMENTS,
        PAUSE
    }

    /**
     * @param retry    retry state after recording the failure
     * @param action   what happens next
     * @param failures the failures that triggered this decision
     */
    public record Decision(RetryState retry, Action action, List<String> failures) {

        public boolean paused() {
            return action == Action.PAUSE;
        }
    }

    /**
     * Records one more failed attempt for {@code stageId}. A retry state belonging to another
     * stage is discarded.
     */
    public static Decision onFailure(RetryState current, String stageId, List<String> failures, Instant now) {
        int previous = current != null && stageId.equals(current.stageId()) ? current.attempt() : 0;
        int attempt = Math.min(previous + 1, MAX_ATTEMPTS);
        var retry = new RetryState(stageId, attempt, failures, now);
        Action action = switch (attempt) {
            case 1 -> Action.RETRY_WITH_FAILURES;
            case 2 -> Action.RETRY_WITH_REQUIREMENTS;
            default -> Action.PAUSE;
        };
        return new Decision(retry, action, retry.failedChecks());
    }

    /**
     * Rewrites a stage directive for the next attempt.
     *
     * @param directive    the directive as originally assembled
     * @param retry        retry state of the stage (attempt 0 or null leaves the directive unchanged)
     * @param requirements file-by-file requirements of the stage
     */
    public static String amend(String directive, RetryState retry, List<String> requirements) {
        if (retry == null || retry.attempt() == 0) {
            return directive;
        }
        var sb = new StringBuilder();
        if (retry.attempt() == 1) {
            sb.append(directive).append("\n\n");
            sb.append("## Previous Attempt Failed Validation\n\n");
            sb.append("Fix every one of these problems:\n");
            retry.failedChecks().forEach(f -> sb.append("- ").append(f).append("\n"));
            return sb.toString();
        }
        sb.append("# Retry ").append(retry.attempt() + 1).append(" of ").append(MAX_ATTEMPTS).append("\n\n");
        sb.append("Earlier attempts did not produce valid outputs. Produce exactly the following, nothing else:\n\n");
        for (int i = 0; i < requirements.size(); i++) {
            sb.append(i + 1).append(". ").append(requirements.get(i)).append("\n");
        }
        if (!retry.failedChecks().isEmpty()) {
            sb.append("\nStill failing:\n");
            retry.failedChecks().forEach(f -> sb.append("- ").append(f).append("\n"));
        }
        return sb.toString();
    }
}
