package com.maestro.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Retry bookkeeping for the stage currently being attempted.
 *
 * @param stageId       stage the attempts belong to
 * @param attempt       number of failed attempts so far (0 to 3)
 * @param failedChecks  validation failures from the most recent attempt
 * @param lastAttemptAt when the most recent attempt failed
 */
public record RetryState(
        String stageId,
        int attempt,
        List<String> failedChecks,
        Instant lastAttemptAt
) implements Serializable {

    public RetryState {
        failedChecks = failedChecks == null ? List.of() : List.copyOf(failedChecks);
    }
}
