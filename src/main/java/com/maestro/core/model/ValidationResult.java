package com.maestro.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Boolean-plus-detail verdict on a stage's outputs.
 *
 * @param stageId              validated stage
 * @param requiredChecksPassed true when no required check failed
 * @param failedChecks         messages of failed required checks
 * @param score                passed checks divided by total checks
 * @param checks               every check that ran
 */
public record ValidationResult(
        String stageId,
        boolean requiredChecksPassed,
        List<String> failedChecks,
        double score,
        List<ValidationCheck> checks
) implements Serializable {

    public ValidationResult {
        failedChecks = failedChecks == null ? List.of() : List.copyOf(failedChecks);
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public static ValidationResult of(String stageId, List<ValidationCheck> checks) {
        var failed = checks.stream()
                .filter(c -> c.required() && !c.passed())
                .map(ValidationCheck::message)
                .toList();
        long passed = checks.stream().filter(ValidationCheck::passed).count();
        double score = checks.isEmpty() ? 0.0 : (double) passed / checks.size();
        return new ValidationResult(stageId, failed.isEmpty(), failed, score, checks);
    }

    public static ValidationResult failure(String stageId, String reason) {
        return of(stageId, List.of(ValidationCheck.required("Execution", false, reason)));
    }

    /** 0 when everything passed, 1 when a critical check failed, 2 when only high/medium findings remain. */
    public int exitCode() {
        boolean critical = checks.stream().anyMatch(c -> !c.passed() && c.severity() == Severity.CRITICAL);
        if (critical) return 1;
        boolean findings = checks.stream().anyMatch(c -> !c.passed());
        return findings ? 2 : 0;
    }
}
