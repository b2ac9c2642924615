package com.maestro.core.model;

import java.io.Serializable;

/**
 * A single validation check on a stage's outputs.
 */
public record ValidationCheck(
        String name,
        boolean passed,
        String message,
        boolean required,
        Severity severity
) implements Serializable {

    public static ValidationCheck required(String name, boolean passed, String message) {
        return new ValidationCheck(name, passed, message, true, Severity.CRITICAL);
    }

    public static ValidationCheck optional(String name, boolean passed, String message, Severity severity) {
        return new ValidationCheck(name, passed, message, false, severity);
    }
}
