package com.maestro.core.model;

/**
 * Severity of a validation finding. Drives the validator exit code.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM
}
