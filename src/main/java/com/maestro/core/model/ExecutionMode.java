package com.maestro.core.model;

/**
 * How a stage produces its artifacts.
 */
public enum ExecutionMode {
    /** Multi-round, multi-role production, cross-review and synthesis. */
    DEBATE,
    /** Fixed ordered list of named steps, each seeing all prior step outputs. */
    SEQUENTIAL
}
