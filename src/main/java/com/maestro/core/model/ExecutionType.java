package com.maestro.core.model;

/**
 * Protocol actually used to produce a stage's artifacts, as recorded in the execution log.
 */
public enum ExecutionType {
    DEBATE,
    SEQUENTIAL,
    SINGLE_AGENT
}
