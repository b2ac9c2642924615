package com.maestro.core.exception;

/**
 * A single agent invocation failed or timed out.
 */
public class AgentInvocationException extends MaestroException {

    public AgentInvocationException(String message) {
        super(message);
    }

    public AgentInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
