package com.maestro.core.exception;

/**
 * An operation was attempted in a pipeline state that does not allow it.
 */
public class PipelineStateException extends MaestroException {

    public PipelineStateException(String message) {
        super(message);
    }

    public PipelineStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
