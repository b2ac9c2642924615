package com.maestro.core.exception;

/**
 * A checkpoint could not be created, restored or deleted.
 */
public class CheckpointException extends MaestroException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
