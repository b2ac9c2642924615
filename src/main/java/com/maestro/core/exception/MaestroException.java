package com.maestro.core.exception;

/**
 * Root of the unchecked exceptions raised by the pipeline core.
 */
public class MaestroException extends RuntimeException {

    public MaestroException(String message) {
        super(message);
    }

    public MaestroException(String message, Throwable cause) {
        super(message, cause);
    }
}
