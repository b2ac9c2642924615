package com.maestro.core.exception;

/**
 * Pipeline state could not be read from or written to durable storage.
 */
public class StateStoreException extends MaestroException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
