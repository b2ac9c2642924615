package com.maestro.core.exception;

/**
 * Invalid pipeline definition or settings, such as a LIGHT stage configured with more than one round.
 */
public class ConfigurationException extends MaestroException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
