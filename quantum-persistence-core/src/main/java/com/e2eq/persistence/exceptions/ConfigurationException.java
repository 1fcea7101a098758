package com.e2eq.persistence.exceptions;

/**
 * Raised for an unsupported backend name or a malformed configuration.
 * Always thrown before any storage I/O takes place.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
