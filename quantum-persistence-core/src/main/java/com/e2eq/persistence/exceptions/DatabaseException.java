package com.e2eq.persistence.exceptions;

/**
 * Connection failures, backup / restore I/O failures and restore compatibility
 * mismatches. Surfaced to the caller as is, there is no automatic retry.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
