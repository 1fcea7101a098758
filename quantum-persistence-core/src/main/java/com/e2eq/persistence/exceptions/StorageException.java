package com.e2eq.persistence.exceptions;

/**
 * A storage backend could not read, write or query its underlying store.
 */
public class StorageException extends DatabaseException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
