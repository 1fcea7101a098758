package com.e2eq.persistence.exceptions;

/**
 * A migration or rollback was requested while another one is running on the same runner.
 */
public class MigrationInProgressException extends MigrationException {

    public MigrationInProgressException(String message) {
        super(message);
    }
}
