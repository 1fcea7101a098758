package com.e2eq.persistence.exceptions;

public class MigrationException extends RuntimeException {

    protected final Long version;
    protected final String migrationName;

    public MigrationException(String message) {
        super(message);
        this.version = null;
        this.migrationName = null;
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
        this.version = null;
        this.migrationName = null;
    }

    public MigrationException(long version, String migrationName, String message) {
        super(buildMessage(version, migrationName, message));
        this.version = version;
        this.migrationName = migrationName;
    }

    public MigrationException(long version, String migrationName, String message, Throwable cause) {
        super(buildMessage(version, migrationName, message), cause);
        this.version = version;
        this.migrationName = migrationName;
    }

    private static String buildMessage(long version, String migrationName, String message) {
        return String.format("Migration %s (version %d) %s", migrationName, version, message);
    }

    /**
     * Version of the failing migration, null when the failure is not tied to one migration.
     */
    public Long getVersion() {
        return version;
    }

    public String getMigrationName() {
        return migrationName;
    }
}
