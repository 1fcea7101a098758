package com.e2eq.persistence.backend;

import com.e2eq.persistence.config.DatabaseConfig;

import java.nio.file.Path;

/**
 * Creates the backend selected by {@link DatabaseConfig#backend()}. The returned backend is
 * not initialized.
 */
public final class StorageBackends {

    public static final String DEFAULT_JSON_FILE = "data/storage.json";
    public static final String DEFAULT_SQLITE_FILE = "data/storage.db";

    private StorageBackends() {
    }

    public static StorageBackend create(DatabaseConfig config) {
        BackendType type = BackendType.fromName(config.backend());
        switch (type) {
            case JSON:
                return new JsonFileBackend(Path.of(config.connectionString().orElse(DEFAULT_JSON_FILE)),
                        config.cacheSize(), config.autoSave(), config.fileBackupCount());
            case SQLITE:
                return new SqliteBackend(Path.of(config.connectionString().orElse(DEFAULT_SQLITE_FILE)),
                        config.cacheSize(), config.timeout());
            case POSTGRESQL:
                return new PostgreSqlBackend(config);
            default:
                throw new IllegalStateException("Unhandled backend type " + type);
        }
    }
}
