package com.e2eq.persistence.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Configuration consumed by the persistence core. Property names are the kebab case
 * form of the method names under the {@code quantum.persistence} prefix, for example
 * {@code quantum.persistence.connection-string}.
 */
@ConfigMapping(prefix = "quantum.persistence")
public interface DatabaseConfig {

    /** One of {@code json}, {@code sqlite} or {@code postgresql}. */
    @WithDefault("sqlite")
    String backend();

    /** File path for json / sqlite, JDBC URL for postgresql. */
    Optional<String> connectionString();

    /** Package that migration units must live in, all discovered units when empty. */
    Optional<String> migrationsLocation();

    @WithDefault("100")
    int cacheSize();

    @WithDefault("10")
    int poolSize();

    /** Operation timeout in seconds. */
    @WithDefault("30")
    int timeout();

    /** Number of auto named backups kept per backend type. */
    @WithDefault("7")
    int backupRetention();

    Optional<String> backupDirectory();

    /** json backend: write the file after every change outside a transaction. */
    @WithDefault("true")
    boolean autoSave();

    /** json backend: number of rotated {@code .bakN} copies of the data file. */
    @WithDefault("3")
    int fileBackupCount();

    Postgresql postgresql();

    interface Postgresql {
        @WithDefault("localhost")
        String host();

        @WithDefault("5432")
        int port();

        @WithDefault("cli_app")
        String database();

        @WithDefault("postgres")
        String username();

        Optional<String> password();
    }
}
