package com.e2eq.persistence.config;

import com.e2eq.persistence.backend.BackendType;
import com.e2eq.persistence.exceptions.ConfigurationException;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link DatabaseConfig} instances outside of a CDI container.
 */
public final class DatabaseConfigs {

    private static final int PROGRAMMATIC_ORDINAL = 500;

    private DatabaseConfigs() {
    }

    /**
     * Resolves the configuration from system properties, environment variables and
     * {@code META-INF/microprofile-config.properties}, in that priority.
     */
    public static DatabaseConfig load() {
        return build(new SmallRyeConfigBuilder().addDefaultSources());
    }

    /**
     * Resolves the configuration only from the given properties, falling back to defaults.
     *
     * @param properties fully qualified property names, e.g. {@code quantum.persistence.backend}
     */
    public static DatabaseConfig fromProperties(Map<String, String> properties) {
        return build(new SmallRyeConfigBuilder()
                        .withSources(new PropertiesConfigSource(properties, "programmatic", PROGRAMMATIC_ORDINAL)));
    }

    private static DatabaseConfig build(SmallRyeConfigBuilder builder) {
        DatabaseConfig config;
        try {
            SmallRyeConfig smallRyeConfig = builder.withMapping(DatabaseConfig.class).build();
            config = smallRyeConfig.getConfigMapping(DatabaseConfig.class);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Malformed persistence configuration: " + e.getMessage(), e);
        }
        validate(config);
        return config;
    }

    /**
     * Checks the values that can not be expressed through the mapping itself.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public static void validate(DatabaseConfig config) {
        BackendType.fromName(config.backend());
        requirePositive("cache-size", config.cacheSize());
        requirePositive("pool-size", config.poolSize());
        requirePositive("timeout", config.timeout());
        requirePositive("backup-retention", config.backupRetention());
        if (config.fileBackupCount() < 0) {
            throw new ConfigurationException("file-backup-count can not be negative: " + config.fileBackupCount());
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(String.format("%s must be positive, was %d", name, value));
        }
    }

    /**
     * The read-only configuration map handed to migration units.
     */
    public static Map<String, Object> toMap(DatabaseConfig config) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("backend", config.backend().toLowerCase());
        map.put("connection_string", config.connectionString().orElse(""));
        map.put("migrations_location", config.migrationsLocation().orElse(""));
        map.put("cache_size", config.cacheSize());
        map.put("pool_size", config.poolSize());
        map.put("timeout", config.timeout());
        map.put("backup_retention", config.backupRetention());
        map.put("backup_directory", config.backupDirectory().orElse(""));
        map.put("auto_save", config.autoSave());
        map.put("file_backup_count", config.fileBackupCount());
        map.put("host", config.postgresql().host());
        map.put("port", config.postgresql().port());
        map.put("database", config.postgresql().database());
        map.put("username", config.postgresql().username());
        return Collections.unmodifiableMap(map);
    }
}
