package com.e2eq.persistence;

import com.e2eq.persistence.backend.StorageBackend;
import com.e2eq.persistence.backend.StorageBackends;
import com.e2eq.persistence.backup.BackupService;
import com.e2eq.persistence.config.DatabaseConfig;
import com.e2eq.persistence.config.DatabaseConfigs;
import com.e2eq.persistence.exceptions.ConfigurationException;
import com.e2eq.persistence.exceptions.DatabaseException;
import com.e2eq.persistence.migration.base.HistoryStore;
import com.e2eq.persistence.migration.base.IntegrityReport;
import com.e2eq.persistence.migration.base.IntegrityVerifier;
import com.e2eq.persistence.migration.base.MigrationDescriptor;
import com.e2eq.persistence.migration.base.MigrationListener;
import com.e2eq.persistence.migration.base.MigrationRecord;
import com.e2eq.persistence.migration.base.MigrationRegistry;
import com.e2eq.persistence.migration.base.MigrationResult;
import com.e2eq.persistence.migration.base.MigrationRunner;
import com.e2eq.persistence.migration.base.MigrationSource;
import com.e2eq.persistence.migration.base.RollbackRecord;
import com.e2eq.persistence.migration.base.RollbackSafety;
import com.e2eq.persistence.migration.base.ServiceLoaderMigrationSource;
import com.e2eq.persistence.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Entry point for applications: selects and opens the configured backend, runs migrations and
 * exposes backup, restore, rollback and health operations.
 */
public class DatabaseManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(DatabaseManager.class);

    private final DatabaseConfig config;
    private final MigrationSource migrationSource;
    private MigrationListener listener = MigrationListener.NO_OP;

    private StorageBackend backend;
    private MigrationRegistry registry;
    private MigrationRunner runner;
    private BackupService backupService;

    /**
     * Discovers migration units through {@code META-INF/services}, restricted to the configured
     * migrations location.
     */
    public DatabaseManager(DatabaseConfig config) {
        this(config, new ServiceLoaderMigrationSource(config.migrationsLocation().orElse("")));
    }

    public DatabaseManager(DatabaseConfig config, MigrationSource migrationSource) {
        this.config = config;
        this.migrationSource = migrationSource;
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    public synchronized void setListener(MigrationListener listener) {
        this.listener = listener == null ? MigrationListener.NO_OP : listener;
        if (runner != null) {
            runner.setListener(this.listener);
        }
    }

    /**
     * Opens the backend and applies pending migrations.
     *
     * @throws ConfigurationException when the configuration is invalid, before any I/O
     * @throws DatabaseException when the backend can not be opened or a migration fails
     */
    public void initialize() {
        initialize(true);
    }

    public synchronized void initialize(boolean runMigrations) {
        if (backend != null) {
            return;
        }
        DatabaseConfigs.validate(config);
        StorageBackend created = StorageBackends.create(config);
        LOG.infof("Initializing %s database", created.type());
        try {
            created.initialize();
            MigrationRegistry loadedRegistry = MigrationRegistry.load(migrationSource);
            BackupService backups = new BackupService(created, config);
            MigrationRunner migrationRunner = new MigrationRunner(created, loadedRegistry,
                    DatabaseConfigs.toMap(config), backups);
            migrationRunner.setListener(listener);
            if (runMigrations) {
                migrationRunner.run();
            }
            this.registry = loadedRegistry;
            this.backupService = backups;
            this.runner = migrationRunner;
            this.backend = created;
        } catch (ConfigurationException e) {
            created.close();
            throw e;
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logError(LOG, e, "Failed to initialize %s database", created.type());
            created.close();
            throw new DatabaseException(String.format("Failed to initialize %s database: %s", created.type(),
                    ExceptionLoggingUtils.describe(e)), e);
        }
        LOG.infof("%s database initialized at schema version %d", backend.type(),
                new HistoryStore(backend).schemaVersion());
    }

    public synchronized boolean isInitialized() {
        return backend != null;
    }

    public synchronized StorageBackend getBackend() {
        return requireBackend();
    }

    public MigrationResult runMigrations() {
        return requireRunner().run();
    }

    public MigrationResult rollback(int steps) {
        return requireRunner().rollback(steps);
    }

    public MigrationResult rollbackTo(long targetVersion) {
        return requireRunner().rollbackTo(targetVersion);
    }

    public RollbackSafety checkRollbackSafety(long version) {
        return requireRunner().checkRollbackSafety(version);
    }

    public List<MigrationDescriptor> pendingMigrations() {
        return requireRunner().pending();
    }

    public List<MigrationRecord> migrationHistory() {
        return requireRunner().history();
    }

    public List<RollbackRecord> rollbackHistory() {
        return requireRunner().rollbackHistory();
    }

    public IntegrityReport verifyIntegrity() {
        StorageBackend current = requireBackend();
        return new IntegrityVerifier(current, registry).verify();
    }

    public Path backup() {
        return requireBackupService().backup();
    }

    public Path backup(Path target) {
        return requireBackupService().backup(target);
    }

    public void restore(Path source, boolean force) {
        requireBackupService().restore(source, force);
    }

    public List<Path> listBackups() {
        return requireBackupService().listBackups();
    }

    public synchronized long schemaVersion() {
        return new HistoryStore(requireBackend()).schemaVersion();
    }

    /**
     * Never throws; a failure to collect the status is reported in {@link HealthStatus#getError()}.
     */
    public synchronized HealthStatus healthStatus() {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        String backendType = config.backend().toLowerCase();
        if (backend == null) {
            return HealthStatus.builder()
                      .backendType(backendType)
                      .initialized(false)
                      .timestamp(timestamp)
                      .build();
        }
        try {
            return HealthStatus.builder()
                      .backendType(backend.type().externalName())
                      .initialized(backend.isInitialized())
                      .schemaVersion(new HistoryStore(backend).schemaVersion())
                      .latestAvailableVersion(registry.latestVersion())
                      .pendingMigrations(runner.pending().size())
                      .migrationInProgress(runner.isInProgress())
                      .stats(backend.stats())
                      .timestamp(timestamp)
                      .build();
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logError(LOG, e, "Health check failed");
            return HealthStatus.builder()
                      .backendType(backendType)
                      .initialized(false)
                      .error(ExceptionLoggingUtils.describe(e))
                      .timestamp(timestamp)
                      .build();
        }
    }

    @Override
    public synchronized void close() {
        if (backend != null) {
            LOG.infof("Closing %s database", backend.type());
            backend.close();
            backend = null;
            runner = null;
            backupService = null;
            registry = null;
        }
    }

    private StorageBackend requireBackend() {
        if (backend == null) {
            throw new DatabaseException("Database manager is not initialized");
        }
        return backend;
    }

    private synchronized MigrationRunner requireRunner() {
        requireBackend();
        return runner;
    }

    private synchronized BackupService requireBackupService() {
        requireBackend();
        return backupService;
    }
}
