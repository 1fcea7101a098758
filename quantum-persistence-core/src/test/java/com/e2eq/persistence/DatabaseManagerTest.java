package com.e2eq.persistence;

import com.e2eq.persistence.backend.BackendType;
import com.e2eq.persistence.config.DatabaseConfig;
import com.e2eq.persistence.config.DatabaseConfigs;
import com.e2eq.persistence.exceptions.ConfigurationException;
import com.e2eq.persistence.exceptions.DatabaseException;
import com.e2eq.persistence.exceptions.MigrationException;
import com.e2eq.persistence.migration.base.IntegrityReport;
import com.e2eq.persistence.migration.base.MigrationDescriptor;
import com.e2eq.persistence.migration.base.MigrationRecord;
import com.e2eq.persistence.migration.base.MigrationState;
import com.e2eq.persistence.migration.base.StaticMigrationSource;
import com.e2eq.persistence.migration.fixtures.V202501010000_CreateSettings;
import com.e2eq.persistence.migration.fixtures.V202501020000_AddNotesIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.e2eq.persistence.TestBackends.doc;
import static org.junit.jupiter.api.Assertions.*;

class DatabaseManagerTest {

    static final long V1 = 202501010000L;
    static final long V2 = 202501020000L;
    static final long V3 = 202501030000L;
    static final String FIXTURES = "com.e2eq.persistence.migration.fixtures";

    @TempDir
    Path dir;

    DatabaseManager manager;

    @AfterEach
    void close() {
        if (manager != null) {
            manager.close();
        }
    }

    DatabaseConfig config(String backend, String file) {
        return DatabaseConfigs.fromProperties(Map.of(
            "quantum.persistence.backend", backend,
            "quantum.persistence.connection-string", dir.resolve(file).toString(),
            "quantum.persistence.migrations-location", FIXTURES));
    }

    static List<Long> versions(List<MigrationRecord> records) {
        return records.stream().map(MigrationRecord::getVersion).collect(Collectors.toList());
    }

    @Test
    void testInitializeAppliesDiscoveredMigrations() {
        manager = new DatabaseManager(config("json", "storage.json"));
        List<String> committed = new ArrayList<>();
        manager.setListener((migration, state, failure) -> {
            if (state == MigrationState.COMMITTED) {
                committed.add(migration.getName());
            }
        });

        manager.initialize();

        assertTrue(manager.isInitialized());
        assertEquals(V3, manager.schemaVersion());
        assertEquals(List.of(V1, V2, V3), versions(manager.migrationHistory()));
        assertEquals(3, committed.size());
        assertTrue(manager.pendingMigrations().isEmpty());
        assertTrue(manager.getBackend().exists("marker"));
        // the risky unit was backed up next to the data file
        assertEquals(1, manager.listBackups().size());
        assertEquals(dir, manager.listBackups().get(0).getParent());
    }

    @Test
    void testHealthStatus() {
        manager = new DatabaseManager(config("sqlite", "storage.db"));
        HealthStatus before = manager.healthStatus();
        assertFalse(before.isInitialized());
        assertEquals("sqlite", before.getBackendType());

        manager.initialize();
        HealthStatus status = manager.healthStatus();

        assertTrue(status.isHealthy());
        assertEquals("sqlite", status.getBackendType());
        assertEquals(V3, status.getSchemaVersion());
        assertEquals(V3, status.getLatestAvailableVersion());
        assertEquals(0, status.getPendingMigrations());
        assertFalse(status.isMigrationInProgress());
        assertEquals(true, status.getStats().get("initialized"));
        assertNotNull(status.getTimestamp());
    }

    @Test
    void testDeferredMigrations() {
        manager = new DatabaseManager(config("sqlite", "storage.db"));
        manager.initialize(false);
        assertEquals(0L, manager.schemaVersion());
        assertEquals(3, manager.pendingMigrations().size());

        assertEquals(List.of(V1, V2, V3), manager.runMigrations().getVersions());
        assertTrue(manager.runMigrations().isEmpty());
    }

    @Test
    void testUnsupportedBackendFailsBeforeIo() {
        DatabaseConfig base = config("json", "never/storage.json");
        DatabaseConfig unsupported = new OverriddenBackendConfig(base, "oracle");
        manager = new DatabaseManager(unsupported, new StaticMigrationSource());

        assertThrows(ConfigurationException.class, manager::initialize);
        assertFalse(manager.isInitialized());
        assertFalse(dir.resolve("never").toFile().exists());
    }

    @Test
    void testFailingMigrationIsWrapped() {
        MigrationDescriptor broken = MigrationDescriptor.builder()
                                        .version(V2)
                                        .name("broken")
                                        .unitFactory(() -> (backend, config) -> {
                                            backend.set("half_done", doc("n", 1));
                                            throw new IllegalStateException("broken unit");
                                        })
                                        .build();
        manager = new DatabaseManager(config("json", "storage.json"),
            new StaticMigrationSource().register(V202501010000_CreateSettings.class).register(broken));

        DatabaseException e = assertThrows(DatabaseException.class, manager::initialize);

        MigrationException cause = assertInstanceOf(MigrationException.class, e.getCause());
        assertEquals(Long.valueOf(V2), cause.getVersion());
        assertEquals("broken", cause.getMigrationName());
        assertFalse(manager.isInitialized());

        manager = new DatabaseManager(config("json", "storage.json"),
            new StaticMigrationSource().register(V202501010000_CreateSettings.class));
        manager.initialize();
        assertEquals(V1, manager.schemaVersion());
        assertFalse(manager.getBackend().exists("half_done"));
    }

    @Test
    void testOperationsRequireInitialize() {
        manager = new DatabaseManager(config("json", "storage.json"));
        assertThrows(DatabaseException.class, manager::getBackend);
        assertThrows(DatabaseException.class, manager::runMigrations);
        assertThrows(DatabaseException.class, manager::backup);
        assertThrows(DatabaseException.class, () -> manager.rollback(1));
    }

    @Test
    void testBackupRollbackRestore() {
        manager = new DatabaseManager(config("json", "storage.json"),
            StaticMigrationSource.of(V202501010000_CreateSettings.class, V202501020000_AddNotesIndex.class));
        manager.initialize();
        Path backup = manager.backup(dir.resolve("manual-backup.json"));

        manager.rollbackTo(V1);
        assertEquals(V1, manager.schemaVersion());
        assertFalse(manager.getBackend().exists("notes_index"));
        assertEquals(List.of(V2), manager.rollbackHistory().stream()
                                         .map(r -> r.getVersion())
                                         .collect(Collectors.toList()));

        assertThrows(DatabaseException.class, () -> manager.restore(backup, false));
        manager.restore(backup, true);
        assertEquals(V2, manager.schemaVersion());
        assertTrue(manager.getBackend().exists("notes_index"));
        assertEquals(List.of(V1, V2), versions(manager.migrationHistory()));
    }

    @Test
    void testRunnerOperationsThroughManager() {
        manager = new DatabaseManager(config("json", "storage.json"));
        manager.initialize();

        IntegrityReport report = manager.verifyIntegrity();
        assertTrue(report.isValid());
        assertEquals(3, report.getChecked());

        assertFalse(manager.checkRollbackSafety(V2).isSafe());
        assertTrue(manager.checkRollbackSafety(V1).isSafe());
        assertThrows(MigrationException.class, () -> manager.rollback(1));
    }

    @Test
    void testCloseReleasesBackend() {
        manager = new DatabaseManager(config("sqlite", "storage.db"));
        manager.initialize();
        assertEquals(BackendType.SQLITE, manager.getBackend().type());

        manager.close();

        assertFalse(manager.isInitialized());
        assertThrows(DatabaseException.class, manager::getBackend);
        manager.initialize();
        assertEquals(V3, manager.schemaVersion());
    }
}
