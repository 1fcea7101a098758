package com.e2eq.persistence.backup;

import com.e2eq.persistence.backend.BackendType;
import com.e2eq.persistence.backend.JsonFileBackend;
import com.e2eq.persistence.backend.StorageBackend;
import com.e2eq.persistence.config.DatabaseConfig;
import com.e2eq.persistence.exceptions.DatabaseException;
import com.e2eq.persistence.migration.base.HistoryStore;
import com.e2eq.persistence.util.ExceptionLoggingUtils;
import com.e2eq.persistence.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes the whole store of a backend to a JSON backup file and restores it again. Both
 * directions run inside a backend transaction, so they never interleave with a migration.
 */
public class BackupService {

    private static final Logger LOG = Logger.getLogger(BackupService.class);
    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final String[] REQUIRED_FIELDS = {"backend_type", "schema_version", "data"};

    private final StorageBackend backend;
    private final Path directory;
    private final int retention;

    /**
     * @param directory where auto named backups go
     * @param retention number of auto named backups kept for this backend type
     */
    public BackupService(StorageBackend backend, Path directory, int retention) {
        this.backend = backend;
        this.directory = directory.toAbsolutePath();
        this.retention = retention;
    }

    public BackupService(StorageBackend backend, DatabaseConfig config) {
        this(backend, defaultDirectory(backend, config), config.backupRetention());
    }

    /**
     * The configured backup directory, else the directory of the JSON data file, else the
     * working directory.
     */
    public static Path defaultDirectory(StorageBackend backend, DatabaseConfig config) {
        if (config.backupDirectory().isPresent() && !config.backupDirectory().get().isBlank()) {
            return Path.of(config.backupDirectory().get());
        }
        if (backend instanceof JsonFileBackend && ((JsonFileBackend) backend).getFile().getParent() != null) {
            return ((JsonFileBackend) backend).getFile().getParent();
        }
        return Path.of("").toAbsolutePath();
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Writes an auto named backup and prunes older ones beyond the retention count.
     */
    public Path backup() {
        Path target = nextBackupFile();
        write(target);
        prune();
        return target;
    }

    /**
     * Writes a backup to the given file, or an auto named one when it is null.
     */
    public Path backup(Path target) {
        if (target == null) {
            return backup();
        }
        write(target);
        return target;
    }

    public BackupSnapshot snapshot() {
        return backend.transaction(tx -> BackupSnapshot.builder()
                                             .backendType(tx.type().externalName())
                                             .schemaVersion(new HistoryStore(tx).schemaVersion())
                                             .createdAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                                             .data(new TreeMap<>(tx.exportData()))
                                             .build());
    }

    private void write(Path target) {
        BackupSnapshot snapshot = snapshot();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSONUtils.instance().getPrettyWriter().writeValue(target.toFile(), snapshot);
        } catch (IOException e) {
            throw new DatabaseException(String.format("Backup to %s failed: %s", target, e.getMessage()), e);
        }
        LOG.infof("Database backed up to %s (%d keys, schema version %d)", target, snapshot.getData().size(),
                snapshot.getSchemaVersion());
    }

    /**
     * Imports a backup file into the backend in one transaction. Keys missing from the backup are
     * left untouched.
     *
     * @param force restore even when the backend type or the schema version differ
     * @throws DatabaseException when the file is unreadable or invalid, or on a mismatch without force
     */
    public void restore(Path source, boolean force) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new DatabaseException(String.format("Backup file not found: %s", source));
        }
        JsonNode root;
        try {
            root = JSONUtils.instance().getMapper().readTree(source.toFile());
        } catch (IOException e) {
            throw new DatabaseException(String.format("Backup file %s is not readable: %s", source, e.getMessage()), e);
        }
        if (root == null || !root.isObject()) {
            throw new DatabaseException(String.format("Invalid backup format in %s: not a json object", source));
        }
        for (String field : REQUIRED_FIELDS) {
            if (!root.has(field)) {
                throw new DatabaseException(String.format("Invalid backup format in %s: missing %s", source, field));
            }
        }
        if (!root.get("data").isObject() || !root.get("schema_version").canConvertToLong()) {
            throw new DatabaseException(String.format("Invalid backup format in %s: malformed schema_version or data", source));
        }

        String backupType = root.get("backend_type").asText();
        long backupVersion = root.get("schema_version").asLong();
        String currentType = backend.type().externalName();
        long currentVersion = new HistoryStore(backend).schemaVersion();

        if (!backupType.equals(currentType)) {
            String message = String.format("Backend mismatch: backup is %s, current is %s", backupType, currentType);
            if (!force) {
                throw new DatabaseException(message + ". Use force to override.");
            }
            LOG.warnf("%s, restoring anyway", message);
        }
        if (backupVersion != currentVersion) {
            String message = String.format("Schema version mismatch: backup is %d, current is %d", backupVersion, currentVersion);
            if (!force) {
                throw new DatabaseException(message + ". Use force to override.");
            }
            LOG.warnf("%s, restoring anyway", message);
        }

        Map<String, JsonNode> data = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.get("data").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            data.put(entry.getKey(), entry.getValue());
        }
        backend.importData(data);
        LOG.infof("Database restored from %s (%d keys)", source, data.size());
    }

    /**
     * Auto named backups of this backend type, newest first.
     */
    public List<Path> listBackups() {
        List<Path> backups = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return backups;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, filePrefix() + "*.json")) {
            stream.forEach(backups::add);
        } catch (IOException e) {
            throw new DatabaseException(String.format("Unable to list backups in %s", directory), e);
        }
        backups.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        return backups;
    }

    private void prune() {
        List<Path> backups = listBackups();
        for (int i = retention; i < backups.size(); i++) {
            Path old = backups.get(i);
            try {
                Files.deleteIfExists(old);
                LOG.debugf("Removed old backup %s", old);
            } catch (IOException e) {
                ExceptionLoggingUtils.logWarn(LOG, e, "Unable to remove old backup %s", old);
            }
        }
    }

    private Path nextBackupFile() {
        String stamp = LocalDateTime.now().format(NAME_FORMAT);
        Path candidate = directory.resolve(filePrefix() + stamp + ".json");
        for (int i = 1; Files.exists(candidate); i++) {
            candidate = directory.resolve(filePrefix() + stamp + "_" + i + ".json");
        }
        return candidate;
    }

    private String filePrefix() {
        BackendType type = backend.type();
        return "backup_" + type.externalName() + "_";
    }
}
