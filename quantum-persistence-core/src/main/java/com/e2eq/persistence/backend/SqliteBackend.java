package com.e2eq.persistence.backend;

import com.e2eq.persistence.exceptions.StorageException;
import com.e2eq.persistence.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite backed storage using one connection in WAL mode.
 */
public class SqliteBackend extends JdbcStorageBackend {

    private static final Logger LOG = Logger.getLogger(SqliteBackend.class);

    private final Path databaseFile;
    private final int timeoutSeconds;
    private Connection connection;

    public SqliteBackend(Path databaseFile, int cacheSize, int timeoutSeconds) {
        super(cacheSize);
        this.databaseFile = databaseFile.toAbsolutePath();
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public BackendType type() {
        return BackendType.SQLITE;
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        try {
            if (databaseFile.getParent() != null) {
                Files.createDirectories(databaseFile.getParent());
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile);
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA journal_mode=WAL");
                statement.execute("PRAGMA synchronous=NORMAL");
                statement.execute("PRAGMA foreign_keys=ON");
                statement.execute("PRAGMA busy_timeout=" + (timeoutSeconds * 1000L));
            }
        } catch (IOException | SQLException e) {
            closeConnection();
            throw new StorageException(String.format("Unable to open sqlite database %s", databaseFile), e);
        }
        createSchema();
        initialized = true;
        LOG.infof("Opened sqlite database %s", databaseFile);
    }

    @Override
    protected Connection acquireConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            throw new SQLException("sqlite connection is not open");
        }
        return connection;
    }

    @Override
    protected void releaseConnection(Connection connection) {
        // single shared connection, closed in close()
    }

    @Override
    protected String valueColumnType() {
        return "TEXT";
    }

    @Override
    protected String valuePlaceholder() {
        return "?";
    }

    @Override
    protected long storageSize(Connection connection) {
        try {
            return Files.exists(databaseFile) ? Files.size(databaseFile) : 0L;
        } catch (IOException e) {
            LOG.debugf("Unable to read size of %s: %s", databaseFile, e.getMessage());
            return -1L;
        }
    }

    @Override
    public synchronized void close() {
        initialized = false;
        invalidateCache();
        closeConnection();
    }

    private void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            ExceptionLoggingUtils.logWarn(LOG, e, "Unable to close sqlite database %s", databaseFile);
        } finally {
            connection = null;
        }
    }
}
