package com.e2eq.persistence.backend;

import com.e2eq.persistence.exceptions.StorageException;
import com.e2eq.persistence.util.ExceptionLoggingUtils;
import com.e2eq.persistence.util.JSONUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Common JDBC implementation over a {@code storage(key, value, created_at, updated_at)} table.
 * Transactions are native: the connection is switched to manual commit for the outermost
 * {@link #transaction(TransactionWork)} call and every statement issued while it is open runs on
 * that connection.
 */
public abstract class JdbcStorageBackend extends AbstractStorageBackend {

    private static final Logger LOG = Logger.getLogger(JdbcStorageBackend.class);

    @FunctionalInterface
    protected interface SqlWork<T> {
        T execute(Connection connection) throws SQLException;
    }

    private final ReentrantLock lock = new ReentrantLock();
    private Connection transactionConnection;

    protected JdbcStorageBackend(int cacheSize) {
        super(cacheSize);
    }

    protected abstract Connection acquireConnection() throws SQLException;

    protected abstract void releaseConnection(Connection connection) throws SQLException;

    /** SQL type of the value column. */
    protected abstract String valueColumnType();

    /** Bind expression for a json value parameter. */
    protected abstract String valuePlaceholder();

    protected abstract long storageSize(Connection connection) throws SQLException;

    protected String createStorageTableSql() {
        return "CREATE TABLE IF NOT EXISTS storage ("
                + "key TEXT PRIMARY KEY, "
                + "value " + valueColumnType() + " NOT NULL, "
                + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)";
    }

    protected String createMetadataTableSql() {
        return "CREATE TABLE IF NOT EXISTS metadata ("
                + "key TEXT PRIMARY KEY, "
                + "value TEXT, "
                + "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)";
    }

    protected String upsertSql() {
        return "INSERT INTO storage (key, value, created_at, updated_at) VALUES (?, " + valuePlaceholder()
                + ", CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) "
                + "ON CONFLICT (key) DO UPDATE SET value = excluded.value, updated_at = CURRENT_TIMESTAMP";
    }

    /**
     * Creates the tables. Subclasses call this once their connection source is ready.
     */
    protected void createSchema() {
        withConnection(connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute(createStorageTableSql());
                statement.execute(createMetadataTableSql());
            }
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO metadata (key, value) VALUES (?, ?) ON CONFLICT (key) DO NOTHING")) {
                statement.setString(1, "backend_type");
                statement.setString(2, type().externalName());
                statement.executeUpdate();
            }
            return null;
        });
    }

    protected <T> T withConnection(SqlWork<T> work) {
        lock.lock();
        try {
            if (transactionConnection != null) {
                return work.execute(transactionConnection);
            }
            Connection connection = acquireConnection();
            try {
                return work.execute(connection);
            } finally {
                releaseConnection(connection);
            }
        } catch (SQLException e) {
            throw new StorageException(String.format("%s operation failed: %s", type(), e.getMessage()), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected Optional<JsonNode> load(String key) {
        String json = withConnection(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT value FROM storage WHERE key = ?")) {
                statement.setString(1, key);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? rs.getString(1) : null;
                }
            }
        });
        return json == null ? Optional.empty() : Optional.of(parse(key, json));
    }

    @Override
    protected void store(String key, JsonNode value) {
        String json = write(key, value);
        withConnection(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(upsertSql())) {
                statement.setString(1, key);
                statement.setString(2, json);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    protected boolean remove(String key) {
        return withConnection(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM storage WHERE key = ?")) {
                statement.setString(1, key);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    protected boolean contains(String key) {
        return withConnection(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM storage WHERE key = ?")) {
                statement.setString(1, key);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    protected List<String> keys(String prefix) {
        List<String> keys = withConnection(connection -> {
            // substr keeps the match case sensitive, LIKE is not on sqlite
            String sql = prefix.isEmpty()
                    ? "SELECT key FROM storage"
                    : "SELECT key FROM storage WHERE substr(key, 1, ?) = ?";
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                if (!prefix.isEmpty()) {
                    statement.setInt(1, prefix.length());
                    statement.setString(2, prefix);
                }
                List<String> found = new ArrayList<>();
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        found.add(rs.getString(1));
                    }
                }
                return found;
            }
        });
        Collections.sort(keys);
        return keys;
    }

    @Override
    protected void removeAll() {
        withConnection(connection -> {
            try (Statement statement = connection.createStatement()) {
                return statement.executeUpdate("DELETE FROM storage");
            }
        });
    }

    @Override
    protected long storageSize() {
        Long size = withConnection(connection -> storageSize(connection));
        return size;
    }

    @Override
    public Map<String, JsonNode> exportData() {
        requireInitialized();
        Map<String, String> raw = withConnection(connection -> {
            Map<String, String> rows = new TreeMap<>();
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT key, value FROM storage")) {
                while (rs.next()) {
                    rows.put(rs.getString(1), rs.getString(2));
                }
            }
            return rows;
        });
        Map<String, JsonNode> data = new TreeMap<>();
        raw.forEach((key, json) -> data.put(key, parse(key, json)));
        return data;
    }

    @Override
    public <T, E extends Exception> T transaction(TransactionWork<T, E> work) throws E {
        requireInitialized();
        lock.lock();
        try {
            if (transactionConnection != null) {
                return work.execute(this);
            }

            Connection connection = acquire();
            boolean previousAutoCommit = beginTransaction(connection);
            transactionConnection = connection;
            try {
                T result = work.execute(this);
                commit(connection);
                return result;
            } catch (Throwable t) {
                rollback(connection, t);
                invalidateCache();
                throw t;
            } finally {
                transactionConnection = null;
                endTransaction(connection, previousAutoCommit);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean inTransaction() {
        return transactionConnection != null;
    }

    private Connection acquire() {
        try {
            return acquireConnection();
        } catch (SQLException e) {
            throw new StorageException(String.format("Unable to obtain %s connection", type()), e);
        }
    }

    private boolean beginTransaction(Connection connection) {
        try {
            boolean previous = connection.getAutoCommit();
            connection.setAutoCommit(false);
            return previous;
        } catch (SQLException e) {
            release(connection);
            throw new StorageException(String.format("Unable to begin %s transaction", type()), e);
        }
    }

    private void commit(Connection connection) {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new StorageException(String.format("Unable to commit %s transaction", type()), e);
        }
    }

    private void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            ExceptionLoggingUtils.logWarn(LOG, e, "Rollback of %s transaction failed", type());
            cause.addSuppressed(e);
        }
    }

    private void endTransaction(Connection connection, boolean previousAutoCommit) {
        try {
            connection.setAutoCommit(previousAutoCommit);
        } catch (SQLException e) {
            ExceptionLoggingUtils.logWarn(LOG, e, "Unable to restore auto commit on %s connection", type());
        } finally {
            release(connection);
        }
    }

    private void release(Connection connection) {
        try {
            releaseConnection(connection);
        } catch (SQLException e) {
            ExceptionLoggingUtils.logWarn(LOG, e, "Unable to release %s connection", type());
        }
    }

    private JsonNode parse(String key, String json) {
        try {
            return JSONUtils.instance().parse(json);
        } catch (JsonProcessingException e) {
            throw new StorageException(String.format("Value of key %s is not valid json", key), e);
        }
    }

    private String write(String key, JsonNode value) {
        try {
            return JSONUtils.instance().toJson(value);
        } catch (JsonProcessingException e) {
            throw new StorageException(String.format("Value of key %s can not be serialized", key), e);
        }
    }
}
