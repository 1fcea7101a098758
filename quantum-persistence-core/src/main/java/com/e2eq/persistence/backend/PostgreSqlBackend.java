package com.e2eq.persistence.backend;

import com.e2eq.persistence.config.DatabaseConfig;
import com.e2eq.persistence.exceptions.StorageException;
import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import io.agroal.api.security.NamePrincipal;
import io.agroal.api.security.SimplePassword;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;

/**
 * PostgreSQL backed storage. Values are kept as JSONB and connections come from an Agroal pool.
 */
public class PostgreSqlBackend extends JdbcStorageBackend {

    private static final Logger LOG = Logger.getLogger(PostgreSqlBackend.class);

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final int poolSize;
    private final int timeoutSeconds;
    private AgroalDataSource dataSource;

    public PostgreSqlBackend(DatabaseConfig config) {
        this(jdbcUrl(config), config.postgresql().username(), config.postgresql().password().orElse(null),
                config.cacheSize(), config.poolSize(), config.timeout());
    }

    public PostgreSqlBackend(String jdbcUrl, String username, String password, int cacheSize, int poolSize,
                             int timeoutSeconds) {
        super(cacheSize);
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.poolSize = poolSize;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * The connection string when one is configured, otherwise a URL built from the
     * {@code postgresql.*} properties.
     */
    public static String jdbcUrl(DatabaseConfig config) {
        if (config.connectionString().isPresent() && !config.connectionString().get().isBlank()) {
            String connectionString = config.connectionString().get().trim();
            if (connectionString.startsWith("jdbc:")) {
                return connectionString;
            }
            if (connectionString.startsWith("postgresql://")) {
                return "jdbc:" + connectionString;
            }
            if (connectionString.startsWith("postgres://")) {
                return "jdbc:postgresql://" + connectionString.substring("postgres://".length());
            }
            return connectionString;
        }
        DatabaseConfig.Postgresql pg = config.postgresql();
        return String.format("jdbc:postgresql://%s:%d/%s", pg.host(), pg.port(), pg.database());
    }

    @Override
    public BackendType type() {
        return BackendType.POSTGRESQL;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        AgroalDataSourceConfigurationSupplier configuration = new AgroalDataSourceConfigurationSupplier()
                .connectionPoolConfiguration(pool -> pool
                        .maxSize(poolSize)
                        .acquisitionTimeout(Duration.ofSeconds(timeoutSeconds))
                        .connectionFactoryConfiguration(factory -> {
                            factory.jdbcUrl(jdbcUrl);
                            if (username != null && !username.isEmpty()) {
                                factory.principal(new NamePrincipal(username));
                            }
                            if (password != null) {
                                factory.credential(new SimplePassword(password));
                            }
                            return factory;
                        }));
        try {
            dataSource = AgroalDataSource.from(configuration);
        } catch (SQLException e) {
            throw new StorageException(String.format("Unable to create connection pool for %s", jdbcUrl), e);
        }
        try {
            createSchema();
        } catch (StorageException e) {
            closeDataSource();
            throw e;
        }
        initialized = true;
        LOG.infof("Connected to postgresql %s with a pool of %d connections", jdbcUrl, poolSize);
    }

    @Override
    protected Connection acquireConnection() throws SQLException {
        if (dataSource == null) {
            throw new SQLException("postgresql connection pool is not open");
        }
        return dataSource.getConnection();
    }

    @Override
    protected void releaseConnection(Connection connection) throws SQLException {
        connection.close();
    }

    @Override
    protected String valueColumnType() {
        return "JSONB";
    }

    @Override
    protected String valuePlaceholder() {
        return "CAST(? AS JSONB)";
    }

    @Override
    protected long storageSize(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_total_relation_size('storage')");
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : -1L;
        }
    }

    @Override
    public synchronized void close() {
        initialized = false;
        invalidateCache();
        closeDataSource();
    }

    private void closeDataSource() {
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
        }
    }
}
