package com.e2eq.persistence.backend;

import com.e2eq.persistence.config.DatabaseConfig;
import com.e2eq.persistence.config.DatabaseConfigs;
import com.e2eq.persistence.exceptions.StorageException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PostgreSqlBackendTest {

    private static DatabaseConfig config(Map<String, String> properties) {
        return DatabaseConfigs.fromProperties(properties);
    }

    @Test
    void testUrlBuiltFromProperties() {
        DatabaseConfig config = config(Map.of(
            "quantum.persistence.backend", "postgresql",
            "quantum.persistence.postgresql.host", "db.internal",
            "quantum.persistence.postgresql.port", "6543",
            "quantum.persistence.postgresql.database", "notes"));
        assertEquals("jdbc:postgresql://db.internal:6543/notes", PostgreSqlBackend.jdbcUrl(config));
    }

    @Test
    void testUrlDefaults() {
        DatabaseConfig config = config(Map.of("quantum.persistence.backend", "postgresql"));
        assertEquals("jdbc:postgresql://localhost:5432/cli_app", PostgreSqlBackend.jdbcUrl(config));
    }

    @Test
    void testConnectionStringWins() {
        assertEquals("jdbc:postgresql://h:1/d", PostgreSqlBackend.jdbcUrl(config(Map.of(
            "quantum.persistence.backend", "postgresql",
            "quantum.persistence.connection-string", "jdbc:postgresql://h:1/d"))));
        assertEquals("jdbc:postgresql://h:1/d", PostgreSqlBackend.jdbcUrl(config(Map.of(
            "quantum.persistence.backend", "postgresql",
            "quantum.persistence.connection-string", "postgresql://h:1/d"))));
        assertEquals("jdbc:postgresql://h:1/d", PostgreSqlBackend.jdbcUrl(config(Map.of(
            "quantum.persistence.backend", "postgresql",
            "quantum.persistence.connection-string", "postgres://h:1/d"))));
    }

    @Test
    void testJsonbDialect() {
        PostgreSqlBackend backend = new PostgreSqlBackend("jdbc:postgresql://localhost/test", "postgres", null, 10, 2, 5);
        assertEquals(BackendType.POSTGRESQL, backend.type());
        assertTrue(backend.createStorageTableSql().contains("value JSONB NOT NULL"));
        assertTrue(backend.upsertSql().contains("CAST(? AS JSONB)"));
        assertTrue(backend.upsertSql().contains("ON CONFLICT (key) DO UPDATE"));
    }

    @Test
    void testUnopenedBackendRejectsOperations() {
        PostgreSqlBackend backend = new PostgreSqlBackend("jdbc:postgresql://localhost/test", "postgres", null, 10, 2, 5);
        assertFalse(backend.isInitialized());
        assertThrows(StorageException.class, () -> backend.get("a"));
        backend.close();
    }

    @Test
    void testFactorySelectsBackend() {
        StorageBackend backend = StorageBackends.create(config(Map.of("quantum.persistence.backend", "postgresql")));
        assertInstanceOf(PostgreSqlBackend.class, backend);
        assertEquals("jdbc:postgresql://localhost:5432/cli_app", ((PostgreSqlBackend) backend).getJdbcUrl());
    }
}
