package com.e2eq.persistence.backend;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.e2eq.persistence.TestBackends.doc;
import static org.junit.jupiter.api.Assertions.*;

class SqliteBackendTest extends AbstractStorageBackendTest {

    @Override
    StorageBackend newBackend(Path dir) {
        return new SqliteBackend(dir.resolve("storage.db"), 100, 5);
    }

    @Test
    void testCreatesDatabaseFile() {
        assertTrue(Files.exists(((SqliteBackend) backend).getDatabaseFile()));
        assertEquals(BackendType.SQLITE, backend.type());
    }

    @Test
    void testTransactionUsesOneConnectionScope() {
        SqliteBackend sqlite = (SqliteBackend) backend;
        backend.transaction(tx -> {
            assertTrue(sqlite.inTransaction());
            tx.set("a", doc("n", 1));
            assertTrue(tx.exists("a"));
            return null;
        });
        assertFalse(sqlite.inTransaction());
        assertTrue(backend.exists("a"));
    }

    @Test
    void testInitializeTwiceIsNoOp() {
        backend.set("a", doc("n", 1));
        backend.initialize();
        assertTrue(backend.exists("a"));
    }

    @Test
    void testNestedValuesRoundTrip() {
        backend.set("nested", doc("list", List.of(1, 2, Map.of("deep", true))));
        assertTrue(backend.get("nested").get().get("list").get(2).get("deep").asBoolean());
    }
}
