package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.TestBackends;
import com.e2eq.persistence.backend.StorageBackend;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HistoryStoreTest {

   @TempDir
   Path dir;

   StorageBackend backend;
   HistoryStore history;

   @BeforeEach
   void open() {
      backend = TestBackends.open("json", dir);
      history = new HistoryStore(backend);
   }

   @AfterEach
   void close() {
      backend.close();
   }

   static MigrationRecord record(long version) {
      return MigrationRecord.builder()
                .version(version)
                .name("unit_" + version)
                .description("")
                .hash("")
                .appliedAt("2025-01-01T00:00:00")
                .build();
   }

   @Test
   void testEmptyStore() {
      assertEquals(0L, history.schemaVersion());
      assertTrue(history.migrations().isEmpty());
      assertTrue(history.rollbacks().isEmpty());
   }

   @Test
   void testAppendKeepsHistorySortedAndUnique() {
      history.append(record(30));
      history.append(record(10));
      history.append(record(30));

      assertEquals(List.of(10L, 30L), history.migrations().stream()
                                           .map(MigrationRecord::getVersion)
                                           .collect(Collectors.toList()));
      assertEquals(Set.of(10L, 30L), history.appliedVersions());
      assertEquals("unit_10", history.find(10).orElseThrow().getName());
   }

   @Test
   void testRemoveReturnsNewLastVersion() {
      history.append(record(10));
      history.append(record(20));

      assertEquals(10L, history.remove(20));
      assertEquals(0L, history.remove(10));
      assertFalse(history.find(10).isPresent());
   }

   @Test
   void testStoredLayout() {
      history.setSchemaVersion(20);
      history.append(record(20));
      history.appendRollback(RollbackRecord.builder().version(30).name("unit_30")
                                .rolledBackAt("2025-01-02T00:00:00").build());

      assertEquals(20L, history.schemaVersion());
      JsonNode version = backend.get(HistoryStore.SCHEMA_VERSION_KEY).orElseThrow();
      assertEquals(20L, version.get("version").asLong());

      JsonNode migrations = backend.get(HistoryStore.MIGRATION_HISTORY_KEY).orElseThrow().get("migrations");
      assertEquals(1, migrations.size());
      assertEquals("2025-01-01T00:00:00", migrations.get(0).get("applied_at").asText());

      JsonNode rollbacks = backend.get(HistoryStore.ROLLBACK_HISTORY_KEY).orElseThrow().get("rollbacks");
      assertEquals("2025-01-02T00:00:00", rollbacks.get(0).get("rolled_back_at").asText());
      assertEquals(30L, history.rollbacks().get(0).getVersion());
   }
}
