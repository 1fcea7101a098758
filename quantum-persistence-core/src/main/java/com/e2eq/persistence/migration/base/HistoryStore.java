package com.e2eq.persistence.migration.base;

import com.e2eq.persistence.backend.StorageBackend;
import com.e2eq.persistence.exceptions.MigrationException;
import com.e2eq.persistence.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 Reads and writes the schema version, migration history and rollback history kept under
 reserved keys of a backend. Writes are only made by the runner, inside a transaction.
 */
public class HistoryStore {
   public static final String SCHEMA_VERSION_KEY = "_schema_version";
   public static final String MIGRATION_HISTORY_KEY = "_migration_history";
   public static final String ROLLBACK_HISTORY_KEY = "_rollback_history";

   private final StorageBackend backend;

   public HistoryStore(StorageBackend backend) {
      this.backend = backend;
   }

   /** The current schema version, 0 when nothing was ever applied. */
   public long schemaVersion() {
      return backend.get(SCHEMA_VERSION_KEY)
                .map(node -> node.path("version").asLong(0L))
                .orElse(0L);
   }

   public void setSchemaVersion(long version) {
      ObjectNode node = JSONUtils.instance().newObject();
      node.put("version", version);
      backend.set(SCHEMA_VERSION_KEY, node);
   }

   /** Applied migrations, ascending by version. */
   public List<MigrationRecord> migrations() {
      List<MigrationRecord> records = readArray(MIGRATION_HISTORY_KEY, "migrations", MigrationRecord.class);
      records.sort(Comparator.comparingLong(MigrationRecord::getVersion));
      return records;
   }

   public Set<Long> appliedVersions() {
      Set<Long> versions = new TreeSet<>();
      migrations().forEach(record -> versions.add(record.getVersion()));
      return versions;
   }

   public Optional<MigrationRecord> find(long version) {
      return migrations().stream().filter(record -> record.getVersion() == version).findFirst();
   }

   public void append(MigrationRecord record) {
      List<MigrationRecord> records = migrations();
      records.removeIf(existing -> existing.getVersion() == record.getVersion());
      records.add(record);
      records.sort(Comparator.comparingLong(MigrationRecord::getVersion));
      writeArray(MIGRATION_HISTORY_KEY, "migrations", records);
   }

   /**
    Removes the record of the given version.
    @return the new last applied version, 0 when the history is empty
    */
   public long remove(long version) {
      List<MigrationRecord> records = migrations();
      records.removeIf(existing -> existing.getVersion() == version);
      writeArray(MIGRATION_HISTORY_KEY, "migrations", records);
      return records.isEmpty() ? 0L : records.get(records.size() - 1).getVersion();
   }

   public List<RollbackRecord> rollbacks() {
      return readArray(ROLLBACK_HISTORY_KEY, "rollbacks", RollbackRecord.class);
   }

   public void appendRollback(RollbackRecord record) {
      List<RollbackRecord> records = rollbacks();
      records.add(record);
      writeArray(ROLLBACK_HISTORY_KEY, "rollbacks", records);
   }

   private <T> List<T> readArray(String key, String field, Class<T> type) {
      List<T> items = new ArrayList<>();
      Optional<JsonNode> document = backend.get(key);
      if (document.isEmpty()) {
         return items;
      }
      JsonNode array = document.get().path(field);
      if (!array.isArray()) {
         return items;
      }
      try {
         for (JsonNode item : array) {
            items.add(JSONUtils.instance().getMapper().convertValue(item, type));
         }
      } catch (IllegalArgumentException e) {
         throw new MigrationException(String.format("Stored %s is corrupt: %s", key, e.getMessage()), e);
      }
      return items;
   }

   private void writeArray(String key, String field, List<?> items) {
      ObjectNode document = JSONUtils.instance().newObject();
      ArrayNode array = document.putArray(field);
      for (Object item : items) {
         array.add(JSONUtils.instance().toTree(item));
      }
      backend.set(key, document);
   }
}
