package com.e2eq.persistence.backend;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A key/value store of JSON documents with a transaction primitive. Keys starting with an
 * underscore are reserved for the migration machinery.
 */
public interface StorageBackend extends AutoCloseable {

    BackendType type();

    /**
     * Opens files, connections or pools. Calling it twice is a no-op.
     */
    void initialize();

    boolean isInitialized();

    /**
     * @return the stored document, empty when the key is absent
     */
    @NotNull
    Optional<JsonNode> get(@NotNull String key);

    void set(@NotNull String key, @NotNull JsonNode value);

    /**
     * @return true when a document was removed
     */
    boolean delete(String key);

    /**
     * @param prefix key prefix, all keys when null or empty
     * @return matching keys in ascending order
     */
    List<String> listKeys(@Nullable String prefix);

    boolean exists(String key);

    void clear();

    /**
     * Backend type, key count, cache figures and storage size.
     */
    Map<String, Object> stats();

    /**
     * @return every key and document, sorted by key
     */
    Map<String, JsonNode> exportData();

    /**
     * Replaces the whole store with the mapping, inside one transaction. Keys absent from the
     * mapping are removed.
     */
    void importData(Map<String, JsonNode> data);

    /**
     * Runs the work in a transaction. Commits when it returns normally; otherwise rolls back
     * and rethrows the original exception. A nested call joins the outermost transaction.
     */
    <T, E extends Exception> T transaction(TransactionWork<T, E> work) throws E;

    @Override
    void close();

    default Map<String, JsonNode> batchGet(Collection<String> keys) {
        Map<String, JsonNode> result = new LinkedHashMap<>();
        for (String key : keys) {
            get(key).ifPresent(value -> result.put(key, value));
        }
        return result;
    }

    default void batchSet(Map<String, JsonNode> entries) {
        transaction(backend -> {
            entries.forEach(backend::set);
            return null;
        });
    }

    /**
     * @return the number of keys actually removed
     */
    default int batchDelete(Collection<String> keys) {
        int removed = 0;
        for (String key : keys) {
            if (delete(key)) {
                removed++;
            }
        }
        return removed;
    }
}
