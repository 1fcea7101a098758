package com.e2eq.persistence.backend;

import com.e2eq.persistence.exceptions.StorageException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-through cache and argument checks shared by every backend. Subclasses implement the
 * raw storage operations; cached and returned documents are always copies. A loaded document
 * is only cached when no write happened while it was being loaded.
 */
public abstract class AbstractStorageBackend implements StorageBackend {

    protected final Cache<String, JsonNode> cache;
    private final int cacheSize;
    private final Object cacheMonitor = new Object();
    private volatile long writeGeneration;
    protected volatile boolean initialized;

    protected AbstractStorageBackend(int cacheSize) {
        this.cacheSize = cacheSize;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(cacheSize)
                .recordStats()
                .build();
    }

    protected abstract Optional<JsonNode> load(String key);

    protected abstract void store(String key, JsonNode value);

    protected abstract boolean remove(String key);

    protected abstract boolean contains(String key);

    protected abstract List<String> keys(String prefix);

    protected abstract void removeAll();

    /** Bytes used by the underlying storage, -1 when unknown. */
    protected abstract long storageSize();

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        checkKey(key);
        requireInitialized();
        JsonNode cached = cache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached.deepCopy());
        }
        long generation = writeGeneration;
        Optional<JsonNode> loaded = load(key);
        loaded.ifPresent(value -> {
            synchronized (cacheMonitor) {
                // a write since the load began may have replaced the document
                if (writeGeneration == generation) {
                    cache.put(key, value.deepCopy());
                }
            }
        });
        return loaded;
    }

    @Override
    public void set(String key, JsonNode value) {
        checkKey(key);
        Objects.requireNonNull(value, "value cannot be null, use delete to remove a key");
        requireInitialized();
        store(key, value.deepCopy());
        invalidate(key);
    }

    @Override
    public boolean delete(String key) {
        checkKey(key);
        requireInitialized();
        boolean removed = remove(key);
        invalidate(key);
        return removed;
    }

    @Override
    public boolean exists(String key) {
        checkKey(key);
        requireInitialized();
        return cache.getIfPresent(key) != null || contains(key);
    }

    @Override
    public List<String> listKeys(String prefix) {
        requireInitialized();
        return keys(Strings.nullToEmpty(prefix));
    }

    @Override
    public void clear() {
        requireInitialized();
        removeAll();
        invalidateCache();
    }

    @Override
    public void importData(Map<String, JsonNode> data) {
        Objects.requireNonNull(data, "data cannot be null");
        requireInitialized();
        try {
            transaction(backend -> {
                backend.clear();
                data.forEach(backend::set);
                return null;
            });
        } finally {
            invalidateCache();
        }
    }

    @Override
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("backend_type", type().externalName());
        stats.put("initialized", initialized);
        if (initialized) {
            CacheStats cacheStats = cache.stats();
            stats.put("key_count", keys("").size());
            stats.put("cache_entries", cache.size());
            stats.put("cache_max_size", cacheSize);
            stats.put("cache_hit_rate", cacheStats.hitRate());
            stats.put("storage_size", storageSize());
        }
        return stats;
    }

    /** Drops every cached document, used after a rollback. */
    protected void invalidateCache() {
        synchronized (cacheMonitor) {
            writeGeneration++;
            cache.invalidateAll();
        }
    }

    private void invalidate(String key) {
        synchronized (cacheMonitor) {
            writeGeneration++;
            cache.invalidate(key);
        }
    }

    protected void requireInitialized() {
        if (!initialized) {
            throw new StorageException(String.format("%s backend is not initialized", type()));
        }
    }

    protected static void checkKey(String key) {
        if (Strings.isNullOrEmpty(key)) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
    }
}
