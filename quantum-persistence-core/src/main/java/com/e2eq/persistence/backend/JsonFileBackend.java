package com.e2eq.persistence.backend;

import com.e2eq.persistence.exceptions.StorageException;
import com.e2eq.persistence.util.JSONUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps every document in memory and persists the whole store as one pretty printed JSON
 * object. Transactions are emulated: the store is copied on entry and restored wholesale when
 * the work fails. This gives atomicity within a single process only; a crash between two file
 * writes is not covered. A transaction that changes nothing leaves the file and its rotated
 * copies alone.
 */
public class JsonFileBackend extends AbstractStorageBackend {

    private static final Logger LOG = Logger.getLogger(JsonFileBackend.class);

    private final Path file;
    private final boolean autoSave;
    private final int fileBackupCount;
    private final ReentrantLock lock = new ReentrantLock();

    private TreeMap<String, JsonNode> store = new TreeMap<>();
    private TreeMap<String, JsonNode> holding;
    private int transactionDepth;
    // true while the in-memory store differs from the file
    private boolean dirty;

    public JsonFileBackend(Path file, int cacheSize, boolean autoSave, int fileBackupCount) {
        super(cacheSize);
        this.file = file.toAbsolutePath();
        this.autoSave = autoSave;
        this.fileBackupCount = fileBackupCount;
    }

    @Override
    public BackendType type() {
        return BackendType.JSON;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void initialize() {
        lock.lock();
        try {
            if (initialized) {
                return;
            }
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            if (Files.exists(file)) {
                store = readFile();
                LOG.infof("Loaded %d keys from %s", store.size(), file);
            } else {
                store = new TreeMap<>();
                writeFile();
                LOG.infof("Created new storage file %s", file);
            }
            initialized = true;
        } catch (IOException e) {
            throw new StorageException(String.format("Unable to initialize json storage at %s", file), e);
        } finally {
            lock.unlock();
        }
    }

    private TreeMap<String, JsonNode> readFile() throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        TreeMap<String, JsonNode> loaded = new TreeMap<>();
        if (content.isBlank()) {
            return loaded;
        }
        JsonNode root;
        try {
            root = JSONUtils.instance().parse(content);
        } catch (JsonProcessingException e) {
            throw new StorageException(String.format("Storage file %s is corrupt: %s", file, e.getOriginalMessage()), e);
        }
        if (!root.isObject()) {
            throw new StorageException(String.format("Storage file %s does not contain a json object", file));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            loaded.put(field.getKey(), field.getValue());
        }
        return loaded;
    }

    @Override
    protected Optional<JsonNode> load(String key) {
        lock.lock();
        try {
            JsonNode value = store.get(key);
            return value == null ? Optional.empty() : Optional.of(value.deepCopy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void store(String key, JsonNode value) {
        JsonNode normalized = normalize(key, value);
        lock.lock();
        try {
            store.put(key, normalized);
            dirty = true;
            autoSave();
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected boolean remove(String key) {
        lock.lock();
        try {
            boolean removed = store.remove(key) != null;
            if (removed) {
                dirty = true;
                autoSave();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected boolean contains(String key) {
        lock.lock();
        try {
            return store.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected List<String> keys(String prefix) {
        lock.lock();
        try {
            List<String> keys = new ArrayList<>();
            for (String key : store.tailMap(prefix, true).keySet()) {
                if (!key.startsWith(prefix)) {
                    break;
                }
                keys.add(key);
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void removeAll() {
        lock.lock();
        try {
            store.clear();
            dirty = true;
            autoSave();
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected long storageSize() {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            LOG.debugf("Unable to read size of %s: %s", file, e.getMessage());
            return -1L;
        }
    }

    @Override
    public Map<String, JsonNode> exportData() {
        requireInitialized();
        lock.lock();
        try {
            return deepCopy(store);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T, E extends Exception> T transaction(TransactionWork<T, E> work) throws E {
        requireInitialized();
        lock.lock();
        try {
            if (transactionDepth > 0) {
                transactionDepth++;
                try {
                    return work.execute(this);
                } finally {
                    transactionDepth--;
                }
            }

            holding = deepCopy(store);
            boolean dirtyBefore = dirty;
            transactionDepth = 1;
            try {
                T result = work.execute(this);
                transactionDepth = 0;
                if (autoSave && dirty) {
                    writeFile();
                }
                holding = null;
                return result;
            } catch (Throwable t) {
                transactionDepth = 0;
                store = holding;
                holding = null;
                dirty = dirtyBefore;
                invalidateCache();
                LOG.debugf("Rolled back json transaction on %s: %s", file, t.toString());
                throw t;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the store to disk now, regardless of the auto-save setting.
     */
    public void flush() {
        requireInitialized();
        lock.lock();
        try {
            writeFile();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (!initialized) {
                return;
            }
            if (dirty && transactionDepth == 0) {
                writeFile();
            }
            initialized = false;
            invalidateCache();
        } finally {
            lock.unlock();
        }
    }

    public boolean inTransaction() {
        return transactionDepth > 0;
    }

    private void autoSave() {
        if (autoSave && transactionDepth == 0) {
            writeFile();
        }
    }

    /**
     * Rotates the previous file into {@code .bak1..N}, writes a temporary sibling and moves it
     * over the target.
     */
    private void writeFile() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.write(tmp, JSONUtils.instance().getPrettyWriter().writeValueAsBytes(store));
            rotateBackups();
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            dirty = false;
        } catch (IOException e) {
            throw new StorageException(String.format("Unable to write storage file %s", file), e);
        }
    }

    private void rotateBackups() throws IOException {
        if (fileBackupCount <= 0 || !Files.exists(file)) {
            return;
        }
        for (int i = fileBackupCount - 1; i >= 1; i--) {
            Path older = backupFile(i);
            if (Files.exists(older)) {
                Files.move(older, backupFile(i + 1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.copy(file, backupFile(1), StandardCopyOption.REPLACE_EXISTING);
    }

    Path backupFile(int index) {
        return file.resolveSibling(file.getFileName() + ".bak" + index);
    }

    /**
     * Keeps the in-memory document identical to what reading the file back produces, e.g. a
     * long that fits an int is held as an int node.
     */
    private static JsonNode normalize(String key, JsonNode value) {
        try {
            ObjectMapper mapper = JSONUtils.instance().getMapper();
            return mapper.readTree(mapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new StorageException(String.format("Value of key %s can not be serialized", key), e);
        }
    }

    private static TreeMap<String, JsonNode> deepCopy(TreeMap<String, JsonNode> source) {
        TreeMap<String, JsonNode> copy = new TreeMap<>();
        source.forEach((key, value) -> copy.put(key, value.deepCopy()));
        return copy;
    }
}
