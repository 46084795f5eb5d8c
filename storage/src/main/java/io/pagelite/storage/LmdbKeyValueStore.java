// file: src/main/java/io/pagelite/storage/LmdbKeyValueStore.java
package io.pagelite.storage;

import org.lmdbjava.CursorIterable;
import org.lmdbjava.Dbi;
import org.lmdbjava.DbiFlags;
import org.lmdbjava.Env;
import org.lmdbjava.EnvFlags;
import org.lmdbjava.LmdbException;
import org.lmdbjava.Txn;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static org.lmdbjava.ByteArrayProxy.PROXY_BA;

/**
 * {@link KeyValueStore} backed by a single LMDB file.
 * <p>
 * Layout:
 *  - The environment is opened with MDB_NOSUBDIR, so 'path' is the data file
 *    itself and LMDB keeps its reader table next to it in "path-lock".
 *  - All entries live in one named database, the "page" namespace.
 * <p>
 * Concurrency:
 *  - LMDB gives MVCC snapshots to readers and serializes writers internally,
 *    so one instance is shared by all request threads without extra locking.
 *  - MDB_NOTLS detaches read transactions from threads, which keeps pooled
 *    worker threads from exhausting reader slots.
 * <p>
 * Ownership:
 *  - LMDB must not be opened twice on the same file within one process, so
 *    open() claims the path and close() releases it.
 */
public final class LmdbKeyValueStore implements KeyValueStore {
    private static final Logger log = Logger.getLogger(LmdbKeyValueStore.class.getName());

    public static final String NAMESPACE = "page";

    private static final int OWNER_READ_WRITE = 0600;
    private static final Set<Path> OPEN_PATHS = ConcurrentHashMap.newKeySet();

    private final Path file;
    private final Env<byte[]> env;
    private final int maxKeyBytes;
    private volatile Dbi<byte[]> dbi;
    private volatile boolean closed;

    private LmdbKeyValueStore(Path file, Env<byte[]> env) {
        this.file = file;
        this.env = env;
        this.maxKeyBytes = env.getMaxKeySize();
    }

    /** Open (creating if absent) the store at 'path' with default options. */
    public static LmdbKeyValueStore open(Path path) {
        return open(path, StoreOptions.defaults());
    }

    /**
     * Open (creating if absent) the store file at 'path' with owner-only permissions
     * and make sure the namespace exists.
     *
     * @throws StorageUnavailableException if the file cannot be created or opened,
     *                                     or is already open in this process
     */
    public static LmdbKeyValueStore open(Path path, StoreOptions options) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(options, "options");
        Path file = path.toAbsolutePath().normalize();

        if (!OPEN_PATHS.add(file)) {
            throw new StorageUnavailableException("store already open in this process: " + file);
        }

        Env<byte[]> env;
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            env = Env.create(PROXY_BA)
                    .setMapSize(options.mapSizeBytes())
                    .setMaxDbs(1)
                    .setMaxReaders(options.maxReaders())
                    .open(file.toFile(), OWNER_READ_WRITE, EnvFlags.MDB_NOSUBDIR, EnvFlags.MDB_NOTLS);
        } catch (IOException | LmdbException e) {
            OPEN_PATHS.remove(file);
            throw new StorageUnavailableException("cannot open store at " + file, e);
        }

        var store = new LmdbKeyValueStore(file, env);
        try {
            store.ensureNamespace();
        } catch (StorageUnavailableException e) {
            store.close();
            throw e;
        }
        log.fine(() -> "opened store " + file + " (mapSize=" + options.mapSizeBytes() + ")");
        return store;
    }

    /** Create the namespace if it does not exist yet. Safe to call repeatedly. */
    public void ensureNamespace() {
        if (dbi != null) {
            return;
        }
        synchronized (this) {
            ensureOpen();
            if (dbi == null) {
                try {
                    dbi = env.openDbi(NAMESPACE, DbiFlags.MDB_CREATE);
                } catch (LmdbException e) {
                    throw new StorageUnavailableException("cannot create namespace " + NAMESPACE, e);
                }
            }
        }
    }

    @Override
    public Optional<byte[]> get(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        byte[] key = name.getBytes(StandardCharsets.UTF_8);
        if (key.length > maxKeyBytes) {
            // can never have been written
            return Optional.empty();
        }
        ensureOpen();
        try (Txn<byte[]> txn = env.txnRead()) {
            return Optional.ofNullable(namespace().get(txn, key));
        } catch (LmdbException e) {
            throw new StorageUnavailableException("read failed for '" + name + "'", e);
        }
    }

    @Override
    public void put(String name, byte[] value) {
        byte[] key = keyOf(name);
        Objects.requireNonNull(value, "value");
        write("put '" + name + "'", txn -> namespace().put(txn, key, value));
    }

    @Override
    public void putAll(List<Entry> entries) {
        Objects.requireNonNull(entries, "entries");
        // validate everything before the transaction starts so a bad name commits nothing
        List<byte[][]> pairs = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            pairs.add(new byte[][]{keyOf(e.name()), Objects.requireNonNull(e.value(), "value")});
        }
        if (pairs.isEmpty()) {
            return;
        }
        write("batch of " + pairs.size(), txn -> {
            Dbi<byte[]> db = namespace();
            for (byte[][] kv : pairs) {
                db.put(txn, kv[0], kv[1]);
            }
        });
    }

    @Override
    public void delete(String name) {
        if (name == null || name.isEmpty()) {
            throw new NameEmptyException();
        }
        byte[] key = name.getBytes(StandardCharsets.UTF_8);
        if (key.length > maxKeyBytes) {
            return;
        }
        write("delete '" + name + "'", txn -> namespace().delete(txn, key));
    }

    @Override
    public void forEach(BiConsumer<String, byte[]> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        ensureOpen();
        try (Txn<byte[]> txn = env.txnRead();
             CursorIterable<byte[]> cursor = namespace().iterate(txn)) {
            for (CursorIterable.KeyVal<byte[]> kv : cursor) {
                visitor.accept(new String(kv.key(), StandardCharsets.UTF_8), kv.val());
            }
        } catch (LmdbException e) {
            throw new StorageUnavailableException("cannot iterate namespace " + NAMESPACE, e);
        }
    }

    @Override
    public long count() {
        ensureOpen();
        try (Txn<byte[]> txn = env.txnRead()) {
            return namespace().stat(txn).entries;
        } catch (LmdbException e) {
            throw new StorageUnavailableException("cannot stat namespace " + NAMESPACE, e);
        }
    }

    @Override
    public int maxNameBytes() {
        return maxKeyBytes;
    }

    /** Absolute path of the data file. */
    public Path path() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            env.close();
        } finally {
            OPEN_PATHS.remove(file);
        }
    }

    // ---------- helpers ----------

    private void write(String what, Consumer<Txn<byte[]>> body) {
        ensureOpen();
        try (Txn<byte[]> txn = env.txnWrite()) {
            body.accept(txn);
            txn.commit();
        } catch (LmdbException e) {
            // closing an uncommitted Txn aborts it, prior state is intact
            throw new StorageUnavailableException("write failed: " + what, e);
        }
    }

    private byte[] keyOf(String name) {
        if (name == null || name.isEmpty()) {
            throw new NameEmptyException();
        }
        byte[] key = name.getBytes(StandardCharsets.UTF_8);
        if (key.length > maxKeyBytes) {
            throw new IllegalArgumentException(
                    "name exceeds " + maxKeyBytes + " bytes: " + name.substring(0, Math.min(32, name.length())) + "...");
        }
        return key;
    }

    private Dbi<byte[]> namespace() {
        Dbi<byte[]> db = dbi;
        if (db == null) {
            ensureNamespace();
            db = dbi;
        }
        return db;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageUnavailableException("store is closed: " + file);
        }
    }
}
