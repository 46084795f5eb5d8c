// file: src/main/java/io/pagelite/storage/KeyValueStore.java
package io.pagelite.storage;

import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Minimal synchronous KV interface used by the page layer.
 * <p>
 * Semantics:
 *  - Every call runs in its own transaction against a single namespace.
 *  - Reads use read-only transactions and see a consistent snapshot.
 *  - Writes use read-write transactions; writers are serialized and a failed
 *    write leaves the previous state untouched.
 *  - Iteration is in lexicographic (unsigned byte) order of the UTF-8 names.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Look up the value stored under 'name'.
     * A missing key (or an empty name) is {@link Optional#empty()}, never an error.
     */
    Optional<byte[]> get(String name);

    /**
     * Insert or overwrite 'name'.
     *
     * @throws NameEmptyException          if name is null or empty
     * @throws StorageUnavailableException on I/O failure
     */
    void put(String name, byte[] value);

    /**
     * Write all entries in one transaction: either all of them commit or none.
     * Later entries win over earlier ones with the same name.
     */
    void putAll(List<Entry> entries);

    /**
     * Remove 'name'. Deleting an absent key is a successful no-op.
     *
     * @throws NameEmptyException if name is null or empty
     */
    void delete(String name);

    /**
     * Visit every entry in key order inside one read-only transaction.
     * The visitor must not keep references beyond the call.
     */
    void forEach(BiConsumer<String, byte[]> visitor);

    /** Number of entries in the namespace. */
    long count();

    /** Longest name, in UTF-8 bytes, that {@link #put} accepts. */
    int maxNameBytes();

    /** Release the underlying handle. Further calls fail with {@link StorageUnavailableException}. */
    @Override
    void close();

    /** A (name, value) pair, used for batch writes. */
    record Entry(String name, byte[] value) {}
}
