// file: src/main/java/io/pagelite/storage/StoreOptions.java
package io.pagelite.storage;

/**
 * Tuning knobs for {@link LmdbKeyValueStore}.
 *
 * @param mapSizeBytes upper bound for the store file; writes beyond it fail
 * @param maxReaders   maximum number of concurrent read transactions
 */
public record StoreOptions(long mapSizeBytes, int maxReaders) {

    public static final long DEFAULT_MAP_SIZE = 64L * 1024 * 1024; // 64 MiB
    // every read transaction in flight holds one slot; reads past the limit fail
    public static final int DEFAULT_MAX_READERS = 512;

    public StoreOptions {
        if (mapSizeBytes <= 0) throw new IllegalArgumentException("mapSizeBytes must be > 0");
        if (maxReaders <= 0) throw new IllegalArgumentException("maxReaders must be > 0");
    }

    public static StoreOptions defaults() {
        return new StoreOptions(DEFAULT_MAP_SIZE, DEFAULT_MAX_READERS);
    }

    public StoreOptions withMapSizeBytes(long bytes) {
        return new StoreOptions(bytes, maxReaders);
    }

    public StoreOptions withMaxReaders(int readers) {
        return new StoreOptions(mapSizeBytes, readers);
    }
}
