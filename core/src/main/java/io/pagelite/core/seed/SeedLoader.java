// file: src/main/java/io/pagelite/core/seed/SeedLoader.java
package io.pagelite.core.seed;

import io.pagelite.storage.KeyValueStore;
import io.pagelite.storage.StorageUnavailableException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes bundled page documents into the store at startup.
 * <p>
 * Algorithm:
 *  1) Enumerate the source; files without the ".json" suffix are not documents
 *     (e.g. the page shell template) and are ignored.
 *  2) Name = file name minus ".json". Directories are not part of the name.
 *  3) Read each document. Unreadable, empty or unnamable documents are recorded
 *     as {@link SeedFailure}s and skipped; the rest of the batch goes on.
 *  4) Upsert every remaining document in ONE write transaction.
 * <p>
 * Seeds always overwrite a stored entry with the same name, on every start.
 * Operator edits to a seeded page survive a restart only under another name.
 * Entries whose names are not in the seed set are never touched.
 */
public final class SeedLoader {
    private static final Logger log = Logger.getLogger(SeedLoader.class.getName());

    public static final String DOCUMENT_SUFFIX = ".json";

    private final KeyValueStore store;

    public SeedLoader(KeyValueStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Merge 'source' into the store.
     *
     * @throws StorageUnavailableException if the batch write itself fails
     */
    public SeedReport load(SeedSource source) {
        Objects.requireNonNull(source, "source");

        List<SeedFile> files;
        try {
            files = source.files();
        } catch (IOException e) {
            log.log(Level.WARNING, "cannot enumerate seed source " + source, e);
            return new SeedReport(List.of(), List.of(new SeedFailure(source.toString(), describe(e))));
        }

        List<KeyValueStore.Entry> batch = new ArrayList<>();
        List<String> loaded = new ArrayList<>();
        List<SeedFailure> failures = new ArrayList<>();

        for (SeedFile file : files) {
            String fileName = file.fileName();
            if (!fileName.endsWith(DOCUMENT_SUFFIX)) {
                continue;
            }
            String name = fileName.substring(0, fileName.length() - DOCUMENT_SUFFIX.length());
            if (name.isEmpty()) {
                skip(failures, fileName, "document name is empty", null);
                continue;
            }
            if (name.getBytes(StandardCharsets.UTF_8).length > store.maxNameBytes()) {
                skip(failures, fileName, "document name exceeds " + store.maxNameBytes() + " bytes", null);
                continue;
            }

            byte[] document;
            try {
                document = file.read();
            } catch (IOException e) {
                skip(failures, fileName, describe(e), e);
                continue;
            }
            if (document.length == 0) {
                skip(failures, fileName, "document is empty", null);
                continue;
            }

            batch.add(new KeyValueStore.Entry(name, document));
            loaded.add(fileName);
        }

        store.putAll(batch);
        for (String fileName : loaded) {
            log.info("load page data to store, file: " + fileName);
        }
        return new SeedReport(loaded, failures);
    }

    private static void skip(List<SeedFailure> failures, String fileName, String error, Throwable cause) {
        failures.add(new SeedFailure(fileName, error));
        log.log(Level.WARNING, "read page data failed, filename: " + fileName + ", err: " + error, cause);
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
