// file: src/main/java/io/pagelite/core/PageConfigRepository.java
package io.pagelite.core;

import io.pagelite.storage.KeyValueStore;
import io.pagelite.storage.StorageUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Page-config operations on top of a {@link KeyValueStore}.
 * <p>
 * Responsibilities:
 *  - Hide the storage namespace from the HTTP layer.
 *  - Replace misses with {@link FallbackPage} so readers always get a page schema.
 *  - Reject empty names and non-JSON documents before touching the store.
 * <p>
 * Storage failures are not translated: {@link StorageUnavailableException}
 * reaches the caller, which decides how to report it.
 */
public class PageConfigRepository {

    private final KeyValueStore store;
    private final DocumentValidator validator;

    public PageConfigRepository(KeyValueStore store) {
        this(store, new DocumentValidator());
    }

    public PageConfigRepository(KeyValueStore store, DocumentValidator validator) {
        this.store = Objects.requireNonNull(store, "store");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * All stored page configs in name order, read from one snapshot.
     *
     * @throws StorageUnavailableException if the namespace cannot be read
     */
    public PageListing list() {
        List<PageEntry> items = new ArrayList<>();
        store.forEach((name, document) -> items.add(new PageEntry(name, document)));
        return PageListing.of(items);
    }

    /**
     * The document stored under 'name', or the fallback document if the name is
     * empty, unknown, or holds an empty value.
     */
    public byte[] get(String name) {
        if (name == null || name.isEmpty()) {
            return FallbackPage.bytes();
        }
        return store.get(name)
                .filter(doc -> doc.length > 0)
                .orElseGet(FallbackPage::bytes);
    }

    /**
     * Store 'document' under 'name', replacing any previous version.
     *
     * @throws ValidationException if the name is empty or the document is not valid JSON
     */
    public void save(String name, byte[] document) {
        requireName(name);
        validator.requireValidJson(document);
        try {
            store.put(name, document);
        } catch (IllegalArgumentException e) {
            // e.g. name longer than the store accepts
            throw new ValidationException(e.getMessage(), e);
        }
    }

    /**
     * Remove 'name'. Unknown names are a no-op.
     *
     * @throws ValidationException if the name is empty
     */
    public void delete(String name) {
        requireName(name);
        store.delete(name);
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new ValidationException("name is empty");
        }
    }
}
