// file: src/main/java/io/pagelite/storage/StorageUnavailableException.java
package io.pagelite.storage;

/**
 * The backing file could not be opened, locked, read or written.
 * <p>
 * Fatal when raised while opening the store at startup. At request time the
 * operation is aborted and the store stays usable for later calls.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
