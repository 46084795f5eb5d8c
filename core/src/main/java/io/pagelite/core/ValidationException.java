// file: src/main/java/io/pagelite/core/ValidationException.java
package io.pagelite.core;

/**
 * Caller supplied an empty name or a document that is not valid JSON.
 * Never retried; no state is mutated when this is thrown.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
