// file: src/main/java/io/pagelite/storage/NameEmptyException.java
package io.pagelite.storage;

/** A write was attempted with a null or empty name. */
public class NameEmptyException extends IllegalArgumentException {

    public NameEmptyException() {
        super("name is empty");
    }
}
