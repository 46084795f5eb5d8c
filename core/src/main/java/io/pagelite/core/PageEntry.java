// file: src/main/java/io/pagelite/core/PageEntry.java
package io.pagelite.core;

import java.nio.charset.StandardCharsets;

/**
 * A stored page configuration: its name and the raw document bytes.
 */
public record PageEntry(String name, byte[] document) {

    /** Document decoded as UTF-8 text. */
    public String documentText() {
        return new String(document, StandardCharsets.UTF_8);
    }
}
