// file: src/main/java/io/pagelite/core/FallbackPage.java
package io.pagelite.core;

import java.nio.charset.StandardCharsets;

/**
 * Page schema served in place of a missing page config.
 * It is a regular page document, so renderers never special-case "missing".
 */
public final class FallbackPage {

    public static final String TITLE = "404";

    private static final String JSON = "{\"type\":\"page\",\"title\":\"" + TITLE + "\","
            + "\"body\":[{\"type\":\"markdown\",\"value\":"
            + "\"# 🚫 Oops, page config not found\\n[👉 Back to the page list](/)\"}],"
            + "\"regions\":[\"body\"]}";

    private static final byte[] BYTES = JSON.getBytes(StandardCharsets.UTF_8);

    private FallbackPage() {
    }

    /** A fresh copy of the fallback document. */
    public static byte[] bytes() {
        return BYTES.clone();
    }

    public static String text() {
        return JSON;
    }
}
