// file: src/test/java/io/pagelite/core/DocumentValidatorTest.java
package io.pagelite.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DocumentValidatorTest {

    private final DocumentValidator validator = new DocumentValidator();

    private void valid(String doc) {
        assertDoesNotThrow(() -> validator.requireValidJson(doc.getBytes(StandardCharsets.UTF_8)), doc);
    }

    private void invalid(String doc) {
        assertThrows(ValidationException.class,
                () -> validator.requireValidJson(doc.getBytes(StandardCharsets.UTF_8)), doc);
    }

    @Test
    void accepts_any_single_json_value() {
        valid("{\"type\":\"page\",\"regions\":[\"body\"]}");
        valid("[1,2,3]");
        valid("\"just a string\"");
        valid("42");
        valid("  {\"padded\":true}\n");
    }

    @Test
    void rejects_broken_or_trailing_content() {
        invalid("{not json");
        invalid("{\"a\":1}}");
        invalid("{\"a\":1} {\"b\":2}");
        invalid("   ");
        invalid("");
    }

    private static String nested(int depth) {
        return "[".repeat(depth) + "]".repeat(depth);
    }

    @Test
    void accepts_nesting_deeper_than_the_jackson_default() {
        valid(nested(1_500));
        valid(nested(DocumentValidator.MAX_NESTING_DEPTH));
    }

    @Test
    void too_deep_nesting_is_reported_as_a_limit_not_as_bad_syntax() {
        var e = assertThrows(ValidationException.class, () -> validator.requireValidJson(
                nested(DocumentValidator.MAX_NESTING_DEPTH + 1).getBytes(StandardCharsets.UTF_8)));
        assertTrue(e.getMessage().startsWith("config exceeds a size limit"), e.getMessage());
    }

    @Test
    void rejects_null_document() {
        assertThrows(ValidationException.class, () -> validator.requireValidJson(null));
    }
}
