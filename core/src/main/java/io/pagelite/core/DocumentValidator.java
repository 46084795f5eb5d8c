// file: src/main/java/io/pagelite/core/DocumentValidator.java
package io.pagelite.core;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Syntax-only JSON check for page documents.
 * <p>
 * Accepts exactly one JSON value (object, array or scalar) with nothing but
 * whitespace after it. The shape of the page schema is not inspected.
 * <p>
 * Limits (a document over a limit is rejected as too large, not as malformed):
 *  - nesting depth: {@value #MAX_NESTING_DEPTH} arrays/objects
 *  - string value length: {@value #MAX_STRING_LENGTH} chars, the HTTP body cap
 */
public final class DocumentValidator {
    public static final int MAX_NESTING_DEPTH = 2_000;
    public static final int MAX_STRING_LENGTH = 10 * 1024 * 1024;

    private final ObjectMapper json;

    public DocumentValidator() {
        StreamReadConstraints limits = StreamReadConstraints.builder()
                .maxNestingDepth(MAX_NESTING_DEPTH)
                .maxStringLength(MAX_STRING_LENGTH)
                .build();
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(limits)
                .build();
        this.json = new ObjectMapper(factory)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @throws ValidationException if 'document' is empty, not valid JSON, or over a limit
     */
    public void requireValidJson(byte[] document) {
        if (document == null || document.length == 0) {
            throw new ValidationException("config is empty");
        }
        JsonNode node;
        try {
            node = json.readTree(document);
        } catch (StreamConstraintsException e) {
            throw new ValidationException("config exceeds a size limit: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ValidationException("config is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ValidationException("config is not valid JSON", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new ValidationException("config is empty");
        }
    }
}
