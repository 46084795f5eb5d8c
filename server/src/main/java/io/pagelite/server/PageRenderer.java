// file: src/main/java/io/pagelite/server/PageRenderer.java
package io.pagelite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Renders the HTML shell that boots the page renderer for one page config.
 * <p>
 * Template placeholders:
 *  - {{pageTitle}}         page name, HTML-escaped
 *  - {{getConfigAddr}}     URL of the raw config, HTML-escaped
 *  - {{pageSchemaApiJson}} schema API ("GET:/config/get/{name}") as a JSON string literal
 */
public final class PageRenderer {
    public static final String TEMPLATE_RESOURCE = "static/amis.tmpl";
    public static final String NOT_FOUND_PAGE = "404";

    private final String template;
    private final ObjectMapper json = new ObjectMapper();

    public PageRenderer(String template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    /** Load the bundled template. */
    public static PageRenderer fromClasspath() {
        try (InputStream in = PageRenderer.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing resource " + TEMPLATE_RESOURCE);
            }
            return new PageRenderer(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + TEMPLATE_RESOURCE, e);
        }
    }

    public String render(String name) {
        String page = (name == null || name.isEmpty()) ? NOT_FOUND_PAGE : name;
        String configAddr = "/config/get/" + encodePath(page);
        return template
                .replace("{{pageTitle}}", escapeHtml(page))
                .replace("{{getConfigAddr}}", escapeHtml(configAddr))
                .replace("{{pageSchemaApiJson}}", jsonLiteral("GET:" + configAddr));
    }

    private String jsonLiteral(String s) {
        try {
            // "</" would end the surrounding <script> block
            return json.writeValueAsString(s).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode string", e);
        }
    }

    /** Percent-encode each '/'-separated segment; the separators stay literal. */
    static String encodePath(String name) {
        String[] segments = name.split("/", -1);
        StringBuilder sb = new StringBuilder(name.length() + 16);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return sb.toString();
    }

    static String escapeHtml(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
