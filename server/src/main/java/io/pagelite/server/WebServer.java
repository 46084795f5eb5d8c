// file: src/main/java/io/pagelite/server/WebServer.java
package io.pagelite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pagelite.core.PageConfigRepository;
import io.pagelite.core.PageEntry;
import io.pagelite.core.PageListing;
import io.pagelite.server.dto.BasicResponse;
import io.pagelite.server.dto.PageItem;
import io.pagelite.storage.StorageUnavailableException;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin HTTP adapter over {@link PageConfigRepository} and {@link PageRenderer}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Wrap repository results in the {status, msg, data} envelope.
 *  - Map Java exceptions to envelopes and HTTP status codes.
 *  - Emit per-request logging via {@link RequestLogger}.
 *
 * Path layout:
 *   - GET  /                      308 to /page/index
 *   - GET  /page/{name}           HTML shell for one page
 *   - GET  /config/list           all page configs
 *   - GET  /config/get/{name}     raw page config (fallback page on miss)
 *   - GET  /config/delete/{name}  delete a page config
 *   - POST /config/save           {"name": "...", "config": "<json text>"}
 *
 * Caller and storage errors are returned as HTTP 200 with status -1, which is
 * what the page renderer's API adaptor expects. Store calls run on worker
 * threads, never on the I/O threads.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    static final String INDEX_PAGE = "index";

    private static final String PAGE_PREFIX = "/page/";
    private static final String GET_PREFIX = "/config/get/";
    private static final String DELETE_PREFIX = "/config/delete/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final PageConfigRepository pages;
    private final PageRenderer renderer;

    public WebServer(String host, int port, PageConfigRepository pages, PageRenderer renderer) {
        this(host, port, ServerConfig.DEFAULT_WORKER_THREADS, pages, renderer);
    }

    /**
     * @param workerThreads worker pool size; the store must have at least this many reader slots
     */
    public WebServer(String host, int port, int workerThreads, PageConfigRepository pages, PageRenderer renderer) {
        this.pages = Objects.requireNonNull(pages, "pages");
        this.renderer = Objects.requireNonNull(renderer, "renderer");

        this.server = Undertow.builder()
                .addHttpListener(port, host)
                .setWorkerThreads(workerThreads)
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Port actually bound; useful when started on port 0. */
    public int port() {
        var address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return address.getPort();
    }

    private void route(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::route);
            return;
        }
        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();

        if ("/".equals(path)) {
            if (requireMethod(exchange, method, "GET")) {
                redirect(exchange, PAGE_PREFIX + INDEX_PAGE);
            }
        } else if (path.startsWith(PAGE_PREFIX)) {
            if (requireMethod(exchange, method, "GET")) {
                handlePage(exchange, path.substring(PAGE_PREFIX.length()));
            }
        } else if ("/config/list".equals(path)) {
            if (requireMethod(exchange, method, "GET")) {
                handleList(exchange);
            }
        } else if (path.startsWith(GET_PREFIX)) {
            if (requireMethod(exchange, method, "GET")) {
                handleGet(exchange, path.substring(GET_PREFIX.length()));
            }
        } else if (path.startsWith(DELETE_PREFIX)) {
            if (requireMethod(exchange, method, "GET")) {
                handleDelete(exchange, path.substring(DELETE_PREFIX.length()));
            }
        } else if ("/config/save".equals(path)) {
            if (requireMethod(exchange, method, "POST")) {
                handleSave(exchange);
            }
        } else {
            send(exchange, StatusCodes.NOT_FOUND, BasicResponse.fail("not found"));
            RequestLogger.logRequest(method, path, StatusCodes.NOT_FOUND, 0, -1, null);
        }
    }

    // ---------- handlers ----------

    /** GET / */
    private void redirect(HttpServerExchange ex, String location) {
        ex.setStatusCode(StatusCodes.PERMANENT_REDIRECT);
        ex.getResponseHeaders().put(Headers.LOCATION, location);
        ex.endExchange();
        RequestLogger.logRequest("GET", ex.getRequestPath(), StatusCodes.PERMANENT_REDIRECT, 0, -1, null);
    }

    /** GET /page/{name} */
    private void handlePage(HttpServerExchange ex, String name) {
        long start = System.nanoTime();
        int status = StatusCodes.OK;
        Throwable error = null;
        try {
            String html = renderer.render(name);
            ex.setStatusCode(status);
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=utf-8");
            ex.getResponseSender().send(html, StandardCharsets.UTF_8);
        } catch (Exception e) {
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            error = e;
            send(ex, status, BasicResponse.fail(e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, elapsedMs(start), -1, error);
        }
    }

    /** GET /config/list */
    private void handleList(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = StatusCodes.OK;
        long storageMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            PageListing listing = pages.list();
            storageMs = elapsedMs(sStart);

            List<PageItem> items = new ArrayList<>(listing.total());
            for (PageEntry e : listing.items()) {
                items.add(new PageItem(e.name(), e.documentText()));
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("items", items);
            data.put("total", listing.total());
            send(ex, status, BasicResponse.ok(data));
        } catch (StorageUnavailableException e) {
            error = e;
            send(ex, status, BasicResponse.fail(e.getMessage()));
        } catch (Exception e) {
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            error = e;
            send(ex, status, BasicResponse.fail(e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, elapsedMs(start), storageMs, error);
        }
    }

    /** GET /config/get/{name}: raw document, fallback page on miss. */
    private void handleGet(HttpServerExchange ex, String name) {
        long start = System.nanoTime();
        int status = StatusCodes.OK;
        long storageMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            byte[] document = pages.get(name);
            storageMs = elapsedMs(sStart);

            ex.setStatusCode(status);
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            ex.getResponseSender().send(ByteBuffer.wrap(document));
        } catch (Exception e) {
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            error = e;
            send(ex, status, BasicResponse.fail(e.getMessage()));
        } finally {
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, elapsedMs(start), storageMs, error);
        }
    }

    /** GET /config/delete/{name} */
    private void handleDelete(HttpServerExchange ex, String name) {
        long start = System.nanoTime();
        int status = StatusCodes.OK;
        long storageMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            pages.delete(name);
            storageMs = elapsedMs(sStart);
            send(ex, status, BasicResponse.ok("delete page config successfully"));
        } catch (IllegalArgumentException | StorageUnavailableException e) {
            error = e;
            send(ex, status, BasicResponse.fail(e.getMessage()));
        } catch (Exception e) {
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            error = e;
            send(ex, status, BasicResponse.fail(e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, elapsedMs(start), storageMs, error);
        }
    }

    /** POST /config/save */
    private void handleSave(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = StatusCodes.OK;
        long storageMs = -1L;
        Throwable error = null;
        try {
            byte[] data;
            try {
                ex.startBlocking();
                InputStream in = ex.getInputStream();
                data = in.readNBytes(MAX_BODY_BYTES + 1);
                if (data.length > MAX_BODY_BYTES) {
                    in.transferTo(OutputStream.nullOutputStream()); // drain so the client sees our reply
                }
            } catch (IOException ioEx) {
                status = StatusCodes.BAD_REQUEST;
                error = ioEx;
                send(ex, status, BasicResponse.fail("invalid request body"));
                return;
            }

            if (data.length > MAX_BODY_BYTES) {
                status = StatusCodes.REQUEST_ENTITY_TOO_LARGE;
                send(ex, status, BasicResponse.fail("request body too large"));
                return;
            }

            var req = json.readValue(data, PageItem.class);
            if (req == null) {
                send(ex, status, BasicResponse.fail("invalid JSON"));
                return;
            }
            byte[] document = req.config == null ? new byte[0] : req.config.getBytes(StandardCharsets.UTF_8);

            long sStart = System.nanoTime();
            pages.save(req.name, document);
            storageMs = elapsedMs(sStart);
            send(ex, status, BasicResponse.ok("save page config successfully"));
        } catch (JsonProcessingException jsonEx) {
            error = jsonEx;
            send(ex, status, BasicResponse.fail("invalid JSON"));
        } catch (IllegalArgumentException | StorageUnavailableException e) {
            error = e;
            send(ex, status, BasicResponse.fail(e.getMessage()));
        } catch (Exception e) {
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            error = e;
            send(ex, status, BasicResponse.fail(e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            RequestLogger.logRequest("POST", ex.getRequestPath(), status, elapsedMs(start), storageMs, error);
        }
    }

    // ---------- helpers ----------

    private boolean requireMethod(HttpServerExchange ex, String method, String allowed) {
        if (allowed.equals(method)) {
            return true;
        }
        send(ex, StatusCodes.METHOD_NOT_ALLOWED, BasicResponse.fail("method not allowed"));
        RequestLogger.logRequest(method, ex.getRequestPath(), StatusCodes.METHOD_NOT_ALLOWED, 0, -1, null);
        return false;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(ByteBuffer.wrap(bytes));
        } catch (Exception e) {
            ex.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            ex.getResponseSender().send("{\"status\":-1,\"msg\":\"serialization\"}");
        }
    }
}
