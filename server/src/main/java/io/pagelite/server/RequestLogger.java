// file: src/main/java/io/pagelite/server/RequestLogger.java
package io.pagelite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log method/path/status and latency of HTTP requests.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param storageMillis store latency, or -1 if the request did not touch the store
     * @param error         exception behind a failure, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storageMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                storageMillis >= 0 ? ", storage=" + storageMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
