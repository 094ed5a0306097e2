// file: server/src/main/java/io/iprank/server/RequestLogger.java
package io.iprank.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for request-level logging.
 * One line per request: method, path, partition, status and latency.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method          HTTP method
     * @param path            request path
     * @param partition       partition key the request was routed to, or null
     * @param status          HTTP status code
     * @param totalMillis     wall-clock latency for the whole request
     * @param partitionMillis latency of the partition/service call, or -1 if not measured
     * @param error           optional exception (logged with the stack trace for 5xx), null if none
     */
    public static void logRequest(
            String method,
            String path,
            String partition,
            int status,
            long totalMillis,
            long partitionMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s%s -> %d (total=%dms%s)",
                method,
                path,
                partition != null ? " [partition=" + partition + "]" : "",
                status,
                totalMillis,
                partitionMillis >= 0 ? ", partition=" + partitionMillis + "ms" : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
