package io.iprank.server;

import java.time.Duration;

/**
 * A sample was not folded within the ingest timeout and was discarded.
 * The collector should treat it as a failed measurement.
 */
public class IngestTimeoutException extends RuntimeException {

    public IngestTimeoutException(String partition, Duration timeout) {
        super("ingest for partition " + partition + " timed out after " + timeout.toMillis() + "ms");
    }
}
