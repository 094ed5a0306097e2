package io.iprank.server;

/**
 * Outcome of an accepted sample: the endpoint's state right after the fold.
 */
public record IngestResult(String partition, String endpoint, double ewma, long sampleCount) {
}
