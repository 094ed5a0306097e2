package io.iprank.client;

/**
 * Result of one timed download.
 *
 * @param endpoint         candidate that was measured
 * @param bytesReceived    body bytes received before completion or failure
 * @param durationMs       wall-clock time from request start to last byte
 * @param observedAtMillis epoch ms when the download finished
 * @param error            null on success, otherwise why the measurement is unusable
 */
public record Measurement(String endpoint, long bytesReceived, double durationMs, long observedAtMillis, String error) {

    public boolean ok() {
        return error == null && bytesReceived > 0;
    }

    /** bytes * 8 / seconds / 1e6, or 0 for failed measurements. */
    public double mbps() {
        if (!ok() || durationMs <= 0) {
            return 0.0;
        }
        return bytesReceived * 8.0 / (durationMs / 1000.0) / 1_000_000.0;
    }
}
