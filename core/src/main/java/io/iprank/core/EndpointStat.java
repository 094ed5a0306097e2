// file: core/src/main/java/io/iprank/core/EndpointStat.java
package io.iprank.core;

import java.util.Objects;

/**
 * Smoothed throughput state for one endpoint inside one partition.
 * <p>
 * Fields:
 *  - endpoint:             opaque identifier (network address), unique within a partition.
 *  - ewma:                 smoothed throughput in Mbps; NaN until the first sample is folded in.
 *  - sampleCount:          number of samples folded into ewma; never decreases.
 *  - lastObservedAtMillis: epoch millis of the most recently folded sample (0 when empty).
 * <p>
 * Invariants:
 *  - sampleCount == 0  <=>  ewma is NaN ("no data yet" is never confused with 0 Mbps).
 *  - sampleCount > 0   =>   ewma is finite and >= 0.
 */
public record EndpointStat(
        String endpoint,
        double ewma,
        long sampleCount,
        long lastObservedAtMillis
) {

    public EndpointStat {
        Objects.requireNonNull(endpoint, "endpoint");
        if (endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must not be blank");
        }
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be >= 0, got " + sampleCount);
        }
        if (sampleCount == 0 && !Double.isNaN(ewma)) {
            throw new IllegalArgumentException("ewma must be unset (NaN) when sampleCount == 0");
        }
        if (sampleCount > 0 && !(Double.isFinite(ewma) && ewma >= 0.0)) {
            throw new IllegalArgumentException("ewma must be finite and >= 0, got " + ewma);
        }
    }

    /** Record for an endpoint that has never been measured. */
    public static EndpointStat empty(String endpoint) {
        return new EndpointStat(endpoint, Double.NaN, 0L, 0L);
    }

    public boolean hasEstimate() {
        return sampleCount > 0;
    }
}
