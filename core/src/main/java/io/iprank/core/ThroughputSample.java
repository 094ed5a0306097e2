// file: core/src/main/java/io/iprank/core/ThroughputSample.java
package io.iprank.core;

/**
 * One validated timing measurement against an endpoint.
 * <p>
 * Instances are only created through {@link #validated}, so every
 * ThroughputSample in the system has:
 *  - a non-blank endpoint,
 *  - bytesTransferred >= 0,
 *  - durationMs finite and > 0,
 *  - a finite derived throughput.
 */
public final class ThroughputSample {

    private static final double BITS_PER_BYTE = 8.0;
    private static final double BITS_PER_MEGABIT = 1_000_000.0;

    private final String endpoint;
    private final long bytesTransferred;
    private final double durationMs;
    private final long observedAtMillis;
    private final double throughputMbps;

    private ThroughputSample(String endpoint,
                             long bytesTransferred,
                             double durationMs,
                             long observedAtMillis,
                             double throughputMbps) {
        this.endpoint = endpoint;
        this.bytesTransferred = bytesTransferred;
        this.durationMs = durationMs;
        this.observedAtMillis = observedAtMillis;
        this.throughputMbps = throughputMbps;
    }

    /**
     * Validate raw collector input and derive its throughput.
     *
     * @throws InvalidSampleException if any field is out of range
     */
    public static ThroughputSample validated(String endpoint,
                                             long bytesTransferred,
                                             double durationMs,
                                             long observedAtMillis) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new InvalidSampleException("endpoint must not be empty");
        }
        if (bytesTransferred < 0) {
            throw new InvalidSampleException("bytesTransferred must be >= 0, got " + bytesTransferred);
        }
        if (!Double.isFinite(durationMs) || durationMs <= 0.0) {
            throw new InvalidSampleException("durationMs must be > 0, got " + durationMs);
        }
        if (observedAtMillis < 0) {
            throw new InvalidSampleException("observedAt must be >= 0 epoch millis, got " + observedAtMillis);
        }
        double mbps = throughputMbps(bytesTransferred, durationMs);
        if (!Double.isFinite(mbps)) {
            throw new InvalidSampleException("derived throughput is not finite");
        }
        return new ThroughputSample(endpoint.trim(), bytesTransferred, durationMs, observedAtMillis, mbps);
    }

    /** bytes * 8 / seconds / 1e6. */
    public static double throughputMbps(long bytesTransferred, double durationMs) {
        double seconds = durationMs / 1000.0;
        return (bytesTransferred * BITS_PER_BYTE) / seconds / BITS_PER_MEGABIT;
    }

    public String endpoint() { return endpoint; }

    public long bytesTransferred() { return bytesTransferred; }

    public double durationMs() { return durationMs; }

    public long observedAtMillis() { return observedAtMillis; }

    public double throughputMbps() { return throughputMbps; }

    @Override
    public String toString() {
        return "ThroughputSample{" +
                "endpoint='" + endpoint + '\'' +
                ", bytes=" + bytesTransferred +
                ", durationMs=" + durationMs +
                ", observedAt=" + observedAtMillis +
                ", mbps=" + throughputMbps +
                '}';
    }
}
