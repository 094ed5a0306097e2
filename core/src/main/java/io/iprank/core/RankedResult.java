package io.iprank.core;

/**
 * One row of a partition ranking.
 * <p>
 * Derived from {@link EndpointStat} at read time; never authoritative.
 *
 * @param endpoint             endpoint identifier
 * @param score                ewma * freshness * confidence
 * @param ewma                 smoothed throughput in Mbps
 * @param lastObservedAtMillis epoch millis of the latest folded sample
 */
public record RankedResult(
        String endpoint,
        double score,
        double ewma,
        long lastObservedAtMillis
) {}
