// file: core/src/main/java/io/iprank/core/EwmaTracker.java
package io.iprank.core;

import java.util.Objects;

/**
 * Folds throughput samples into per-endpoint EWMA state.
 * <p>
 * For each sample:
 *  - first observation seeds the estimate directly (no artificial zero baseline),
 *  - later observations use ewma' = alpha * sample + (1 - alpha) * ewma,
 *  - sampleCount is incremented and lastObservedAt is replaced.
 * <p>
 * The tracker holds no mutable state of its own. Read-modify-write atomicity
 * for a given partition is the caller's job (one serialized actor per
 * partition in the server module).
 */
public final class EwmaTracker {

    private final EndpointStatStore store;
    private final AggregationSettings settings;

    public EwmaTracker(EndpointStatStore store, AggregationSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Fold one observation into the stored record for (partition, endpoint)
     * and persist the result.
     *
     * @return the record as written
     * @throws InvalidSampleException if the throughput is negative or not finite,
     *                                or the sample is stale under {@link OutOfOrderPolicy#REJECT}
     */
    public EndpointStat update(String partition, String endpoint, double throughputMbps, long observedAtMillis) {
        Objects.requireNonNull(partition, "partition");
        if (endpoint == null || endpoint.isBlank()) {
            throw new InvalidSampleException("endpoint must not be empty");
        }
        if (!Double.isFinite(throughputMbps) || throughputMbps < 0.0) {
            throw new InvalidSampleException("throughput must be finite and >= 0, got " + throughputMbps);
        }

        EndpointStat prev = store.load(partition, endpoint).orElseGet(() -> EndpointStat.empty(endpoint));
        EndpointStat next = fold(prev, throughputMbps, observedAtMillis);
        store.save(partition, next);
        return next;
    }

    /** Pure EWMA step; exposed for tests and offline replays. */
    public EndpointStat fold(EndpointStat prev, double throughputMbps, long observedAtMillis) {
        if (prev.hasEstimate()
                && observedAtMillis < prev.lastObservedAtMillis()
                && settings.outOfOrderPolicy() == OutOfOrderPolicy.REJECT) {
            throw new InvalidSampleException(
                    "sample for " + prev.endpoint() + " observed at " + observedAtMillis
                            + " is older than stored " + prev.lastObservedAtMillis());
        }

        double ewma;
        if (!prev.hasEstimate()) {
            ewma = throughputMbps;
        } else {
            double alpha = settings.alpha();
            ewma = alpha * throughputMbps + (1.0 - alpha) * prev.ewma();
        }
        return new EndpointStat(prev.endpoint(), ewma, prev.sampleCount() + 1, observedAtMillis);
    }

    public AggregationSettings settings() {
        return settings;
    }
}
