// file: core/src/main/java/io/iprank/core/RankingEngine.java
package io.iprank.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Freshness- and confidence-weighted ranking over one partition.
 * <p>
 * For every stored endpoint with an estimate:
 * <pre>
 *   ageSeconds = max(0, (now - lastObservedAt) / 1000)
 *   freshness  = exp(-ageSeconds / tau)
 *   confidence = sampleCount >= threshold ? 1.0 : penalty
 *   score      = ewma * freshness * confidence
 * </pre>
 * Results are ordered by score descending, endpoint ascending on ties, so the
 * output is a pure function of (stored state, now).
 * <p>
 * The scan is read-only. A bounded min-heap keeps memory at O(limit) for large
 * partitions.
 */
public final class RankingEngine {

    /** Best first: higher score, then lexicographically smaller endpoint. */
    public static final Comparator<RankedResult> RANK_ORDER =
            Comparator.comparingDouble(RankedResult::score).reversed()
                    .thenComparing(RankedResult::endpoint);

    private final EndpointStatStore store;
    private final AggregationSettings settings;

    public RankingEngine(EndpointStatStore store, AggregationSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<RankedResult> computeTop(String partition, long nowMillis, int limit) {
        Objects.requireNonNull(partition, "partition");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }

        // Head of the heap is the worst entry currently kept.
        PriorityQueue<RankedResult> heap = new PriorityQueue<>(Math.min(limit, 1024) + 1, RANK_ORDER.reversed());
        for (EndpointStat stat : store.scan(partition)) {
            if (!stat.hasEstimate()) {
                continue;
            }
            RankedResult r = new RankedResult(
                    stat.endpoint(),
                    score(stat, nowMillis),
                    stat.ewma(),
                    stat.lastObservedAtMillis()
            );
            heap.offer(r);
            if (heap.size() > limit) {
                heap.poll();
            }
        }

        List<RankedResult> out = new ArrayList<>(heap);
        out.sort(RANK_ORDER);
        return List.copyOf(out);
    }

    public double score(EndpointStat stat, long nowMillis) {
        return stat.ewma() * freshness(stat.lastObservedAtMillis(), nowMillis) * confidence(stat.sampleCount());
    }

    double freshness(long lastObservedAtMillis, long nowMillis) {
        // Clock skew can put lastObservedAt in the future; treat as age 0.
        if (lastObservedAtMillis >= nowMillis) {
            return 1.0;
        }
        // Subtract in double: a long difference overflows for timestamps near Long.MIN_VALUE.
        double ageSeconds = ((double) nowMillis - (double) lastObservedAtMillis) / 1000.0;
        return Math.exp(-ageSeconds / settings.decayTauSeconds());
    }

    double confidence(long sampleCount) {
        return sampleCount >= settings.confidenceThreshold() ? 1.0 : settings.lowConfidencePenalty();
    }

    public AggregationSettings settings() {
        return settings;
    }
}
