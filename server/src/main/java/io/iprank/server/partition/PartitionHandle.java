package io.iprank.server.partition;

import io.iprank.core.EndpointStat;
import io.iprank.core.RankedResult;
import io.iprank.core.ThroughputSample;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point to exactly one logical partition.
 * <p>
 * All calls on the same handle are executed one at a time, in arrival order.
 * Futures complete exceptionally with:
 *  - {@link io.iprank.core.InvalidSampleException} for samples the tracker refuses,
 *  - {@link PartitionUnavailableException} when the backing store fails.
 * <p>
 * Cancelling a returned future before its task starts guarantees the task
 * never runs; once started, cancel() returns false and the task completes.
 */
public interface PartitionHandle {

    String partitionKey();

    CompletableFuture<EndpointStat> ingest(ThroughputSample sample);

    CompletableFuture<List<RankedResult>> computeTop(long nowMillis, int limit);

    /** Last ranking this partition computed successfully, if any. */
    Optional<ComputedRanking> lastComputed();

    /**
     * A ranking plus the inputs that produced it.
     *
     * @param top              ranked rows, best first
     * @param computedAtMillis the "now" used for freshness decay
     * @param limit            the limit it was computed with; top.size() < limit means complete
     */
    record ComputedRanking(List<RankedResult> top, long computedAtMillis, int limit) {
        public ComputedRanking {
            top = List.copyOf(top);
        }

        /** True when this ranking can answer a request for {@code requested} rows. */
        public boolean covers(int requested) {
            return requested <= limit || top.size() < limit;
        }

        public List<RankedResult> truncate(int requested) {
            return top.size() <= requested ? top : top.subList(0, requested);
        }
    }
}
