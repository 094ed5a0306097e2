package io.iprank.server;

import io.iprank.core.RankedResult;

import java.util.List;

/**
 * Ranking as served to a caller.
 *
 * @param partition        normalized partition key
 * @param top              rows, best first, at most the requested limit
 * @param stale            true when served from a fallback after a store failure
 * @param source           where the rows came from
 * @param computedAtMillis the "now" the scores were computed against
 */
public record RankingView(String partition,
                          List<RankedResult> top,
                          boolean stale,
                          Source source,
                          long computedAtMillis) {

    public enum Source {
        /** Result cache hit. */
        CACHE,
        /** Computed from the state store for this request. */
        LIVE,
        /** Last ranking held in memory, served because the store is unreachable. */
        FALLBACK
    }

    public RankingView {
        top = List.copyOf(top);
    }
}
