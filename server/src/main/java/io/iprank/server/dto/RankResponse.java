package io.iprank.server.dto;

import java.util.List;

/**
 * Response for GET /api/rank.
 * Example:
 *   {
 *     "partition": "4134",
 *     "top": [{"endpoint": "104.16.0.0", "score": 41.2, "ewma": 44.0, "lastObservedAt": 1700000000000}],
 *     "stale": false,
 *     "source": "cache",
 *     "computedAt": 1700000000000
 *   }
 */
public class RankResponse {
    public String partition;
    public List<Entry> top;
    public boolean stale;
    public String source;    // cache | live | fallback
    public long computedAt;

    public static class Entry {
        public String endpoint;
        public double score;
        public double ewma;
        public long lastObservedAt;
    }
}
