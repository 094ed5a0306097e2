package io.iprank.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.iprank.core.RankedResult;
import io.iprank.server.partition.PartitionHandle.ComputedRanking;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON encoding of a computed ranking for the result cache.
 * <p>
 * Stored shape:
 *   {"computedAt": 1700000000000, "limit": 100, "top": [{"endpoint": ..., "score": ..., ...}]}
 * <p>
 * The limit lets a reader tell a complete list (fewer rows than the limit)
 * from a truncated one.
 */
final class RankingCacheCodec {

    /** Cache key for a partition's ranking. */
    static String cacheKey(String partition) {
        return "top:" + partition;
    }

    private final ObjectMapper json;

    RankingCacheCodec(ObjectMapper json) {
        this.json = json;
    }

    byte[] encode(ComputedRanking ranking) {
        var dto = new CachedRanking();
        dto.computedAt = ranking.computedAtMillis();
        dto.limit = ranking.limit();
        dto.top = ranking.top();
        try {
            return json.writeValueAsBytes(dto);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to encode cached ranking", e);
        }
    }

    ComputedRanking decode(byte[] bytes) {
        try {
            CachedRanking dto = json.readValue(bytes, CachedRanking.class);
            if (dto.top == null || dto.limit < 1) {
                throw new IllegalArgumentException("cached ranking is incomplete");
            }
            return new ComputedRanking(dto.top, dto.computedAt, dto.limit);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to decode cached ranking", e);
        }
    }

    static final class CachedRanking {
        public long computedAt;
        public int limit;
        public List<RankedResult> top;
    }
}
