// file: server/src/main/java/io/iprank/server/AggregationService.java
package io.iprank.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.iprank.core.AggregationSettings;
import io.iprank.core.EndpointStat;
import io.iprank.core.InvalidSampleException;
import io.iprank.core.RankedResult;
import io.iprank.core.ThroughputSample;
import io.iprank.server.partition.PartitionHandle;
import io.iprank.server.partition.PartitionHandle.ComputedRanking;
import io.iprank.server.partition.PartitionRouter;
import io.iprank.server.partition.PartitionUnavailableException;
import io.iprank.storage.ResultCache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service between the HTTP boundary and the partition actors.
 * <p>
 * Responsibilities:
 *  - Validate raw samples before they reach any actor.
 *  - Route each call to the partition that owns it.
 *  - Bound ingest latency; a sample that misses the deadline is never folded.
 *  - Serve rankings through the result cache, falling back to the last
 *    in-memory ranking (marked stale) when the state store is unreachable.
 * <p>
 * The result cache is strictly optional: read and write failures are logged
 * and the service recomputes from the store.
 */
public final class AggregationService {
    private static final Logger log = Logger.getLogger(AggregationService.class.getName());

    public static final Duration DEFAULT_INGEST_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(90);

    private final PartitionRouter router;
    private final ResultCache cache;
    private final RankingCacheCodec codec;
    private final AggregationSettings settings;
    private final Duration ingestTimeout;
    private final Duration cacheTtl;
    private final Clock clock;

    public AggregationService(PartitionRouter router, ResultCache cache) {
        this(router, cache, DEFAULT_INGEST_TIMEOUT, DEFAULT_CACHE_TTL, Clock.systemUTC());
    }

    public AggregationService(PartitionRouter router,
                              ResultCache cache,
                              Duration ingestTimeout,
                              Duration cacheTtl,
                              Clock clock) {
        this.router = Objects.requireNonNull(router, "router");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.settings = router.settings();
        this.ingestTimeout = Objects.requireNonNull(ingestTimeout, "ingestTimeout");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ingestTimeout.isZero() || ingestTimeout.isNegative()) {
            throw new IllegalArgumentException("ingestTimeout must be > 0");
        }
        if (cacheTtl.isZero() || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must be > 0");
        }
        this.codec = new RankingCacheCodec(new ObjectMapper());
    }

    // ---------- ingest ----------

    /**
     * Validate a sample and fold it into its partition.
     *
     * @throws InvalidSampleException        if the sample is malformed; nothing is stored
     * @throws IngestTimeoutException        if the partition did not start the fold in time
     * @throws PartitionUnavailableException if the state store failed
     */
    public IngestResult ingest(String partitionKey, SampleReport report) {
        if (report == null) {
            throw new InvalidSampleException("sample body is required");
        }
        if (report.bytesTransferred() == null) {
            throw new InvalidSampleException("bytesTransferred is required");
        }
        if (report.durationMs() == null) {
            throw new InvalidSampleException("durationMs is required");
        }
        long observedAt = report.observedAtMillis() != null ? report.observedAtMillis() : clock.millis();
        ThroughputSample sample = ThroughputSample.validated(
                report.endpoint(),
                report.bytesTransferred(),
                report.durationMs(),
                observedAt
        );

        PartitionHandle handle = router.resolve(partitionKey);
        CompletableFuture<EndpointStat> pending = handle.ingest(sample);
        EndpointStat stat = awaitIngest(handle.partitionKey(), pending);
        return new IngestResult(handle.partitionKey(), stat.endpoint(), stat.ewma(), stat.sampleCount());
    }

    private EndpointStat awaitIngest(String partition, CompletableFuture<EndpointStat> pending) {
        try {
            return pending.get(ingestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (pending.cancel(false)) {
                throw new IngestTimeoutException(partition, ingestTimeout);
            }
            // Already started: the fold will be persisted, so report its real outcome.
            return join(pending);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            pending.cancel(false);
            Thread.currentThread().interrupt();
            throw new IngestTimeoutException(partition, ingestTimeout);
        }
    }

    // ---------- rank ----------

    /**
     * Top endpoints for a partition.
     *
     * @param limit requested size; null means the default, larger values are capped
     * @throws IllegalArgumentException     if limit is below 1
     * @throws RankingUnavailableException  if the store is down and nothing was computed before
     */
    public RankingView rank(String partitionKey, Integer limit) {
        int effective = effectiveLimit(limit);
        String partition = PartitionRouter.normalize(partitionKey);

        Optional<ComputedRanking> cached = readCache(partition);
        if (cached.isPresent() && cached.get().covers(effective)) {
            ComputedRanking hit = cached.get();
            return new RankingView(partition, hit.truncate(effective), false,
                    RankingView.Source.CACHE, hit.computedAtMillis());
        }

        PartitionHandle handle = router.resolve(partition);
        int computeLimit = Math.max(effective, settings.defaultLimit());
        long now = clock.millis();
        try {
            List<RankedResult> top = join(handle.computeTop(now, computeLimit));
            ComputedRanking fresh = new ComputedRanking(top, now, computeLimit);
            writeCache(partition, fresh, cacheTtl);
            return new RankingView(partition, fresh.truncate(effective), false, RankingView.Source.LIVE, now);
        } catch (PartitionUnavailableException e) {
            Optional<ComputedRanking> last = handle.lastComputed();
            if (last.isEmpty()) {
                throw new RankingUnavailableException(partition, e);
            }
            log.log(Level.WARNING, "Serving stale ranking for partition " + partition + ": " + e.getMessage());
            ComputedRanking prev = last.get();
            return new RankingView(partition, prev.truncate(effective), true,
                    RankingView.Source.FALLBACK, prev.computedAtMillis());
        }
    }

    /**
     * Recompute a partition's default-size ranking and write it to the cache.
     * Errors propagate: the caller decides whether a failure is fatal.
     *
     * @return number of ranked rows written
     */
    public int refresh(String partitionKey, Duration ttl) {
        PartitionHandle handle = router.resolve(partitionKey);
        long now = clock.millis();
        List<RankedResult> top = join(handle.computeTop(now, settings.defaultLimit()));
        ComputedRanking fresh = new ComputedRanking(top, now, settings.defaultLimit());
        cache.putWithTtl(RankingCacheCodec.cacheKey(handle.partitionKey()), codec.encode(fresh), ttl);
        return top.size();
    }

    public AggregationSettings settings() {
        return settings;
    }

    int effectiveLimit(Integer limit) {
        if (limit == null) {
            return settings.defaultLimit();
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        return Math.min(limit, settings.maxLimit());
    }

    // ---------- cache helpers ----------

    private Optional<ComputedRanking> readCache(String partition) {
        try {
            return cache.get(RankingCacheCodec.cacheKey(partition)).map(codec::decode);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Result cache read failed for partition " + partition + ", recomputing", e);
            return Optional.empty();
        }
    }

    private void writeCache(String partition, ComputedRanking ranking, Duration ttl) {
        try {
            cache.putWithTtl(RankingCacheCodec.cacheKey(partition), codec.encode(ranking), ttl);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Result cache write failed for partition " + partition, e);
        }
    }

    // ---------- future helpers ----------

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new IllegalStateException("partition task cancelled", e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new IllegalStateException(cause);
    }
}
