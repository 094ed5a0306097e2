// file: server/src/main/java/io/iprank/server/partition/PartitionRouter.java
package io.iprank.server.partition;

import io.iprank.core.AggregationSettings;
import io.iprank.core.EndpointStatStore;
import io.iprank.core.EwmaTracker;
import io.iprank.core.RankingEngine;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps a partition key to the single {@link PartitionHandle} that owns it.
 * <p>
 * Responsibilities:
 *  - Normalize keys: null or blank keys share the {@link #UNKNOWN_PARTITION} sentinel.
 *  - Create one {@link PartitionActor} per distinct key, lazily, and reuse it forever.
 *  - Own the worker pool that all actors drain onto.
 * <p>
 * The router does not validate partition keys beyond that: any string is a partition.
 */
public final class PartitionRouter implements AutoCloseable {

    public static final String UNKNOWN_PARTITION = "unknown";

    private final EwmaTracker tracker;
    private final RankingEngine engine;
    private final ExecutorService workers;
    private final ConcurrentMap<String, PartitionActor> actors = new ConcurrentHashMap<>();

    public PartitionRouter(EndpointStatStore store, AggregationSettings settings, int workerThreads) {
        this(store, settings, Executors.newFixedThreadPool(workerThreads, workerThreadFactory()));
    }

    public PartitionRouter(EndpointStatStore store, AggregationSettings settings, ExecutorService workers) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(settings, "settings");
        this.tracker = new EwmaTracker(store, settings);
        this.engine = new RankingEngine(store, settings);
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /** Keys pass through verbatim; only a null or blank key maps to {@link #UNKNOWN_PARTITION}. */
    public static String normalize(String partitionKey) {
        if (partitionKey == null || partitionKey.isBlank()) {
            return UNKNOWN_PARTITION;
        }
        return partitionKey;
    }

    public PartitionHandle resolve(String partitionKey) {
        String key = normalize(partitionKey);
        return actors.computeIfAbsent(key, k -> new PartitionActor(k, tracker, engine, workers));
    }

    /** Partitions that have been touched since startup, sorted. */
    public Set<String> knownPartitions() {
        return new TreeSet<>(actors.keySet());
    }

    public AggregationSettings settings() {
        return tracker.settings();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "partition-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
