// file: server/src/main/java/io/iprank/server/Main.java
package io.iprank.server;

import io.iprank.core.AggregationSettings;
import io.iprank.server.partition.PartitionRouter;
import io.iprank.server.refresh.ScheduledRefresher;
import io.iprank.storage.DurableKeyValueStore;
import io.iprank.storage.FileSnapshotter;
import io.iprank.storage.FileWal;
import io.iprank.storage.InMemoryKeyValueStore;
import io.iprank.storage.KeyValueStore;
import io.iprank.storage.KvEndpointStatStore;
import io.iprank.storage.TtlResultCache;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a ranking server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire the state store (durable WAL + snapshots, or in-memory).
 *  - Build the partition router, result cache and aggregation service.
 *  - Start the HTTP server and the scheduled refresh of hot partitions.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        AggregationSettings settings = cfg.tuningPath() != null
                ? TuningConfig.fromJsonFile(Path.of(cfg.tuningPath()))
                : AggregationSettings.defaults();

        // ------ Storage layer ------
        KeyValueStore kv;
        DurableKeyValueStore durable = null;
        if (cfg.dataDir() != null && !cfg.dataDir().isBlank()) {
            Path dataDir = Path.of(cfg.dataDir());
            var wal = new FileWal(dataDir.resolve("wal"), 64L * 1024 * 1024); // rotate ~64MB
            var snaps = new FileSnapshotter(dataDir.resolve("snap"));
            durable = new DurableKeyValueStore(wal, snaps);
            kv = durable;
        } else {
            kv = new InMemoryKeyValueStore();
        }
        var statStore = new KvEndpointStatStore(kv);

        // ------ Partitions + cache ------
        var router = new PartitionRouter(statStore, settings, cfg.workerThreads());
        var cache = new TtlResultCache();
        var service = new AggregationService(
                router,
                cache,
                AggregationService.DEFAULT_INGEST_TIMEOUT,
                Duration.ofSeconds(cfg.cacheTtlSeconds()),
                Clock.systemUTC()
        );

        // ------ Scheduled refresh ------
        long intervalSeconds = cfg.refreshIntervalSeconds();
        var refresher = new ScheduledRefresher(
                service,
                cfg.hotPartitions(),
                Duration.ofSeconds(intervalSeconds > 0 ? intervalSeconds : ScheduledRefresher.DEFAULT_PERIOD.toSeconds()),
                Duration.ofSeconds(cfg.refreshTtlSeconds())
        );

        // ------ HTTP layer ------
        CandidatePool candidates = cfg.candidatesPath() != null
                ? CandidatePool.fromJsonFile(Path.of(cfg.candidatesPath()))
                : CandidatePool.builtIn();
        var web = new WebServer(
                cfg.httpPort(),
                service,
                refresher,
                candidates,
                cfg.partitionHeader(),
                cfg.downloadDefaultBytes()
        );

        web.start();
        if (intervalSeconds > 0) {
            refresher.start();
        }
        System.out.printf(
                "iprank listening on http://%s:%d (partition header %s, %s state, %d candidates)%n",
                "localhost", cfg.httpPort(),
                cfg.partitionHeader(),
                durable != null ? "durable" : "in-memory",
                candidates.candidates().size()
        );

        // Shutdown hook
        final DurableKeyValueStore toClose = durable;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            refresher.stop();
            web.stop();
            router.close();
            if (toClose != null) {
                try {
                    toClose.close();
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "failed to close state store cleanly", e);
                }
            }
        }));
    }
}
