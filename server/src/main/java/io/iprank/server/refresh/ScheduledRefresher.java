// file: server/src/main/java/io/iprank/server/refresh/ScheduledRefresher.java
package io.iprank.server.refresh;

import io.iprank.server.AggregationService;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic cache warmer for hot partitions.
 * <p>
 * Responsibilities:
 *  - On a fixed interval, recompute the default-size ranking of every
 *    configured partition and write it to the result cache.
 *  - Keep going when one partition fails: the failure is logged and
 *    recorded in the {@link RefreshReport}, the rest still refresh.
 * <p>
 * The refresh TTL should exceed the period so a hot partition's cache entry
 * never expires between two passes.
 */
public final class ScheduledRefresher {
    private static final Logger log = Logger.getLogger(ScheduledRefresher.class.getName());

    public static final List<String> DEFAULT_HOT_PARTITIONS = List.of("4134", "4837", "9808", "4538", "unknown");
    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(120);

    private final AggregationService service;
    private final List<String> partitions;
    private final Duration period;
    private final Duration ttl;

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ranking-refresher");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean started = false;

    /**
     * @param service    service whose refresh() writes the cache
     * @param partitions hot partitions, refreshed in this order
     * @param period     time between passes
     * @param ttl        TTL for the entries each pass writes
     */
    public ScheduledRefresher(AggregationService service, List<String> partitions, Duration period, Duration ttl) {
        this.service = Objects.requireNonNull(service, "service");
        this.partitions = List.copyOf(partitions);
        this.period = Objects.requireNonNull(period, "period");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
    }

    public void start() {
        if (started) {
            return;
        }
        started = true;
        exec.scheduleAtFixedRate(this::tick, period.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        exec.shutdownNow();
    }

    /** Refresh every configured partition once, on the calling thread. */
    public RefreshReport refreshOnce() {
        List<String> refreshed = new ArrayList<>(partitions.size());
        Map<String, String> failures = new LinkedHashMap<>();
        for (String partition : partitions) {
            try {
                int rows = service.refresh(partition, ttl);
                refreshed.add(partition);
                log.fine(() -> "refreshed partition " + partition + " (" + rows + " rows)");
            } catch (RuntimeException e) {
                failures.put(partition, String.valueOf(e.getMessage()));
                log.log(Level.WARNING, "ScheduledRefreshPartialFailure partition=" + partition, e);
            }
        }
        if (!failures.isEmpty()) {
            log.warning(String.format("Refresh pass finished: %d refreshed, %d failed %s",
                    refreshed.size(), failures.size(), failures.keySet()));
        }
        return new RefreshReport(refreshed, failures);
    }

    public List<String> partitions() {
        return partitions;
    }

    private void tick() {
        try {
            refreshOnce();
        } catch (RuntimeException e) {
            // A thrown exception would cancel the fixed-rate schedule.
            log.log(Level.SEVERE, "refresh tick failed", e);
        }
    }
}
