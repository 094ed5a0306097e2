package io.iprank.server.partition;

import io.iprank.core.EndpointStat;
import io.iprank.core.EwmaTracker;
import io.iprank.core.RankedResult;
import io.iprank.core.RankingEngine;
import io.iprank.core.ThroughputSample;
import io.iprank.storage.StoreUnavailableException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Single-writer actor for one partition.
 * <p>
 * Design:
 *  - A FIFO mailbox of tasks plus a "scheduled" flag.
 *  - Submitting a task enqueues it and, if the actor is idle, schedules one
 *    drain pass on the shared worker pool.
 *  - A drain pass runs up to {@code BATCH} tasks back to back, then yields
 *    the worker so busy partitions cannot starve quiet ones.
 * <p>
 * At most one drain pass per actor is in flight, so every store
 * read-modify-write for this partition happens on one thread at a time.
 * Different partitions share only the worker pool.
 */
public final class PartitionActor implements PartitionHandle {

    private static final int BATCH = 64;

    private final String partitionKey;
    private final EwmaTracker tracker;
    private final RankingEngine engine;
    private final Executor workers;

    private final Queue<Task<?>> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    private volatile ComputedRanking lastComputed;

    public PartitionActor(String partitionKey, EwmaTracker tracker, RankingEngine engine, Executor workers) {
        this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    @Override
    public String partitionKey() {
        return partitionKey;
    }

    @Override
    public CompletableFuture<EndpointStat> ingest(ThroughputSample sample) {
        Objects.requireNonNull(sample, "sample");
        return submit(() -> tracker.update(
                partitionKey,
                sample.endpoint(),
                sample.throughputMbps(),
                sample.observedAtMillis()
        ));
    }

    @Override
    public CompletableFuture<List<RankedResult>> computeTop(long nowMillis, int limit) {
        return submit(() -> {
            List<RankedResult> top = engine.computeTop(partitionKey, nowMillis, limit);
            lastComputed = new ComputedRanking(top, nowMillis, limit);
            return top;
        });
    }

    @Override
    public Optional<ComputedRanking> lastComputed() {
        return Optional.ofNullable(lastComputed);
    }

    /** Tasks waiting or running; for diagnostics. */
    public int pending() {
        return mailbox.size();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> body) {
        Task<T> task = new Task<>(partitionKey, body);
        mailbox.add(task);
        schedule();
        return task;
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            workers.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            for (Task<?> t; (t = mailbox.poll()) != null; ) {
                t.completeExceptionally(new IllegalStateException("partition workers are shut down", e));
            }
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < BATCH; i++) {
                Task<?> t = mailbox.poll();
                if (t == null) {
                    break;
                }
                t.run();
            }
        } finally {
            scheduled.set(false);
            // A producer may have enqueued after our last poll but before the flag was cleared.
            if (!mailbox.isEmpty()) {
                schedule();
            }
        }
    }

    /**
     * Future that runs its body at most once and can only be cancelled
     * before the body has started.
     */
    static final class Task<T> extends CompletableFuture<T> {
        private final String partition;
        private final Supplier<T> body;
        private final AtomicBoolean claimed = new AtomicBoolean(false);

        Task(String partition, Supplier<T> body) {
            this.partition = partition;
            this.body = body;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            return claimed.compareAndSet(false, true) && super.cancel(mayInterruptIfRunning);
        }

        void run() {
            if (!claimed.compareAndSet(false, true)) {
                return; // cancelled while queued
            }
            try {
                complete(body.get());
            } catch (StoreUnavailableException e) {
                completeExceptionally(new PartitionUnavailableException(partition, e));
            } catch (RuntimeException | Error e) {
                completeExceptionally(e);
            }
        }
    }
}
