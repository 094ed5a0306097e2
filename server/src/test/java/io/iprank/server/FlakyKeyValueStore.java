package io.iprank.server;

import io.iprank.storage.InMemoryKeyValueStore;
import io.iprank.storage.KeyValueStore;
import io.iprank.storage.StoreUnavailableException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Test-only store over {@link InMemoryKeyValueStore} that can be told to fail
 * (per key or key prefix) or to park the first reader until released.
 */
public final class FlakyKeyValueStore implements KeyValueStore {
    private final InMemoryKeyValueStore delegate = new InMemoryKeyValueStore();

    private volatile Predicate<String> failing = k -> false;
    private final AtomicBoolean parkNext = new AtomicBoolean(false);
    private final CountDownLatch parked = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    public void failAll() {
        failing = k -> true;
    }

    public void failWhere(Predicate<String> keyOrPrefix) {
        failing = keyOrPrefix;
    }

    public void recover() {
        failing = k -> false;
    }

    /** The next get() (only that one) blocks until {@link #release()}. */
    public void parkNextRead() {
        parkNext.set(true);
    }

    public boolean awaitParked(long millis) throws InterruptedException {
        return parked.await(millis, TimeUnit.MILLISECONDS);
    }

    public void release() {
        parkNext.set(false);
        release.countDown();
    }

    @Override
    public byte[] get(String key) {
        check(key);
        if (parkNext.compareAndSet(true, false)) {
            parked.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreUnavailableException("interrupted while parked", e);
            }
        }
        return delegate.get(key);
    }

    @Override
    public void put(String key, byte[] value) {
        check(key);
        delegate.put(key, value);
    }

    @Override
    public Iterable<Entry> listByPrefix(String prefix) {
        check(prefix);
        return delegate.listByPrefix(prefix);
    }

    private void check(String key) {
        if (failing.test(key)) {
            throw new StoreUnavailableException("simulated outage for " + key);
        }
    }
}
