// file: storage/src/main/java/io/iprank/storage/TtlResultCache.java
package io.iprank.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process TTL cache.
 * <p>
 * Semantics:
 *  - get(key) returns the value if it was stored less than its TTL ago.
 *  - putWithTtl(key, value, ttl) replaces any previous entry.
 * <p>
 * Implementation notes:
 *  - Backed by a ConcurrentHashMap<key, Slot(value, expireAtMillis)>.
 *  - Lazy cleanup: expired entries are removed on access, and every
 *    SWEEP_EVERY writes one full pass drops all expired entries. No background thread.
 */
public final class TtlResultCache implements ResultCache {

    private record Slot(byte[] value, long expireAtMillis) {}

    static final int SWEEP_EVERY = 64;

    private final Map<String, Slot> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicLong writes = new AtomicLong();

    public TtlResultCache() {
        this(Clock.systemUTC());
    }

    public TtlResultCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<byte[]> get(String key) {
        Objects.requireNonNull(key, "key");
        Slot slot = entries.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        if (slot.expireAtMillis() <= clock.millis()) {
            entries.remove(key, slot);
            return Optional.empty();
        }
        return Optional.of(Arrays.copyOf(slot.value(), slot.value().length));
    }

    @Override
    public void putWithTtl(String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        long now = clock.millis();
        entries.put(key, new Slot(Arrays.copyOf(value, value.length), now + ttl.toMillis()));
        maybeCleanup(now);
    }

    public int size() {
        return entries.size();
    }

    private void maybeCleanup(long now) {
        if (writes.incrementAndGet() % SWEEP_EVERY != 0) {
            return;
        }
        entries.values().removeIf(slot -> slot.expireAtMillis() <= now);
    }
}
