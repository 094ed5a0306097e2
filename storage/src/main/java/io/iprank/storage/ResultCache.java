package io.iprank.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-to-live cache for computed rankings, keyed by partition.
 * <p>
 * The cache is an eventually-stale read-through layer: entries may lag live
 * state by up to their TTL. Nothing may depend on it for correctness; with
 * {@link #disabled()} every read misses and the caller recomputes.
 * <p>
 * A miss is normal control flow, not an error.
 */
public interface ResultCache {

    Optional<byte[]> get(String key);

    void putWithTtl(String key, byte[] value, Duration ttl);

    /** Cache that never stores anything. */
    static ResultCache disabled() {
        return new ResultCache() {
            @Override
            public Optional<byte[]> get(String key) {
                return Optional.empty();
            }

            @Override
            public void putWithTtl(String key, byte[] value, Duration ttl) {
                // intentionally empty: nothing is cached
            }
        };
    }
}
