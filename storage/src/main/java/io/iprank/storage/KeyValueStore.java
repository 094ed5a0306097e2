// file: storage/src/main/java/io/iprank/storage/KeyValueStore.java
package io.iprank.storage;

import java.util.Arrays;

/**
 * Minimal synchronous KV interface used by the aggregation layer.
 * <p>
 * Semantics:
 *  - put() replaces the whole value for a key; once it returns, get() and
 *    listByPrefix() observe the new value.
 *  - get() returns the latest value for the key, or null if absent.
 *  - listByPrefix() is a lazy, key-ordered sequence over all keys starting
 *    with the prefix. It is weakly consistent: concurrent puts may or may not
 *    be observed, but each returned entry is a complete value.
 *  - Backends that cannot be reached throw {@link StoreUnavailableException}.
 */
public interface KeyValueStore {

    byte[] get(String key);

    void put(String key, byte[] value);

    Iterable<Entry> listByPrefix(String prefix);

    /** One (key, value) pair returned from a prefix listing. */
    record Entry(String key, byte[] value) {
        @Override
        public boolean equals(Object o) {
            return o instanceof Entry e && key.equals(e.key) && Arrays.equals(value, e.value);
        }

        @Override
        public int hashCode() {
            return 31 * key.hashCode() + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Entry{" + key + ", " + (value == null ? 0 : value.length) + " bytes}";
        }
    }
}
