package io.iprank.storage;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Volatile store for tests and single-process deployments without a data dir.
 * Values are copied on the way in and out.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentSkipListMap<String, byte[]> mem = new ConcurrentSkipListMap<>();

    @Override
    public byte[] get(String key) {
        byte[] v = mem.get(Objects.requireNonNull(key, "key"));
        return v == null ? null : Arrays.copyOf(v, v.length);
    }

    @Override
    public void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        mem.put(key, Arrays.copyOf(value, value.length));
    }

    @Override
    public Iterable<Entry> listByPrefix(String prefix) {
        return prefixView(mem, prefix);
    }

    /**
     * Lazy prefix iteration over a sorted concurrent map. Shared with
     * {@link DurableKeyValueStore}, whose in-memory image is the same shape.
     */
    static Iterable<Entry> prefixView(ConcurrentSkipListMap<String, byte[]> map, String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        NavigableMap<String, byte[]> tail = map.tailMap(prefix, true);
        return () -> new Iterator<>() {
            private final Iterator<Map.Entry<String, byte[]>> it = tail.entrySet().iterator();
            private Entry next = advance();

            private Entry advance() {
                if (!it.hasNext()) {
                    return null;
                }
                Map.Entry<String, byte[]> e = it.next();
                if (!e.getKey().startsWith(prefix)) {
                    return null;
                }
                byte[] v = e.getValue();
                return new Entry(e.getKey(), Arrays.copyOf(v, v.length));
            }

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public Entry next() {
                if (next == null) {
                    throw new java.util.NoSuchElementException();
                }
                Entry current = next;
                next = advance();
                return current;
            }
        };
    }
}
