package io.iprank.storage;

import io.iprank.core.EndpointStat;
import io.iprank.core.EndpointStatStore;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EndpointStatStore} on top of any {@link KeyValueStore}.
 * <p>
 * Key layout:
 * <pre>
 *   stat:&lt;len(partition)&gt;:&lt;partition&gt;:ip:&lt;endpoint&gt;
 * </pre>
 * The length prefix keeps partition prefixes disjoint ("AS1" never lists
 * records of "AS12"), whatever characters a partition key contains.
 */
public final class KvEndpointStatStore implements EndpointStatStore {

    private final KeyValueStore kv;

    public KvEndpointStatStore(KeyValueStore kv) {
        this.kv = Objects.requireNonNull(kv, "kv");
    }

    static String partitionPrefix(String partition) {
        return "stat:" + partition.length() + ":" + partition + ":ip:";
    }

    static String statKey(String partition, String endpoint) {
        return partitionPrefix(partition) + endpoint;
    }

    @Override
    public Optional<EndpointStat> load(String partition, String endpoint) {
        byte[] raw = kv.get(statKey(partition, endpoint));
        return raw == null ? Optional.empty() : Optional.of(EndpointStatCodec.decode(raw));
    }

    @Override
    public void save(String partition, EndpointStat stat) {
        kv.put(statKey(partition, stat.endpoint()), EndpointStatCodec.encode(stat));
    }

    @Override
    public Iterable<EndpointStat> scan(String partition) {
        Iterable<KeyValueStore.Entry> entries = kv.listByPrefix(partitionPrefix(partition));
        return () -> {
            Iterator<KeyValueStore.Entry> it = entries.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return it.hasNext();
                }

                @Override
                public EndpointStat next() {
                    return EndpointStatCodec.decode(it.next().value());
                }
            };
        };
    }
}
