package io.iprank.server.partition;

import io.iprank.core.AggregationSettings;
import io.iprank.storage.InMemoryKeyValueStore;
import io.iprank.storage.KvEndpointStatStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PartitionRouterSpec {

    private final PartitionRouter router = new PartitionRouter(
            new KvEndpointStatStore(new InMemoryKeyValueStore()),
            AggregationSettings.defaults(),
            2
    );

    @AfterEach
    void close() {
        router.close();
    }

    @Test
    void same_key_always_resolves_to_the_same_handle() {
        PartitionHandle a = router.resolve("4134");
        PartitionHandle b = router.resolve("4134");
        assertSame(a, b);
        assertEquals("4134", a.partitionKey());
    }

    @Test
    void distinct_keys_get_distinct_handles() {
        assertNotSame(router.resolve("AS1"), router.resolve("AS12"));
    }

    @Test
    void null_and_blank_keys_share_the_unknown_partition() {
        PartitionHandle unknown = router.resolve(null);
        assertEquals(PartitionRouter.UNKNOWN_PARTITION, unknown.partitionKey());
        assertSame(unknown, router.resolve(""));
        assertSame(unknown, router.resolve("   "));
        assertSame(unknown, router.resolve("unknown"));
    }

    @Test
    void keys_are_used_verbatim() {
        assertNotSame(router.resolve("4837"), router.resolve(" 4837"));
        assertEquals(" 4837", router.resolve(" 4837").partitionKey());
        assertEquals(" 4837", PartitionRouter.normalize(" 4837"));
    }

    @Test
    void known_partitions_lists_every_resolved_key() {
        router.resolve("b");
        router.resolve("a");
        router.resolve(null);
        assertEquals(Set.of("a", "b", "unknown"), router.knownPartitions());
    }
}
