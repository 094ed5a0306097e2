package io.iprank.storage;

import io.iprank.core.AggregationSettings;
import io.iprank.core.EndpointStat;
import io.iprank.core.EwmaTracker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DurableKeyValueStoreTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private DurableKeyValueStore open(int snapshotEvery) {
        return new DurableKeyValueStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(snapshotEvery));
    }

    @Test
    void latest_value_survives_restart() {
        var store1 = open(1_000);
        store1.put("k", "v1".getBytes());
        store1.put("k", "v2".getBytes());
        store1.close();

        // "Crash": drop reference; new instance recovers from disk
        var store2 = open(1_000);
        assertArrayEquals("v2".getBytes(), store2.get("k"));
    }

    @Test
    void snapshot_truncates_wal_and_recovery_combines_both() throws Exception {
        var store1 = open(3);
        store1.put("a", "1".getBytes());
        store1.put("b", "2".getBytes());
        store1.put("c", "3".getBytes()); // snapshot here
        store1.put("a", "4".getBytes()); // WAL only
        store1.close();

        try (Stream<Path> snaps = Files.list(snapDir)) {
            assertEquals(1, snaps.count());
        }

        var store2 = open(3);
        assertEquals(3, store2.size());
        assertArrayEquals("4".getBytes(), store2.get("a"));
        assertArrayEquals("2".getBytes(), store2.get("b"));
        assertArrayEquals("3".getBytes(), store2.get("c"));
    }

    @Test
    void list_by_prefix_is_ordered_and_bounded() {
        var store = open(1_000);
        store.put("p:a", "1".getBytes());
        store.put("p:c", "3".getBytes());
        store.put("p:b", "2".getBytes());
        store.put("q:a", "x".getBytes());
        store.put("o:z", "y".getBytes());

        List<String> keys = new ArrayList<>();
        for (KeyValueStore.Entry e : store.listByPrefix("p:")) {
            keys.add(e.key());
        }
        assertEquals(List.of("p:a", "p:b", "p:c"), keys);
    }

    @Test
    void failed_snapshot_does_not_fail_a_committed_write() {
        Snapshotter broken = new Snapshotter() {
            @Override
            public String writeSnapshot(Map<String, byte[]> current) {
                throw new StoreUnavailableException("disk full");
            }

            @Override
            public LoadedSnapshot loadLatest() {
                return null;
            }
        };
        var store1 = new DurableKeyValueStore(new FileWal(walDir, 1L << 60), broken, new SnapshotPolicy(1));

        assertDoesNotThrow(() -> store1.put("k", "v1".getBytes()));
        assertArrayEquals("v1".getBytes(), store1.get("k"));
        store1.close();

        // The record stayed in the WAL, so recovery still sees it.
        var store2 = open(1_000);
        assertArrayEquals("v1".getBytes(), store2.get("k"));
    }

    @Test
    void sample_folded_before_a_snapshot_failure_is_reported_once() {
        Snapshotter broken = new Snapshotter() {
            @Override
            public String writeSnapshot(Map<String, byte[]> current) {
                throw new StoreUnavailableException("disk full");
            }

            @Override
            public LoadedSnapshot loadLatest() {
                return null;
            }
        };
        var kv = new DurableKeyValueStore(new FileWal(walDir, 1L << 60), broken, new SnapshotPolicy(1));
        var stats = new KvEndpointStatStore(kv);
        var tracker = new EwmaTracker(stats, AggregationSettings.defaults());

        EndpointStat written = tracker.update("AS1", "1.1.1.1", 40.0, 1L);

        assertEquals(1, written.sampleCount());
        assertEquals(written, stats.load("AS1", "1.1.1.1").orElseThrow());
    }

    @Test
    void returned_values_are_copies() {
        var store = open(1_000);
        byte[] v = "abc".getBytes();
        store.put("k", v);
        v[0] = 'z';
        byte[] got = store.get("k");
        got[1] = 'z';
        assertArrayEquals("abc".getBytes(), store.get("k"));
    }
}
