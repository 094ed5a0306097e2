// file: storage/src/main/java/io/iprank/storage/DurableKeyValueStore.java
package io.iprank.storage;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable key-value store: sorted in-memory image, WAL for every write,
 * periodic full snapshots.
 * <p>
 * Responsibilities:
 *  - On write:
 *      1) Serialize key+value to a WAL record.
 *      2) Append+fsync to WAL. Only then is the write visible in memory.
 *      3) Rotate WAL segment if needed.
 *      4) Every N writes, write a snapshot and truncate the WAL.
 *      Failures in 3) and 4) are logged; the write already committed in 2).
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records in order. Replay is idempotent because every
 *         record is a full overwrite of its key.
 * <p>
 * Writes are serialized by the instance monitor; reads go straight to the
 * concurrent map and never block behind a write.
 */
public class DurableKeyValueStore implements KeyValueStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableKeyValueStore.class.getName());

    private final ConcurrentSkipListMap<String, byte[]> mem = new ConcurrentSkipListMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    public DurableKeyValueStore(Wal wal, Snapshotter snaps) {
        this(wal, snaps, new SnapshotPolicy(50_000));
    }

    public DurableKeyValueStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    @Override
    public byte[] get(String key) {
        byte[] v = mem.get(Objects.requireNonNull(key, "key"));
        return v == null ? null : Arrays.copyOf(v, v.length);
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        byte[] copy = Arrays.copyOf(value, value.length);

        // If the process crashes after append returns, recovery will see this record.
        wal.append(RecordCodec.encode(key, copy));
        mem.put(key, copy);

        // The write is committed. Maintenance failures below must not report it as failed.
        try {
            wal.rotateIfNeeded();
            if (snapPolicy.recordWrite()) {
                String id = snaps.writeSnapshot(mem);
                wal.truncate();
                log.fine(() -> "snapshot " + id + " written with " + mem.size() + " keys");
            }
        } catch (StoreUnavailableException e) {
            log.log(Level.WARNING, "WAL rotation or snapshot failed after commit of key " + key
                    + "; the WAL still holds the record", e);
        }
    }

    @Override
    public Iterable<Entry> listByPrefix(String prefix) {
        return InMemoryKeyValueStore.prefixView(mem, prefix);
    }

    public int size() {
        return mem.size();
    }

    @Override
    public synchronized void close() {
        wal.close();
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            mem.putAll(loaded.data());
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                mem.put(rec.key(), rec.value());
                replayed++;
            }
        }
        log.info(String.format("recovered %d keys (snapshot=%s, walRecords=%d)",
                mem.size(), loaded == null ? "none" : loaded.id(), replayed));
    }
}
