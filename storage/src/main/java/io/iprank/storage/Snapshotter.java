// file: storage/src/main/java/io/iprank/storage/Snapshotter.java
package io.iprank.storage;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store's key space at some point in time.
 * On restart we load the latest snapshot, then replay WAL records written
 * after it.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current map.
     *
     * @return snapshot identifier (file name).
     */
    String writeSnapshot(Map<String, byte[]> current);

    /** Load the latest snapshot, or null when none exists. */
    LoadedSnapshot loadLatest();

    /** Snapshot id and its data. */
    record LoadedSnapshot(String id, Map<String, byte[]> data) {}
}
