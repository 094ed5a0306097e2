// file: storage/src/main/java/io/iprank/storage/SnapshotPolicy.java
package io.iprank.storage;

/**
 * Snapshot policy that asks for a full snapshot after every N writes.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length.
 * Not thread-safe; callers invoke it under the store's write lock.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private int sinceLast;

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each durable write; returns true when a snapshot is due. */
    public boolean recordWrite() {
        if (++sinceLast >= everyOps) {
            sinceLast = 0;
            return true;
        }
        return false;
    }
}
