// file: storage/src/main/java/io/iprank/storage/Wal.java
package io.iprank.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - I/O failures surface as {@link StoreUnavailableException}.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /** Rotate log segment if configured thresholds are hit. Called after each write. */
    void rotateIfNeeded();

    /**
     * Drop every segment and start a fresh one. Called right after a snapshot
     * that already contains everything the log holds.
     */
    void truncate();

    /**
     * Open a sequential reader over all segments, oldest first.
     * The reader stops at the first corrupt header, truncated payload or EOF
     * of the newest segment.
     */
    WalReader openReader();

    /** Reader abstraction used during recovery. */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null at the end
         *         of the log or at a torn tail.
         */
        byte[] next();

        @Override
        void close();
    }

    @Override
    void close();
}
