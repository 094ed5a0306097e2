// file: storage/src/main/java/io/iprank/storage/FileWal.java
package io.iprank.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction it creates the directory if needed and opens the segment
 *    after the newest one ("00000001.log", "00000002.log", ...), so a torn
 *    tail left by a crash is never followed by new records in the same file.
 *  - append() writes the bytes, calls force(true) and tracks bytes written
 *    in the current segment.
 *  - rotateIfNeeded() opens the next segment once rotateBytes is reached.
 *  - truncate() deletes all segments and restarts numbering after the
 *    newest one, so a concurrent reader never sees a reused file name.
 *  - The reader walks segments in name order. Inside a segment it stops at
 *    the first truncated header/payload or CRC mismatch and moves on to the
 *    next segment.
 */
public class FileWal implements Wal {
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot create WAL dir " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so a freshly rotated file is durable
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new StoreUnavailableException("WAL append failed", e);
        }
    }

    @Override
    public void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openSegment(segmentIndex(current) + 1);
    }

    @Override
    public void truncate() {
        int next = segmentIndex(current) + 1;
        try {
            ch.close();
            for (Path p : segments(dir)) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("WAL truncate failed", e);
        }
        ch = null;
        openSegment(next);
    }

    @Override
    public WalReader openReader() {
        try {
            return new Reader(segments(dir));
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot list WAL segments in " + dir, e);
        }
    }

    @Override
    public void close() {
        if (ch == null) return;
        try {
            ch.close();
        } catch (IOException e) {
            throw new StoreUnavailableException("WAL close failed", e);
        }
    }

    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            // Never append behind a possibly torn tail: a restart always starts a new segment.
            openSegment(segs.isEmpty() ? 1 : segmentIndex(segs.get(segs.size() - 1)) + 1);
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot open WAL in " + dir, e);
        }
    }

    private void openSegment(int index) {
        try {
            if (ch != null) ch.close();
            current = dir.resolve(String.format("%08d%s", index, SUFFIX));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot open WAL segment " + index, e);
        }
    }

    private static int segmentIndex(Path p) {
        return Integer.parseInt(p.getFileName().toString().replace(SUFFIX, ""));
    }

    private static List<Path> segments(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        }
    }

    /** Sequential reader over all WAL segments, oldest first. */
    private static final class Reader implements WalReader {
        private final List<Path> pending;
        private FileChannel ch;
        private long pos = 0;

        Reader(List<Path> segments) {
            this.pending = new ArrayList<>(segments);
        }

        @Override
        public byte[] next() {
            try {
                while (true) {
                    if (ch == null) {
                        if (pending.isEmpty()) return null;
                        ch = FileChannel.open(pending.remove(0), READ);
                        pos = 0;
                    }
                    byte[] payload = readOne();
                    if (payload != null) return payload;
                    // EOF or torn tail of this segment.
                    ch.close();
                    ch = null;
                }
            } catch (IOException e) {
                throw new StoreUnavailableException("WAL read failed", e);
            }
        }

        private byte[] readOne() throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            int read = ch.read(hdr, pos);
            if (read < RecordCodec.HEADER_BYTES) return null; // EOF or truncated header
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
            ByteBuffer payload = ByteBuffer.allocate(len);
            int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
            if (r2 < len) return null; // truncated payload
            byte[] bytes = payload.array();
            if (RecordCodec.crc32(bytes) != crc) return null; // bad tail
            pos += RecordCodec.HEADER_BYTES + (long) len;
            return bytes;
        }

        @Override
        public void close() {
            if (ch == null) return;
            try {
                ch.close();
            } catch (IOException e) {
                throw new StoreUnavailableException("WAL reader close failed", e);
            }
        }
    }
}
