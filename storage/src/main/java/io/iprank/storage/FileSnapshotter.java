// file: storage/src/main/java/io/iprank/storage/FileSnapshotter.java
package io.iprank.storage;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32 count
 *   repeated 'count' times:
 *     - key:   int32 len + UTF-8 bytes
 *     - value: int32 len + bytes
 * <p>
 * Atomicity:
 *   - Snapshots are numbered with a zero-padded sequence so name order is age order.
 *   - We write to "snapshot-<seq>.bin.tmp" first,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE.
 *   - Older snapshots are deleted once the new one is in place.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot create snapshot dir " + dir, e);
        }
    }

    @Override
    public String writeSnapshot(Map<String, byte[]> current) {
        List<Path> existing = list();
        long seq = existing.isEmpty() ? 1L : sequenceOf(existing.get(existing.size() - 1)) + 1L;
        String name = String.format("%s%019d%s", PREFIX, seq, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            out.writeInt(current.size());
            for (Map.Entry<String, byte[]> e : current.entrySet()) {
                writeBytes(out, e.getKey().getBytes(StandardCharsets.UTF_8));
                writeBytes(out, e.getValue());
            }
        } catch (IOException ex) {
            throw new StoreUnavailableException("snapshot write failed", ex);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path old : existing) {
                if (old.getFileName().toString().compareTo(name) < 0) {
                    Files.deleteIfExists(old);
                }
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("snapshot publish failed", e);
        }
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = list();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            int count = in.readInt();
            Map<String, byte[]> map = new HashMap<>(Math.max(16, count * 2));
            for (int i = 0; i < count; i++) {
                String key = new String(readBytes(in), StandardCharsets.UTF_8);
                map.put(key, readBytes(in));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), map);
        } catch (IOException e) {
            throw new StoreUnavailableException("snapshot load failed: " + snap, e);
        }
    }

    private List<Path> list() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot list snapshots in " + dir, e);
        }
    }

    private static long sequenceOf(Path p) {
        String n = p.getFileName().toString();
        return Long.parseLong(n.substring(PREFIX.length(), n.length() - SUFFIX.length()));
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) throw new IOException("negative length in snapshot");
        return in.readNBytes(len);
    }
}
