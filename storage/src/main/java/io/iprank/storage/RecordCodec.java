// file: storage/src/main/java/io/iprank/storage/RecordCodec.java
package io.iprank.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x1A7E   (helps detect garbage)
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - key:   int32 len + UTF-8 bytes
 *     - value: int32 len + bytes
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x1A7E;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    /** Immutable view of a decoded record. */
    record LogRecord(String key, byte[] value) {}

    private RecordCodec() {
    }

    /** Encode a put into header+payload bytes ready for append. */
    static byte[] encode(String key, byte[] value) {
        byte[] payload = encodePayload(key, value);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        String key = new String(readBytes(b), StandardCharsets.UTF_8);
        byte[] value = readBytes(b);
        return new LogRecord(key, value);
    }

    private static byte[] encodePayload(String key, byte[] value) {
        byte[] sKey = key.getBytes(StandardCharsets.UTF_8);
        ByteBuffer b = ByteBuffer.allocate(4 + sKey.length + 4 + value.length).order(ByteOrder.LITTLE_ENDIAN);
        b.putInt(sKey.length).put(sKey);
        b.putInt(value.length).put(value);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // compared as raw bits, sign is irrelevant
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalStateException("corrupt record: length " + len);
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
