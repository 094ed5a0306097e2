package io.iprank.storage;

import io.iprank.core.EndpointStat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Binary value format for a stored {@link EndpointStat}.
 * <p>
 * Layout (little-endian):
 *   - version:         1B = 1
 *   - sampleCount:     int64
 *   - ewma:            float64 (NaN when sampleCount == 0)
 *   - lastObservedAt:  int64 epoch millis
 *   - endpoint:        int32 len + UTF-8 bytes
 */
public final class EndpointStatCodec {
    static final byte VERSION = 1;

    private EndpointStatCodec() {
    }

    public static byte[] encode(EndpointStat stat) {
        byte[] ep = stat.endpoint().getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(1 + 8 + 8 + 8 + 4 + ep.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .put(VERSION)
                .putLong(stat.sampleCount())
                .putDouble(stat.ewma())
                .putLong(stat.lastObservedAtMillis())
                .putInt(ep.length)
                .put(ep)
                .array();
    }

    public static EndpointStat decode(byte[] bytes) {
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        byte version = b.get();
        if (version != VERSION) {
            throw new IllegalStateException("unsupported EndpointStat version " + version);
        }
        long n = b.getLong();
        double ewma = b.getDouble();
        long last = b.getLong();
        byte[] ep = new byte[b.getInt()];
        b.get(ep);
        return new EndpointStat(new String(ep, StandardCharsets.UTF_8), ewma, n, last);
    }
}
