package io.iprank.client;

import java.net.URI;
import java.time.Duration;

/**
 * Settings for one collection run.
 *
 * @param baseUrl             ranking server, e.g. http://localhost:8080
 * @param downloadUrlTemplate per-candidate download URL with {endpoint} and {bytes} placeholders
 * @param bytes               payload size to request from each candidate
 * @param concurrency         max downloads in flight
 * @param timeout             per-download deadline, headers and body included
 * @param partition           partition key to report under; null lets the server decide
 * @param partitionHeader     header that carries the partition key
 */
public record CollectorOptions(
        URI baseUrl,
        String downloadUrlTemplate,
        long bytes,
        int concurrency,
        Duration timeout,
        String partition,
        String partitionHeader
) {
    public static final String DEFAULT_TEMPLATE = "http://{endpoint}:8080/dl?bytes={bytes}";
    public static final long DEFAULT_BYTES = 5_000_000L;
    public static final int DEFAULT_CONCURRENCY = 20;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    public static final String DEFAULT_PARTITION_HEADER = "X-Network-Origin";

    public CollectorOptions {
        if (bytes < 1) {
            throw new IllegalArgumentException("bytes must be >= 1");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (!downloadUrlTemplate.contains("{endpoint}")) {
            throw new IllegalArgumentException("download URL template needs an {endpoint} placeholder");
        }
    }

    public static CollectorOptions defaults(URI baseUrl) {
        return new CollectorOptions(baseUrl, DEFAULT_TEMPLATE, DEFAULT_BYTES, DEFAULT_CONCURRENCY,
                DEFAULT_TIMEOUT, null, DEFAULT_PARTITION_HEADER);
    }

    /**
     * Parse collector flags on top of the defaults.
     *
     *   --download-url-template <template>
     *   --bytes                 <n>
     *   --concurrency           <n>
     *   --timeout-seconds       <n>
     *   --partition             <key>
     *   --partition-header      <name>
     *
     * @throws IllegalArgumentException on unknown flags, missing values or bad numbers
     */
    public static CollectorOptions parse(URI baseUrl, String[] args) {
        CollectorOptions d = defaults(baseUrl);
        String template = d.downloadUrlTemplate();
        long bytes = d.bytes();
        int concurrency = d.concurrency();
        Duration timeout = d.timeout();
        String partition = d.partition();
        String header = d.partitionHeader();

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for option: " + flag);
            }
            String v = args[++i];
            switch (flag) {
                case "--download-url-template" -> template = v;
                case "--bytes" -> bytes = number(flag, v);
                case "--concurrency" -> concurrency = (int) number(flag, v);
                case "--timeout-seconds" -> timeout = Duration.ofSeconds(number(flag, v));
                case "--partition" -> partition = v;
                case "--partition-header" -> header = v;
                default -> throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        return new CollectorOptions(baseUrl, template, bytes, concurrency, timeout, partition, header);
    }

    private static long number(String flag, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + raw, e);
        }
    }
}
