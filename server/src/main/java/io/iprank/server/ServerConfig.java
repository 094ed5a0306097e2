// file: server/src/main/java/io/iprank/server/ServerConfig.java
package io.iprank.server;

import io.iprank.server.refresh.ScheduledRefresher;

import java.util.ArrayList;
import java.util.List;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:               external HTTP API port
 *  - dataDir:                directory for WAL segments and snapshots; null keeps state in memory
 *  - cacheTtlSeconds:        TTL of rankings cached on the read path
 *  - refreshTtlSeconds:      TTL of rankings written by the scheduled refresh
 *  - refreshIntervalSeconds: period of the scheduled refresh; 0 disables it
 *  - hotPartitions:          partitions the scheduled refresh keeps warm
 *  - candidatesPath:         optional JSON candidate pool, {"candidates": [...]}
 *  - partitionHeader:        request header carrying the partition key
 *  - downloadDefaultBytes:   payload size of /dl when no bytes= is given
 *  - tuningPath:             optional JSON file overriding aggregation settings
 *  - workerThreads:          size of the shared partition worker pool
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        long cacheTtlSeconds,
        long refreshTtlSeconds,
        long refreshIntervalSeconds,
        List<String> hotPartitions,
        String candidatesPath,
        String partitionHeader,
        long downloadDefaultBytes,
        String tuningPath,
        int workerThreads
) {

    public static final String DEFAULT_PARTITION_HEADER = "X-Network-Origin";
    public static final long DEFAULT_DOWNLOAD_BYTES = 5_000_000L;

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("http-port out of range: " + httpPort);
        }
        if (cacheTtlSeconds <= 0 || refreshTtlSeconds <= 0) {
            throw new IllegalArgumentException("cache TTLs must be > 0");
        }
        if (refreshIntervalSeconds < 0) {
            throw new IllegalArgumentException("refresh-interval-seconds must be >= 0");
        }
        if (partitionHeader == null || partitionHeader.isBlank()) {
            throw new IllegalArgumentException("partition-header must not be empty");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("worker-threads must be >= 1");
        }
        hotPartitions = List.copyOf(hotPartitions);
    }

    public static ServerConfig defaults() {
        return new ServerConfig(
                8080,
                null,
                90,
                ScheduledRefresher.DEFAULT_TTL.toSeconds(),
                ScheduledRefresher.DEFAULT_PERIOD.toSeconds(),
                ScheduledRefresher.DEFAULT_HOT_PARTITIONS,
                null,
                DEFAULT_PARTITION_HEADER,
                DEFAULT_DOWNLOAD_BYTES,
                null,
                Math.max(2, Runtime.getRuntime().availableProcessors())
        );
    }

    /**
     * CLI entry: parse, or print the problem plus usage and exit.
     */
    public static ServerConfig fromArgs(String[] args) {
        try {
            return parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(usage());
            System.exit(1);
            return null; // unreachable
        }
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p               <port>
     *   --data-dir, -d                <path>
     *   --cache-ttl-seconds           <seconds>
     *   --refresh-ttl-seconds         <seconds>
     *   --refresh-interval-seconds    <seconds>
     *   --hot-partitions              <p1,p2,...>
     *   --candidates                  <path>
     *   --partition-header            <name>
     *   --download-default-bytes      <bytes>
     *   --tuning                      <path>
     *   --worker-threads              <n>
     *   --help, -h
     *
     * @throws IllegalArgumentException on unknown flags, missing values or bad numbers
     */
    public static ServerConfig parse(String[] args) {
        ServerConfig d = defaults();
        int httpPort = d.httpPort();
        String dataDir = d.dataDir();
        long cacheTtl = d.cacheTtlSeconds();
        long refreshTtl = d.refreshTtlSeconds();
        long refreshInterval = d.refreshIntervalSeconds();
        List<String> hot = d.hotPartitions();
        String candidates = d.candidatesPath();
        String header = d.partitionHeader();
        long dlBytes = d.downloadDefaultBytes();
        String tuning = d.tuningPath();
        int workers = d.workerThreads();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();
                case "--http-port", "-p" -> httpPort = (int) parseLong(args, ++i);
                case "--data-dir", "-d" -> dataDir = value(args, ++i);
                case "--cache-ttl-seconds" -> cacheTtl = parseLong(args, ++i);
                case "--refresh-ttl-seconds" -> refreshTtl = parseLong(args, ++i);
                case "--refresh-interval-seconds" -> refreshInterval = parseLong(args, ++i);
                case "--hot-partitions" -> hot = splitList(value(args, ++i));
                case "--candidates" -> candidates = value(args, ++i);
                case "--partition-header" -> header = value(args, ++i);
                case "--download-default-bytes" -> dlBytes = parseLong(args, ++i);
                case "--tuning" -> tuning = value(args, ++i);
                case "--worker-threads" -> workers = (int) parseLong(args, ++i);
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ServerConfig(httpPort, dataDir, cacheTtl, refreshTtl, refreshInterval,
                hot, candidates, header, dlBytes, tuning, workers);
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i - 1]);
        }
        return args[i];
    }

    private static long parseLong(String[] args, int i) {
        String raw = value(args, i);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + args[i - 1] + ": " + raw, e);
        }
    }

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    static String usage() {
        return """
            Usage: server [options]

            Options:
              --http-port, -p              HTTP port (default: 8080)
              --data-dir, -d               WAL + snapshot directory (default: in-memory)
              --cache-ttl-seconds          TTL of read-path cached rankings (default: 90)
              --refresh-ttl-seconds        TTL of refreshed rankings (default: 120)
              --refresh-interval-seconds   Refresh period, 0 disables (default: 60)
              --hot-partitions             Comma-separated partitions to refresh (default: 4134,4837,9808,4538,unknown)
              --candidates                 JSON candidate pool file (default: built-in list)
              --partition-header           Header carrying the partition key (default: X-Network-Origin)
              --download-default-bytes     Default /dl payload size (default: 5000000)
              --tuning                     JSON file overriding aggregation settings (optional)
              --worker-threads             Partition worker pool size (default: #cpus, min 2)
              --help, -h                   Show this help message
            """;
    }

    private static void printHelpAndExit() {
        System.out.println(usage());
        System.exit(0);
    }
}
