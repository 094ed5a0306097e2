// file: client/src/main/java/io/iprank/client/SampleCollector.java
package io.iprank.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Measures download throughput from every candidate endpoint and reports
 * successful measurements to the ranking server.
 * <p>
 * One run:
 *  1. GET /api/candidates.
 *  2. Download {@code bytes} from each candidate, at most {@code concurrency} at a time,
 *     timing request start to last byte with System.nanoTime().
 *  3. POST each usable measurement to /api/report.
 * <p>
 * Failed or timed-out downloads are printed and never reported.
 */
public final class SampleCollector {

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final CollectorOptions options;

    public SampleCollector(HttpClient http, CollectorOptions options) {
        this.http = Objects.requireNonNull(http, "http");
        this.options = Objects.requireNonNull(options, "options");
    }

    /** Summary of one run. */
    public record RunSummary(List<Measurement> measurements, int reported, int reportFailures) {
        public long succeeded() {
            return measurements.stream().filter(Measurement::ok).count();
        }
    }

    public RunSummary runOnce() throws IOException, InterruptedException {
        List<String> candidates = fetchCandidates();
        List<Measurement> results = measureAll(candidates);

        int reported = 0;
        int reportFailures = 0;
        for (Measurement m : results) {
            if (!m.ok()) {
                System.out.printf("%-40s failed (%s)%n", m.endpoint(), m.error() != null ? m.error() : "empty body");
                continue;
            }
            System.out.printf("%-40s %8.2f Mbps%n", m.endpoint(), m.mbps());
            try {
                report(m);
                reported++;
            } catch (IOException | ReportRejectedException e) {
                reportFailures++;
                System.err.println("report failed for " + m.endpoint() + ": " + e.getMessage());
            }
        }
        var summary = new RunSummary(results, reported, reportFailures);
        System.out.printf("measured %d/%d candidates, reported %d%n",
                summary.succeeded(), candidates.size(), reported);
        return summary;
    }

    public List<String> fetchCandidates() throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(resolve("/api/candidates"))
                .timeout(options.timeout())
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new IOException("GET /api/candidates failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode list = json.readTree(resp.body()).path("candidates");
        List<String> out = new ArrayList<>();
        for (JsonNode n : list) {
            if (n.isTextual() && !n.asText().isBlank()) {
                out.add(n.asText().trim());
            }
        }
        return out;
    }

    /** Measure every candidate with bounded concurrency; results keep candidate order. */
    public List<Measurement> measureAll(List<String> candidates) throws InterruptedException {
        if (candidates.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.concurrency(), candidates.size()), r -> {
            Thread t = new Thread(r, "collector-download");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Measurement>> pending = new ArrayList<>(candidates.size());
            for (String c : candidates) {
                pending.add(pool.submit(() -> measure(c)));
            }
            List<Measurement> out = new ArrayList<>(pending.size());
            for (int i = 0; i < pending.size(); i++) {
                try {
                    out.add(pending.get(i).get());
                } catch (ExecutionException e) {
                    out.add(failed(candidates.get(i), 0, 0, String.valueOf(e.getCause())));
                }
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    /** One timed download; never throws for network problems. */
    public Measurement measure(String endpoint) {
        URI uri;
        try {
            uri = URI.create(downloadUrl(options.downloadUrlTemplate(), endpoint, options.bytes()));
        } catch (IllegalArgumentException bad) {
            return failed(endpoint, 0, 0, "bad URL: " + bad.getMessage());
        }
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(options.timeout())
                .GET()
                .build();

        AtomicLong received = new AtomicLong();
        long start = System.nanoTime();
        CompletableFuture<HttpResponse<Void>> call = http.sendAsync(req,
                HttpResponse.BodyHandlers.ofByteArrayConsumer(chunk -> chunk.ifPresent(b -> received.addAndGet(b.length))));
        try {
            HttpResponse<Void> resp = call.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
            double ms = (System.nanoTime() - start) / 1_000_000.0;
            if (resp.statusCode() / 100 != 2) {
                return failed(endpoint, received.get(), ms, "HTTP " + resp.statusCode());
            }
            return new Measurement(endpoint, received.get(), ms, System.currentTimeMillis(), null);
        } catch (TimeoutException e) {
            call.cancel(true);
            return failed(endpoint, received.get(), (System.nanoTime() - start) / 1_000_000.0, "timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String why = cause instanceof HttpTimeoutException ? "timeout" : cause.getClass().getSimpleName();
            return failed(endpoint, received.get(), (System.nanoTime() - start) / 1_000_000.0, why);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return failed(endpoint, received.get(), 0, "interrupted");
        }
    }

    /** POST one measurement to /api/report. */
    public void report(Measurement m) throws IOException, InterruptedException {
        var payload = new ReportPayload();
        payload.endpoint = m.endpoint();
        payload.bytesTransferred = m.bytesReceived();
        payload.durationMs = reportedDurationMs(m.durationMs());
        payload.observedAt = m.observedAtMillis();

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(resolve("/api/report"))
                .timeout(options.timeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(payload)));
        if (options.partition() != null && !options.partition().isBlank()) {
            b.header(options.partitionHeader(), options.partition());
        }
        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new ReportRejectedException(resp.statusCode(), resp.body());
        }
    }

    // ---------- helpers ----------

    /** Whole milliseconds, never below 1: the server rejects non-positive durations. */
    static long reportedDurationMs(double ms) {
        return Math.max(1L, Math.round(ms));
    }

    static String downloadUrl(String template, String endpoint, long bytes) {
        String host = endpoint.contains(":") && !endpoint.startsWith("[") ? "[" + endpoint + "]" : endpoint;
        return template.replace("{endpoint}", host).replace("{bytes}", Long.toString(bytes));
    }

    private URI resolve(String path) {
        String base = options.baseUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private static Measurement failed(String endpoint, long received, double ms, String why) {
        return new Measurement(endpoint, received, ms, System.currentTimeMillis(), why);
    }

    /** JSON body for POST /api/report. */
    static final class ReportPayload {
        public String endpoint;
        public long bytesTransferred;
        public long durationMs;
        public long observedAt;
    }

    /** The server answered a report with a non-200 status. */
    public static final class ReportRejectedException extends RuntimeException {
        private final int status;

        ReportRejectedException(int status, String body) {
            super("report rejected (" + status + "): " + body);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }
}
