// file: server/src/main/java/io/iprank/server/WebServer.java
package io.iprank.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.iprank.core.RankedResult;
import io.iprank.server.dto.CandidatesResponse;
import io.iprank.server.dto.RankResponse;
import io.iprank.server.dto.RefreshResponse;
import io.iprank.server.dto.ReportRequest;
import io.iprank.server.dto.ReportResponse;
import io.iprank.server.partition.PartitionRouter;
import io.iprank.server.partition.PartitionUnavailableException;
import io.iprank.server.refresh.RefreshReport;
import io.iprank.server.refresh.ScheduledRefresher;
import io.iprank.storage.StoreUnavailableException;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Thin HTTP adapter over {@link AggregationService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Take the partition key from the configured request header, never from the body.
 *  - Decode JSON request bodies into DTOs and convert results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET       /                  liveness banner
 *   - GET       /admin/health      basic health check
 *   - GET       /dl?bytes=N        N random bytes for throughput measurement
 *   - GET       /api/candidates    candidate endpoint pool
 *   - POST      /api/report        submit one throughput sample
 *   - GET       /api/rank?limit=N  top endpoints for the caller's partition
 *   - GET|POST  /cron/refresh      run one scheduled refresh pass now
 *
 * Every request is dispatched off the IO thread: ingest and rank block on
 * partition actors.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    static final long MIN_DOWNLOAD_BYTES = 1024L;
    static final long MAX_DOWNLOAD_BYTES = 50_000_000L;
    private static final int DOWNLOAD_CHUNK_BYTES = 64 * 1024;

    private static final HttpString ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final AggregationService service;
    private final ScheduledRefresher refresher;
    private final CandidatePool candidates;
    private final String partitionHeader;
    private final long downloadDefaultBytes;

    public WebServer(int port,
                     AggregationService service,
                     ScheduledRefresher refresher,
                     CandidatePool candidates,
                     String partitionHeader,
                     long downloadDefaultBytes) {
        this.service = Objects.requireNonNull(service, "service");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
        this.candidates = Objects.requireNonNull(candidates, "candidates");
        this.partitionHeader = Objects.requireNonNull(partitionHeader, "partitionHeader");
        this.downloadDefaultBytes = downloadDefaultBytes;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::route);
                        return;
                    }
                    route(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Bound port; useful when constructed with port 0. */
    public int port() {
        var address = server.getListenerInfo().get(0).getAddress();
        return ((InetSocketAddress) address).getPort();
    }

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();

        if ("OPTIONS".equals(method)) {
            corsHeaders(ex);
            ex.getResponseHeaders().put(ALLOW_METHODS, "GET, POST, OPTIONS");
            ex.getResponseHeaders().put(ALLOW_HEADERS, "content-type, " + partitionHeader);
            ex.setStatusCode(204);
            RequestLogger.logRequest(method, path, null, 204, 0, -1, null);
            return;
        }

        switch (path) {
            case "/" -> {
                if (!requireMethod(ex, "GET")) return;
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                ex.getResponseSender().send("iprank: ok");
                RequestLogger.logRequest(method, path, null, 200, 0, -1, null);
            }
            case "/admin/health" -> {
                send(ex, 200, Map.of("status", "ok"));
                RequestLogger.logRequest(method, path, null, 200, 0, -1, null);
            }
            case "/dl" -> {
                if (requireMethod(ex, "GET")) handleDownload(ex);
            }
            case "/api/candidates" -> {
                if (requireMethod(ex, "GET")) handleCandidates(ex);
            }
            case "/api/report" -> {
                if (requireMethod(ex, "POST")) handleReport(ex);
            }
            case "/api/rank" -> {
                if (requireMethod(ex, "GET")) handleRank(ex);
            }
            case "/cron/refresh" -> {
                if ("GET".equals(method) || requireMethod(ex, "POST")) handleRefresh(ex);
            }
            default -> {
                send(ex, 404, Map.of("error", "not found"));
                RequestLogger.logRequest(method, path, null, 404, 0, -1, null);
            }
        }
    }

    // ---------- handlers ----------

    /** POST /api/report */
    private void handleReport(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status;
        long partitionMs = -1L;
        Throwable error = null;
        String partition = PartitionRouter.normalize(ex.getRequestHeaders().getFirst(partitionHeader));

        try {
            ex.startBlocking();
            byte[] data = ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
            if (data.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                ReportRequest req = json.readValue(data, ReportRequest.class);
                SampleReport report = req == null
                        ? null
                        : new SampleReport(req.endpoint, req.bytesTransferred, req.durationMs, req.observedAt);

                long pStart = System.nanoTime();
                IngestResult r = service.ingest(partition, report);
                partitionMs = (System.nanoTime() - pStart) / 1_000_000L;

                var dto = new ReportResponse();
                dto.accepted = true;
                dto.partition = r.partition();
                dto.endpoint = r.endpoint();
                dto.ewma = r.ewma();
                dto.sampleCount = r.sampleCount();
                status = 200;
                send(ex, status, dto);
            }
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (IngestTimeoutException timeout) {
            status = 504;
            error = timeout;
            send(ex, status, Map.of("error", timeout.getMessage()));
        } catch (PartitionUnavailableException | StoreUnavailableException down) {
            status = 503;
            error = down;
            send(ex, status, Map.of("error", "state store unavailable", "message", String.valueOf(down.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            sendInternalError(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("POST", ex.getRequestPath(), partition, ex.getStatusCode(), totalMs, partitionMs, error);
        }
    }

    /** GET /api/rank?limit=N */
    private void handleRank(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        long partitionMs = -1L;
        Throwable error = null;
        String partition = PartitionRouter.normalize(ex.getRequestHeaders().getFirst(partitionHeader));

        try {
            Integer limit = parseOptionalInt(ex, "limit");

            long pStart = System.nanoTime();
            RankingView view = service.rank(partition, limit);
            partitionMs = (System.nanoTime() - pStart) / 1_000_000L;

            var dto = new RankResponse();
            dto.partition = view.partition();
            dto.stale = view.stale();
            dto.source = view.source().name().toLowerCase(Locale.ROOT);
            dto.computedAt = view.computedAtMillis();
            dto.top = new ArrayList<>(view.top().size());
            for (RankedResult r : view.top()) {
                var e = new RankResponse.Entry();
                e.endpoint = r.endpoint();
                e.score = r.score();
                e.ewma = r.ewma();
                e.lastObservedAt = r.lastObservedAtMillis();
                dto.top.add(e);
            }
            send(ex, status, dto);
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (RankingUnavailableException down) {
            status = 503;
            error = down;
            send(ex, status, Map.of(
                    "partition", down.partition(),
                    "top", List.of(),
                    "error", "ranking unavailable"
            ));
        } catch (Exception e) {
            status = 500;
            error = e;
            sendInternalError(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), partition, status, totalMs, partitionMs, error);
        }
    }

    /** GET /dl?bytes=N; streams N random bytes, N bounded to [1 KiB, 50 MB]. */
    private void handleDownload(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            long requested;
            try {
                Long parsed = parseOptionalLong(ex, "bytes");
                requested = parsed != null ? parsed : downloadDefaultBytes;
            } catch (IllegalArgumentException bad) {
                status = 400;
                error = bad;
                send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
                return;
            }
            long total = boundDownloadBytes(requested);

            byte[] chunk = new byte[DOWNLOAD_CHUNK_BYTES];
            ThreadLocalRandom.current().nextBytes(chunk); // incompressible payload

            ex.setStatusCode(status);
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/octet-stream");
            ex.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
            ex.getResponseHeaders().put(Headers.CONTENT_LENGTH, total);
            corsHeaders(ex);
            ex.startBlocking();
            try (OutputStream out = ex.getOutputStream()) {
                long sent = 0;
                while (sent < total) {
                    int n = (int) Math.min(chunk.length, total - sent);
                    out.write(chunk, 0, n);
                    sent += n;
                }
            }
        } catch (Exception e) {
            // Client aborts mid-stream land here; headers are already gone.
            status = 500;
            error = e;
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), null, status, totalMs, -1, error);
        }
    }

    /** GET /api/candidates */
    private void handleCandidates(HttpServerExchange ex) {
        var dto = new CandidatesResponse();
        dto.candidates = candidates.candidates();
        send(ex, 200, dto);
        RequestLogger.logRequest("GET", ex.getRequestPath(), null, 200, 0, -1, null);
    }

    /** GET|POST /cron/refresh */
    private void handleRefresh(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            RefreshReport report = refresher.refreshOnce();
            var dto = new RefreshResponse();
            dto.refreshed = report.refreshed();
            dto.failures = report.failures();
            send(ex, status, dto);
        } catch (Exception e) {
            status = 500;
            error = e;
            sendInternalError(ex, e);
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), null,
                    status, totalMs, -1, error);
        }
    }

    // ---------- helpers ----------

    static long boundDownloadBytes(long requested) {
        return Math.max(MIN_DOWNLOAD_BYTES, Math.min(requested, MAX_DOWNLOAD_BYTES));
    }

    private boolean requireMethod(HttpServerExchange ex, String expected) {
        String method = ex.getRequestMethod().toString();
        if (expected.equals(method)) {
            return true;
        }
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, ex.getRequestPath(), null, 405, 0, -1, null);
        return false;
    }

    private static Integer parseOptionalInt(HttpServerExchange ex, String name) {
        Long v = parseOptionalLong(ex, name);
        if (v == null) {
            return null;
        }
        if (v > Integer.MAX_VALUE || v < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(name + " out of range");
        }
        return v.intValue();
    }

    private static Long parseOptionalLong(HttpServerExchange ex, String name) {
        String raw = firstOrNull(ex.getQueryParameters().get(name));
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(name + " must be an integer", nfe);
        }
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    private static void corsHeaders(HttpServerExchange ex) {
        ex.getResponseHeaders().put(ALLOW_ORIGIN, "*");
    }

    private void sendInternalError(HttpServerExchange ex, Exception e) {
        send(ex, 500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        ex.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
        corsHeaders(ex);
        try {
            byte[] bytes = json.writeValueAsBytes(body);
            ex.setStatusCode(code);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
