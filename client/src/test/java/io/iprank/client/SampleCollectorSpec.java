package io.iprank.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Collector against an in-process Undertow stub that plays both the ranking
 * server and three candidates: one healthy, one failing, one too slow.
 */
class SampleCollectorSpec {

    private final ObjectMapper json = new ObjectMapper();
    private final Queue<String> reportBodies = new ConcurrentLinkedQueue<>();
    private final Queue<String> reportPartitions = new ConcurrentLinkedQueue<>();
    private Undertow stub;
    private int port;

    @BeforeEach
    void startStub() {
        stub = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setHandler(ex -> {
                    if (ex.isInIoThread()) {
                        ex.dispatch(this::handle);
                        return;
                    }
                    handle(ex);
                }).build();
        stub.start();
        port = ((InetSocketAddress) stub.getListenerInfo().get(0).getAddress()).getPort();
    }

    @AfterEach
    void stopStub() {
        stub.stop();
    }

    private void handle(HttpServerExchange ex) throws Exception {
        String path = ex.getRequestPath();
        ex.startBlocking();
        switch (path) {
            case "/api/candidates" -> ex.getResponseSender().send("{\"candidates\":[\"good\",\"bad\",\"slow\"]}");
            case "/api/report" -> {
                reportBodies.add(new String(ex.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
                reportPartitions.add(String.valueOf(ex.getRequestHeaders().getFirst("X-Network-Origin")));
                ex.getResponseSender().send("{\"accepted\":true}");
            }
            case "/dl/good" -> {
                int n = Integer.parseInt(ex.getQueryParameters().get("bytes").getFirst());
                ex.getResponseHeaders().put(Headers.CONTENT_LENGTH, n);
                try (OutputStream out = ex.getOutputStream()) {
                    out.write(new byte[n]);
                }
            }
            case "/dl/bad" -> ex.setStatusCode(500);
            case "/dl/slow" -> {
                Thread.sleep(1_500);
                ex.getResponseSender().send("late");
            }
            default -> ex.setStatusCode(404);
        }
    }

    private SampleCollector collector(String partition) {
        var options = new CollectorOptions(
                URI.create("http://127.0.0.1:" + port),
                "http://127.0.0.1:" + port + "/dl/{endpoint}?bytes={bytes}",
                20_000,
                2,
                Duration.ofMillis(500),
                partition,
                "X-Network-Origin"
        );
        return new SampleCollector(HttpClient.newHttpClient(), options);
    }

    @Test
    void only_successful_downloads_are_reported() throws Exception {
        SampleCollector.RunSummary summary = collector("4134").runOnce();

        List<String> endpoints = new ArrayList<>();
        summary.measurements().forEach(m -> endpoints.add(m.endpoint()));
        assertEquals(List.of("good", "bad", "slow"), endpoints, "results keep candidate order");
        assertEquals(1, summary.succeeded());
        assertEquals(1, summary.reported());
        assertEquals(0, summary.reportFailures());

        assertEquals(1, reportBodies.size());
        JsonNode body = json.readTree(reportBodies.peek());
        assertEquals("good", body.get("endpoint").asText());
        assertEquals(20_000, body.get("bytesTransferred").asLong());
        assertTrue(body.get("durationMs").isIntegralNumber());
        assertTrue(body.get("durationMs").asLong() >= 1);
        assertTrue(body.get("observedAt").asLong() > 0);
        assertEquals("4134", reportPartitions.peek());
    }

    @Test
    void failures_carry_a_reason() {
        SampleCollector c = collector(null);

        Measurement bad = c.measure("bad");
        assertFalse(bad.ok());
        assertEquals("HTTP 500", bad.error());
        assertEquals(0.0, bad.mbps());

        Measurement slow = c.measure("slow");
        assertFalse(slow.ok());
        assertEquals("timeout", slow.error());

        Measurement good = c.measure("good");
        assertTrue(good.ok());
        assertEquals(20_000, good.bytesReceived());
        assertTrue(good.mbps() > 0);
    }

    @Test
    void partition_header_is_omitted_when_not_configured() throws Exception {
        collector(null).runOnce();
        assertEquals("null", reportPartitions.peek());
    }

    @Test
    void reported_duration_is_whole_millis_and_never_zero() {
        assertEquals(1, SampleCollector.reportedDurationMs(0.2));
        assertEquals(1, SampleCollector.reportedDurationMs(0.0));
        assertEquals(813, SampleCollector.reportedDurationMs(812.6));
        assertEquals(812, SampleCollector.reportedDurationMs(812.4));
    }

    @Test
    void download_url_fills_placeholders_and_brackets_ipv6() {
        assertEquals("http://104.16.0.0:8080/dl?bytes=5000000",
                SampleCollector.downloadUrl(CollectorOptions.DEFAULT_TEMPLATE, "104.16.0.0", 5_000_000));
        assertEquals("http://[2606:4700::1]:8080/dl?bytes=1024",
                SampleCollector.downloadUrl(CollectorOptions.DEFAULT_TEMPLATE, "2606:4700::1", 1024));
    }
}
