// file: server/src/test/java/io/iprank/server/WebServerSpec.java
package io.iprank.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.iprank.core.AggregationSettings;
import io.iprank.server.partition.PartitionRouter;
import io.iprank.server.refresh.ScheduledRefresher;
import io.iprank.storage.KvEndpointStatStore;
import io.iprank.storage.TtlResultCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP boundary.
 *
 * Focus:
 *  - Report + rank round trip, partition taken from the header.
 *  - Validation -> 400, oversized body -> 413, outage -> 503.
 *  - /dl size bounds, candidates, refresh, response headers.
 */
class WebServerSpec {

    private static final String HEADER = "X-Network-Origin";

    private final ObjectMapper json = new ObjectMapper();
    private final FlakyKeyValueStore kv = new FlakyKeyValueStore();
    private PartitionRouter router;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        router = new PartitionRouter(new KvEndpointStatStore(kv), AggregationSettings.defaults(), 2);
        var service = new AggregationService(router, new TtlResultCache());
        var refresher = new ScheduledRefresher(service, List.of("4134", "unknown"),
                Duration.ofSeconds(60), Duration.ofSeconds(120));

        server = new WebServer(0, service, refresher,
                new CandidatePool(List.of("104.16.0.0", "172.64.0.0")), HEADER, 5_000_000L);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        server.stop();
        router.close();
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.port() + pathAndQuery);
    }

    private HttpResponse<String> get(String path, String partition) throws Exception {
        var b = HttpRequest.newBuilder(uri(path)).GET();
        if (partition != null) {
            b.header(HEADER, partition);
        }
        return client.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String partition, String body) throws Exception {
        var b = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (partition != null) {
            b.header(HEADER, partition);
        }
        return client.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void liveness_banner_and_health() throws Exception {
        var root = get("/", null);
        assertEquals(200, root.statusCode());
        assertEquals("iprank: ok", root.body());

        var health = get("/admin/health", null);
        assertEquals(200, health.statusCode());
        assertEquals("ok", json.readTree(health.body()).get("status").asText());
    }

    @Test
    void report_then_rank_for_the_same_partition() throws Exception {
        var r1 = post("/api/report", "4134",
                "{\"endpoint\":\"1.1.1.1\",\"bytesTransferred\":5000000,\"durationMs\":1000}");
        assertEquals(200, r1.statusCode(), r1.body());
        JsonNode ack = json.readTree(r1.body());
        assertTrue(ack.get("accepted").asBoolean());
        assertEquals("4134", ack.get("partition").asText());
        assertEquals(40.0, ack.get("ewma").asDouble(), 1e-9);
        assertEquals(1, ack.get("sampleCount").asLong());

        var rank = get("/api/rank", "4134");
        assertEquals(200, rank.statusCode());
        JsonNode body = json.readTree(rank.body());
        assertEquals("4134", body.get("partition").asText());
        assertEquals("live", body.get("source").asText());
        assertFalse(body.get("stale").asBoolean());
        assertEquals(1, body.get("top").size());
        assertEquals("1.1.1.1", body.get("top").get(0).get("endpoint").asText());
        assertTrue(body.get("top").get(0).has("lastObservedAt"));

        var other = get("/api/rank", "4837");
        assertEquals(0, json.readTree(other.body()).get("top").size(), "partitions never leak into each other");
    }

    @Test
    void partition_in_the_body_is_ignored() throws Exception {
        var r = post("/api/report", null,
                "{\"endpoint\":\"e\",\"bytesTransferred\":1000,\"durationMs\":10,\"asn\":\"4134\",\"partition\":\"4134\"}");
        assertEquals(200, r.statusCode(), r.body());
        assertEquals("unknown", json.readTree(r.body()).get("partition").asText());
    }

    @Test
    void legacy_field_names_are_accepted() throws Exception {
        var r = post("/api/report", "9808", "{\"ip\":\"e\",\"bytes\":1250000,\"durationMs\":1000,\"ts\":1000}");
        assertEquals(200, r.statusCode(), r.body());
        assertEquals(10.0, json.readTree(r.body()).get("ewma").asDouble(), 1e-9);
    }

    @Test
    void invalid_samples_are_400() throws Exception {
        var negative = post("/api/report", "p", "{\"endpoint\":\"e\",\"bytesTransferred\":-1,\"durationMs\":10}");
        assertEquals(400, negative.statusCode());

        var zeroDuration = post("/api/report", "p", "{\"endpoint\":\"e\",\"bytesTransferred\":1,\"durationMs\":0}");
        assertEquals(400, zeroDuration.statusCode());

        var missing = post("/api/report", "p", "{\"endpoint\":\"e\"}");
        assertEquals(400, missing.statusCode());

        var badJson = post("/api/report", "p", "{not json");
        assertEquals(400, badJson.statusCode());
        assertEquals("invalid JSON", json.readTree(badJson.body()).get("error").asText());
    }

    @Test
    void oversized_body_is_413() throws Exception {
        String big = "{\"endpoint\":\"" + "x".repeat(WebServer.MAX_BODY_BYTES) + "\"}";
        var r = post("/api/report", "p", big);
        assertEquals(413, r.statusCode());
    }

    @Test
    void bad_limit_is_400() throws Exception {
        assertEquals(400, get("/api/rank?limit=0", "p").statusCode());
        assertEquals(400, get("/api/rank?limit=abc", "p").statusCode());
        assertEquals(200, get("/api/rank?limit=5000", "p").statusCode());
    }

    @Test
    void store_outage_maps_to_503() throws Exception {
        kv.failAll();

        var report = post("/api/report", "p", "{\"endpoint\":\"e\",\"bytesTransferred\":1000,\"durationMs\":10}");
        assertEquals(503, report.statusCode());

        var rank = get("/api/rank", "p");
        assertEquals(503, rank.statusCode());
        JsonNode body = json.readTree(rank.body());
        assertEquals("p", body.get("partition").asText());
        assertEquals(0, body.get("top").size());
        assertTrue(body.has("error"));
    }

    @Test
    void download_is_bounded() throws Exception {
        var small = client.send(HttpRequest.newBuilder(uri("/dl?bytes=10")).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());
        assertEquals(200, small.statusCode());
        assertEquals(1024, small.body().length);
        assertEquals("application/octet-stream", small.headers().firstValue("content-type").orElse(""));
        assertEquals("no-store", small.headers().firstValue("cache-control").orElse(""));

        var exact = client.send(HttpRequest.newBuilder(uri("/dl?bytes=200000")).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());
        assertEquals(200_000, exact.body().length);

        assertEquals(50_000_000L, WebServer.boundDownloadBytes(Long.MAX_VALUE));
        assertEquals(400, get("/dl?bytes=lots", null).statusCode());
    }

    @Test
    void candidates_are_served() throws Exception {
        var r = get("/api/candidates", null);
        assertEquals(200, r.statusCode());
        JsonNode c = json.readTree(r.body()).get("candidates");
        assertEquals(2, c.size());
        assertEquals("104.16.0.0", c.get(0).asText());
    }

    @Test
    void cron_refresh_reports_refreshed_partitions() throws Exception {
        var r = post("/cron/refresh", null, "");
        assertEquals(200, r.statusCode(), r.body());
        JsonNode body = json.readTree(r.body());
        assertEquals(2, body.get("refreshed").size());
        assertEquals(0, body.get("failures").size());

        // Warmed entries are served from the cache.
        assertEquals("cache", json.readTree(get("/api/rank", "4134").body()).get("source").asText());
    }

    @Test
    void json_responses_carry_no_store_and_cors_headers() throws Exception {
        var r = get("/api/rank", "p");
        assertEquals("no-store", r.headers().firstValue("cache-control").orElse(""));
        assertEquals("*", r.headers().firstValue("access-control-allow-origin").orElse(""));
        assertTrue(r.headers().firstValue("content-type").orElse("").startsWith("application/json"));
    }

    @Test
    void unknown_path_is_404_and_wrong_method_is_405() throws Exception {
        assertEquals(404, get("/nope", null).statusCode());
        assertEquals(405, get("/api/report", "p").statusCode());
        assertEquals(405, post("/api/rank", "p", "{}").statusCode());
    }
}
