// file: client/src/main/java/io/iprank/client/Cli.java
package io.iprank.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Simple CLI for interacting with a running ranking server over HTTP.
 *
 * Usage:
 *   iprank-cli [--base-url http://host:port] rank [--partition P] [--limit N]
 *   iprank-cli [--base-url http://host:port] report <endpoint> <bytes> <durationMs> [--partition P]
 *   iprank-cli [--base-url http://host:port] candidates
 *   iprank-cli [--base-url http://host:port] collect [collector options]
 *
 * Examples:
 *   iprank-cli rank --partition 4134 --limit 10
 *   iprank-cli report 104.16.0.0 5000000 812 --partition 4134
 *   iprank-cli collect --partition 4134 --concurrency 10
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            String[] cmdArgs = Arrays.copyOfRange(rest, 1, rest.length);
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "rank" -> {
                    String partition = optionValue(cmdArgs, "--partition");
                    String limit = optionValue(cmdArgs, "--limit");
                    cli.rank(partition, limit);
                }
                case "report" -> {
                    if (cmdArgs.length != 3 && cmdArgs.length != 5) {
                        usageAndExit("report requires <endpoint> <bytes> <durationMs> [--partition P]");
                    }
                    String partition = optionValue(Arrays.copyOfRange(cmdArgs, 3, cmdArgs.length), "--partition");
                    cli.report(cmdArgs[0], cmdArgs[1], cmdArgs[2], partition);
                }
                case "candidates" -> cli.candidates();
                case "collect" -> {
                    var options = CollectorOptions.parse(URI.create(cli.baseUrl), cmdArgs);
                    var summary = new SampleCollector(cli.http, options).runOnce();
                    if (summary.reportFailures() > 0) {
                        throw new CliException(summary.reportFailures() + " report(s) rejected");
                    }
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException | IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 2 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** Value of {@code --name v} pairs; any other token is an error. */
    static String optionValue(String[] args, String name) {
        String found = null;
        for (int i = 0; i < args.length; i += 2) {
            if (i + 1 >= args.length) {
                throw new CliException("missing value for " + args[i]);
            }
            if (name.equals(args[i])) {
                found = args[i + 1];
            } else if (!args[i].startsWith("--")) {
                throw new CliException("unexpected argument: " + args[i]);
            }
        }
        return found;
    }

    private void rank(String partition, String limit) throws Exception {
        String path = "/api/rank" + (limit != null ? "?limit=" + URLEncoder.encode(limit, StandardCharsets.UTF_8) : "");
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET();
        if (partition != null) {
            b.header(CollectorOptions.DEFAULT_PARTITION_HEADER, partition);
        }
        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("rank failed (" + resp.statusCode() + "): " + resp.body());
        }

        JsonNode body = json.readTree(resp.body());
        System.out.printf("partition=%s source=%s%s%n",
                body.path("partition").asText(),
                body.path("source").asText(),
                body.path("stale").asBoolean() ? " (stale)" : "");
        int rank = 1;
        for (JsonNode row : body.path("top")) {
            System.out.printf("%4d  %-40s score=%8.2f  ewma=%8.2f Mbps%n",
                    rank++,
                    row.path("endpoint").asText(),
                    row.path("score").asDouble(),
                    row.path("ewma").asDouble());
        }
    }

    private void report(String endpoint, String bytes, String durationMs, String partition) throws Exception {
        var payload = json.createObjectNode()
                .put("endpoint", endpoint)
                .put("bytesTransferred", parseNumber("bytes", bytes))
                .put("durationMs", parseNumber("durationMs", durationMs));

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/report"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload)));
        if (partition != null) {
            b.header(CollectorOptions.DEFAULT_PARTITION_HEADER, partition);
        }
        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("report failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode ack = json.readTree(resp.body());
        System.out.printf("OK partition=%s ewma=%.2f Mbps samples=%d%n",
                ack.path("partition").asText(),
                ack.path("ewma").asDouble(),
                ack.path("sampleCount").asLong());
    }

    private void candidates() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/candidates"))
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("candidates failed (" + resp.statusCode() + "): " + resp.body());
        }
        for (JsonNode c : json.readTree(resp.body()).path("candidates")) {
            System.out.println(c.asText());
        }
    }

    private static long parseNumber(String name, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CliException(name + " must be an integer: " + raw);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  iprank-cli [--base-url http://host:port] rank [--partition P] [--limit N]
                  iprank-cli [--base-url http://host:port] report <endpoint> <bytes> <durationMs> [--partition P]
                  iprank-cli [--base-url http://host:port] candidates
                  iprank-cli [--base-url http://host:port] collect [--partition P] [--partition-header H]
                             [--bytes N] [--concurrency N] [--timeout-seconds N]
                             [--download-url-template http://{endpoint}:8080/dl?bytes={bytes}]
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
