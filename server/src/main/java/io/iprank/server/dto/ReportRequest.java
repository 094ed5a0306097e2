// file: server/src/main/java/io/iprank/server/dto/ReportRequest.java
package io.iprank.server.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON body for POST /api/report.
 * Example:
 *   {
 *     "endpoint": "104.16.0.0",
 *     "bytesTransferred": 5000000,
 *     "durationMs": 812,
 *     "observedAt": 1700000000000
 *   }
 * The partition key is never read from the body; collector-side extras are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportRequest {
    @JsonAlias("ip")
    public String endpoint;
    @JsonAlias("bytes")
    public Long bytesTransferred;
    public Double durationMs;
    @JsonAlias("ts")
    public Long observedAt;  // epoch ms, optional
}
