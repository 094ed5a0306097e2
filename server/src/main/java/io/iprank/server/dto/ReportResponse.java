package io.iprank.server.dto;

/** Response for an accepted POST /api/report. */
public class ReportResponse {
    public boolean accepted;
    public String partition;
    public String endpoint;
    public double ewma;        // Mbps after the fold
    public long sampleCount;
}
