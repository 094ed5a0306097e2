package io.iprank.server;

/**
 * One raw measurement as submitted by a collector, before validation.
 * Boxed fields are null when the submitter omitted them.
 *
 * @param endpoint         measured endpoint identifier
 * @param bytesTransferred bytes received
 * @param durationMs       elapsed transfer time in milliseconds
 * @param observedAtMillis measurement time (epoch ms); null means "now"
 */
public record SampleReport(String endpoint, Long bytesTransferred, Double durationMs, Long observedAtMillis) {
}
