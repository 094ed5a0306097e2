package io.iprank.server.refresh;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one refresh pass.
 *
 * @param refreshed partitions whose cached ranking was rewritten, in run order
 * @param failures  partition to error message, for partitions that failed
 */
public record RefreshReport(List<String> refreshed, Map<String, String> failures) {

    public RefreshReport {
        refreshed = List.copyOf(refreshed);
        failures = Map.copyOf(failures);
    }

    public boolean partialFailure() {
        return !failures.isEmpty();
    }
}
