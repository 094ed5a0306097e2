package io.iprank.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.iprank.core.AggregationSettings;
import io.iprank.core.OutOfOrderPolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Optional JSON overrides for {@link AggregationSettings}.
 * <p>
 * Example:
 * <pre>
 *   {
 *     "alpha": 0.3,
 *     "decayTauSeconds": 180,
 *     "confidenceThreshold": 5,
 *     "lowConfidencePenalty": 0.6,
 *     "defaultLimit": 100,
 *     "maxLimit": 1000,
 *     "outOfOrderPolicy": "accept"
 *   }
 * </pre>
 * Absent fields keep their defaults. Unknown fields are rejected so typos surface at startup.
 */
public final class TuningConfig {
    public Double alpha;
    public Double decayTauSeconds;
    public Long confidenceThreshold;
    public Double lowConfidencePenalty;
    public Integer defaultLimit;
    public Integer maxLimit;
    public String outOfOrderPolicy;

    public static AggregationSettings fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            return mapper.readValue(path.toFile(), TuningConfig.class).applyTo(AggregationSettings.defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load tuning from " + path + ": " + e.getMessage(), e);
        }
    }

    public AggregationSettings applyTo(AggregationSettings base) {
        return new AggregationSettings(
                alpha != null ? alpha : base.alpha(),
                decayTauSeconds != null ? decayTauSeconds : base.decayTauSeconds(),
                confidenceThreshold != null ? confidenceThreshold : base.confidenceThreshold(),
                lowConfidencePenalty != null ? lowConfidencePenalty : base.lowConfidencePenalty(),
                defaultLimit != null ? defaultLimit : base.defaultLimit(),
                maxLimit != null ? maxLimit : base.maxLimit(),
                outOfOrderPolicy != null
                        ? OutOfOrderPolicy.valueOf(outOfOrderPolicy.trim().toUpperCase(Locale.ROOT))
                        : base.outOfOrderPolicy()
        );
    }
}
