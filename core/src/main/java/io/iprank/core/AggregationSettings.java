// file: core/src/main/java/io/iprank/core/AggregationSettings.java
package io.iprank.core;

import java.util.Objects;

/**
 * Tuning knobs shared by {@link EwmaTracker} and {@link RankingEngine}.
 * <p>
 * Fields:
 *  - alpha:                 EWMA smoothing factor in (0,1]; higher reacts faster, ranks less stably.
 *  - decayTauSeconds:       freshness time constant; an endpoint's weight falls to ~37% after one tau.
 *  - confidenceThreshold:   sample count at which an endpoint gets full confidence.
 *  - lowConfidencePenalty:  multiplier in (0,1] applied below the threshold.
 *  - defaultLimit:          ranking size when the caller does not ask for one.
 *  - maxLimit:              hard cap on any requested ranking size.
 *  - outOfOrderPolicy:      handling of samples older than the stored lastObservedAt.
 */
public record AggregationSettings(
        double alpha,
        double decayTauSeconds,
        long confidenceThreshold,
        double lowConfidencePenalty,
        int defaultLimit,
        int maxLimit,
        OutOfOrderPolicy outOfOrderPolicy
) {

    public static final double DEFAULT_ALPHA = 0.3;
    public static final double DEFAULT_DECAY_TAU_SECONDS = 180.0;
    public static final long DEFAULT_CONFIDENCE_THRESHOLD = 5L;
    public static final double DEFAULT_LOW_CONFIDENCE_PENALTY = 0.6;
    public static final int DEFAULT_LIMIT = 100;
    public static final int DEFAULT_MAX_LIMIT = 1000;

    public AggregationSettings {
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0,1], got " + alpha);
        }
        if (!(decayTauSeconds > 0.0) || Double.isInfinite(decayTauSeconds)) {
            throw new IllegalArgumentException("decayTauSeconds must be > 0, got " + decayTauSeconds);
        }
        if (confidenceThreshold < 1) {
            throw new IllegalArgumentException("confidenceThreshold must be >= 1");
        }
        if (!(lowConfidencePenalty > 0.0 && lowConfidencePenalty <= 1.0)) {
            throw new IllegalArgumentException("lowConfidencePenalty must be in (0,1], got " + lowConfidencePenalty);
        }
        if (defaultLimit < 1) {
            throw new IllegalArgumentException("defaultLimit must be >= 1");
        }
        if (maxLimit < defaultLimit) {
            throw new IllegalArgumentException("maxLimit must be >= defaultLimit");
        }
        Objects.requireNonNull(outOfOrderPolicy, "outOfOrderPolicy");
    }

    public static AggregationSettings defaults() {
        return new AggregationSettings(
                DEFAULT_ALPHA,
                DEFAULT_DECAY_TAU_SECONDS,
                DEFAULT_CONFIDENCE_THRESHOLD,
                DEFAULT_LOW_CONFIDENCE_PENALTY,
                DEFAULT_LIMIT,
                DEFAULT_MAX_LIMIT,
                OutOfOrderPolicy.ACCEPT
        );
    }

    public AggregationSettings withOutOfOrderPolicy(OutOfOrderPolicy policy) {
        return new AggregationSettings(alpha, decayTauSeconds, confidenceThreshold,
                lowConfidencePenalty, defaultLimit, maxLimit, policy);
    }
}
