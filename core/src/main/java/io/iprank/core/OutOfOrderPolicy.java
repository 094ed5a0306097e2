package io.iprank.core;

/**
 * What to do with a sample whose timestamp is older than the stored
 * {@link EndpointStat#lastObservedAtMillis()}.
 */
public enum OutOfOrderPolicy {

    /** Fold it anyway; lastObservedAt becomes the sample's timestamp (last-received-wins). */
    ACCEPT,

    /** Drop it with {@link InvalidSampleException}; stored state is left untouched. */
    REJECT
}
