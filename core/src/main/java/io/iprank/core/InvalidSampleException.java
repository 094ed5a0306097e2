package io.iprank.core;

/**
 * A measurement that is malformed or physically impossible
 * (non-positive duration, negative byte count, non-finite throughput,
 * or a stale sample rejected by {@link OutOfOrderPolicy#REJECT}).
 * <p>
 * Such samples are dropped and never folded into stored state.
 */
public class InvalidSampleException extends IllegalArgumentException {

    public InvalidSampleException(String message) {
        super(message);
    }
}
