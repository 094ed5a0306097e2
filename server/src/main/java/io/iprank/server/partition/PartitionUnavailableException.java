package io.iprank.server.partition;

/**
 * The state store behind a partition could not be reached. The operation
 * failed closed: no sample was folded, no ranking was produced.
 */
public class PartitionUnavailableException extends RuntimeException {

    private final String partition;

    public PartitionUnavailableException(String partition, Throwable cause) {
        super("partition " + partition + " unavailable: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.partition = partition;
    }

    public String partition() {
        return partition;
    }
}
