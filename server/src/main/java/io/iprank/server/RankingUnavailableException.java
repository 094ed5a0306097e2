package io.iprank.server;

/**
 * No live ranking could be computed and no previous one exists to fall back to.
 */
public class RankingUnavailableException extends RuntimeException {

    private final String partition;

    public RankingUnavailableException(String partition, Throwable cause) {
        super("ranking for partition " + partition + " unavailable", cause);
        this.partition = partition;
    }

    public String partition() {
        return partition;
    }
}
