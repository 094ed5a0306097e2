package io.iprank.storage;

/**
 * The backing store could not be reached or failed an I/O operation.
 * Callers must surface it; a failed write is never silently dropped.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
