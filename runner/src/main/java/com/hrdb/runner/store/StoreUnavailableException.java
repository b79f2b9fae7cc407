package com.hrdb.runner.store;

/**
 * Thrown when the store cannot be reached, before any statement runs.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
