package com.streamfirst.seed.domain;

/**
 * A store adapter could not reach its backend.
 */
public class StoreUnavailableException extends SeedException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
