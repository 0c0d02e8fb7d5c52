package com.streamfirst.seed.domain;

/**
 * Base class of every failure raised while seeding. Skip conditions (no template, a held mutex,
 * an existing completion flag) are not failures and never surface as exceptions.
 */
public class SeedException extends RuntimeException {

    public SeedException(String message) {
        super(message);
    }

    public SeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
