package com.streamfirst.seed.domain;

import lombok.Getter;

/**
 * A conditional write found a different version than the one it expected.
 */
@Getter
public class VersionConflictException extends SeedException {

    private final String collection;
    private final String key;
    private final Version expected;

    public VersionConflictException(String collection, String key, Version expected) {
        super("Version conflict on " + collection + "/" + key + " (expected " + expected + ")");
        this.collection = collection;
        this.key = key;
        this.expected = expected;
    }
}
