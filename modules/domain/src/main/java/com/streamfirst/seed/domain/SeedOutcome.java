package com.streamfirst.seed.domain;

/**
 * How a seed attempt ended when it did not fail.
 */
public enum SeedOutcome {
    /** No template configured; seeding is opt-in */
    NOT_CONFIGURED,
    /** Another instance holds the seed mutex, or the lock backend is unreachable */
    CONTENDED,
    /** The completion flag was already set */
    ALREADY_COMPLETED,
    /** This attempt ran the seed sequence and set the completion flag */
    SEEDED;

    public boolean isSkip() {
        return this != SEEDED;
    }
}
