package com.streamfirst.seed.domain;

import lombok.Getter;

/**
 * A remote read or write failed part way through the seed sequence.
 * Identifies the step and the entity that could not be seeded so callers do not have to
 * dig through logs to find the offender.
 */
@Getter
public class SeedStepException extends SeedException {

    public enum Step {
        /** Upserting a device group */
        GROUP,
        /** Upserting a rule */
        RULE,
        /** Looking up or creating a simulation */
        SIMULATION,
        /** Writing the completion flag */
        COMPLETION_FLAG
    }

    private final Step step;
    private final String entityId;

    public SeedStepException(Step step, String entityId, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
        this.entityId = entityId;
    }
}
