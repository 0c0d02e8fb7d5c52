package com.streamfirst.seed.domain;

import java.util.Locale;

/**
 * The kind of solution being deployed. Both kinds share a template but seed different parts of it.
 */
public enum SolutionType {
    /** Seeds device groups, rules and the default simulation */
    REMOTE_MONITORING,
    /** Seeds only the default simulation */
    DEVICE_SIMULATION;

    private static final String DEVICE_SIMULATION_PREFIX = "devicesimulation";

    /**
     * Parses the configured solution type. Any value starting with "devicesimulation",
     * ignoring case and surrounding whitespace, selects {@link #DEVICE_SIMULATION};
     * anything else, including an unset value, is {@link #REMOTE_MONITORING}.
     */
    public static SolutionType fromConfig(String value) {
        if (value == null) {
            return REMOTE_MONITORING;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith(DEVICE_SIMULATION_PREFIX) ? DEVICE_SIMULATION : REMOTE_MONITORING;
    }

    public boolean seedsGroupsAndRules() {
        return this == REMOTE_MONITORING;
    }
}
