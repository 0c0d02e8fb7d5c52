package com.streamfirst.seed.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simulation declared by a seed template. The payload is opaque to the coordinator.
 *
 * @param id simulation id, or null to create it as the default simulation
 * @param attributes the simulation payload without the id
 */
public record SimulationModel(String id, Map<String, Object> attributes) {

    /** Id under which the simulation service keeps its default simulation. */
    public static final String DEFAULT_SIMULATION_ID = "1";

    public SimulationModel {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Returns the id this simulation is stored under.
     */
    public String effectiveId() {
        return id != null ? id : DEFAULT_SIMULATION_ID;
    }

    public boolean isDefault() {
        return DEFAULT_SIMULATION_ID.equals(effectiveId());
    }
}
