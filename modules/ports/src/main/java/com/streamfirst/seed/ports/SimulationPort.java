package com.streamfirst.seed.ports;

import com.streamfirst.seed.domain.SimulationModel;

import java.util.Optional;

/**
 * Port for the device simulation service.
 */
public interface SimulationPort {

    /**
     * Fetches the default simulation.
     *
     * @return the default simulation, or empty if none has been created yet
     */
    Optional<SimulationModel> getDefaultSimulation();

    /**
     * Creates (or replaces) a simulation under its {@link SimulationModel#effectiveId()}.
     *
     * @param simulation the simulation to create
     */
    void createSimulation(SimulationModel simulation);
}
