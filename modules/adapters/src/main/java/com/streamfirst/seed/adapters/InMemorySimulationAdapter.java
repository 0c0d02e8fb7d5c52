package com.streamfirst.seed.adapters;

import com.streamfirst.seed.domain.SimulationModel;
import com.streamfirst.seed.domain.StoreUnavailableException;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.ports.SimulationPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of SimulationPort for testing and development.
 * Simulations are keyed by {@link SimulationModel#effectiveId()}; the default simulation is the
 * one stored under {@link SimulationModel#DEFAULT_SIMULATION_ID}.
 */
@Slf4j
public class InMemorySimulationAdapter extends InMemoryCollection<SimulationModel> implements SimulationPort {

    private volatile boolean readable = true;

    public InMemorySimulationAdapter() {
        super("simulations");
    }

    @Override
    public Optional<SimulationModel> getDefaultSimulation() {
        if (!readable) {
            throw new StoreUnavailableException("Simulation service is unavailable");
        }
        Optional<SimulationModel> simulation = find(SimulationModel.DEFAULT_SIMULATION_ID);
        log.debug("Default simulation {}", simulation.isPresent() ? "exists" : "not found");
        return simulation;
    }

    @Override
    public void createSimulation(SimulationModel simulation) {
        put(simulation.effectiveId(), simulation, Version.ANY);
        log.info("Created simulation {}", simulation.effectiveId());
    }

    public Optional<SimulationModel> getSimulation(String id) {
        return find(id);
    }

    public List<SimulationModel> listSimulations() {
        return values();
    }

    /**
     * Makes {@link #getDefaultSimulation()} fail, simulating an unreachable service.
     */
    public void setReadable(boolean readable) {
        this.readable = readable;
    }
}
