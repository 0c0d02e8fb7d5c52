package com.streamfirst.seed.application;

import com.streamfirst.seed.domain.SeedException;
import com.streamfirst.seed.domain.SeedStepException;
import com.streamfirst.seed.domain.SeedTemplate;
import com.streamfirst.seed.domain.SimulationModel;
import com.streamfirst.seed.ports.SimulationPort;
import com.streamfirst.seed.ports.TemplatePort;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the template's simulations unless a default simulation already exists. The existence
 * check makes this step safe to repeat on its own, independent of the completion flag.
 */
@Slf4j
@RequiredArgsConstructor
public class SimulationSeeder {

  private final TemplatePort templatePort;
  private final SimulationPort simulationPort;

  /**
   * Seeds the default simulation(s) from the named template.
   *
   * @param templateName the template to read simulations from; read only when seeding is needed
   * @return true if simulations were created, false if a default simulation already existed
   * @throws SeedStepException if the simulation service fails
   */
  public boolean seed(String templateName) {
    Optional<SimulationModel> existing;
    try {
      existing = simulationPort.getDefaultSimulation();
    } catch (RuntimeException e) {
      log.error("Failed to seed default simulations: cannot read the default simulation", e);
      throw new SeedStepException(
          SeedStepException.Step.SIMULATION,
          SimulationModel.DEFAULT_SIMULATION_ID,
          "Failed to read the default simulation",
          e);
    }

    if (existing.isPresent()) {
      log.info(
          "Skip seed simulation since there is already one simulation ({})",
          existing.get().effectiveId());
      return false;
    }

    SeedTemplate template;
    try {
      template = templatePort.load(templateName);
    } catch (SeedException e) {
      log.error("Failed to seed default simulations: cannot load template {}", templateName, e);
      throw e;
    }

    for (SimulationModel simulation : template.getSimulations()) {
      try {
        simulationPort.createSimulation(simulation);
      } catch (RuntimeException e) {
        log.error("Failed to seed default simulation {}", simulation.effectiveId(), e);
        throw new SeedStepException(
            SeedStepException.Step.SIMULATION,
            simulation.effectiveId(),
            "Failed to seed default simulation " + simulation.effectiveId(),
            e);
      }
    }

    log.info("Seeded {} simulation(s) from template {}", template.getSimulations().size(), templateName);
    return true;
  }
}
