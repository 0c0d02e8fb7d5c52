package com.streamfirst.seed.application;

import com.streamfirst.seed.domain.DeviceGroup;
import com.streamfirst.seed.domain.Rule;
import com.streamfirst.seed.domain.SeedStepException;
import com.streamfirst.seed.domain.SeedTemplate;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.ports.DeviceGroupPort;
import com.streamfirst.seed.ports.RulePort;
import com.streamfirst.seed.ports.TemplatePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the default resources of a template. Every write overwrites whatever is stored, so the
 * sequence can be rerun from the start after a failure. The first failed write aborts the sequence;
 * writes already applied are left in place.
 */
@Slf4j
@RequiredArgsConstructor
public class SeedSequence {

  private final TemplatePort templatePort;
  private final DeviceGroupPort deviceGroupPort;
  private final RulePort rulePort;
  private final SimulationSeeder simulationSeeder;
  private final TemplateValidator templateValidator;

  /**
   * Runs the sequence for the given settings. Device simulation solutions have no groups or rules,
   * so only the simulation step runs for them.
   *
   * @param settings the configured template and solution type
   * @throws com.streamfirst.seed.domain.SeedException on the first failed step
   */
  public void run(SeedSettings settings) {
    if (settings.solutionType().seedsGroupsAndRules()) {
      SeedTemplate template = templatePort.load(settings.templateName());
      templateValidator.validate(template);

      seedGroups(template);
      seedRules(template);
    } else {
      log.debug("Solution type {} has no groups or rules to seed", settings.solutionType());
    }

    simulationSeeder.seed(settings.templateName());
  }

  private void seedGroups(SeedTemplate template) {
    for (DeviceGroup group : template.getGroups()) {
      try {
        deviceGroupPort.upsertGroup(group.id(), group, Version.ANY);
      } catch (RuntimeException e) {
        log.error("Failed to seed default group {} ({})", group.displayName(), group.id(), e);
        throw new SeedStepException(
            SeedStepException.Step.GROUP,
            group.id(),
            "Failed to seed default group " + group.displayName() + " (" + group.id() + ")",
            e);
      }
    }
    log.debug("Seeded {} device group(s)", template.getGroups().size());
  }

  private void seedRules(SeedTemplate template) {
    for (Rule rule : template.getRules()) {
      try {
        rulePort.upsertRule(rule, Version.ANY);
      } catch (RuntimeException e) {
        log.error("Failed to seed default rule {} ({})", rule.description(), rule.id(), e);
        throw new SeedStepException(
            SeedStepException.Step.RULE,
            rule.id(),
            "Failed to seed default rule " + rule.description() + " (" + rule.id() + ")",
            e);
      }
    }
    log.debug("Seeded {} rule(s)", template.getRules().size());
  }
}
