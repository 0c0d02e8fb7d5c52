package com.streamfirst.seed.application;

import com.streamfirst.seed.domain.SolutionType;
import java.util.Objects;

/**
 * What to seed: the template to load and the kind of solution it is seeded for.
 *
 * @param templateName template name without extension; null or blank disables seeding
 * @param solutionType selects which parts of the template are seeded
 */
public record SeedSettings(String templateName, SolutionType solutionType) {
  public SeedSettings {
    Objects.requireNonNull(solutionType, "Solution type cannot be null");
    templateName = templateName == null ? "" : templateName.trim();
  }

  public static SeedSettings disabled() {
    return new SeedSettings("", SolutionType.REMOTE_MONITORING);
  }

  public boolean isConfigured() {
    return !templateName.isEmpty();
  }
}
