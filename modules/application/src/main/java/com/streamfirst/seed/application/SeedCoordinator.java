package com.streamfirst.seed.application;

import com.streamfirst.seed.domain.SeedOutcome;
import com.streamfirst.seed.domain.SeedStepException;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.ports.KeyValuePort;
import com.streamfirst.seed.ports.MutexPort;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds the default resources exactly once across every instance of the application.
 *
 * <p>Instances race for a shared mutex; the winner checks the completion flag, runs the {@link
 * SeedSequence} if the flag is missing, then sets the flag. Losers and later starters skip. The
 * mutex is released on every path once acquired, failures included, so a failed seed can be retried
 * as soon as another instance starts. A seed that fails leaves the flag unset.
 */
@Slf4j
@RequiredArgsConstructor
public class SeedCoordinator {

  public static final String SEED_COLLECTION_ID = "solution-settings";
  public static final String MUTEX_KEY = "seedMutex";
  public static final String COMPLETED_FLAG_KEY = "seedCompleted";
  public static final String COMPLETED_FLAG_VALUE = "true";
  public static final Duration MUTEX_TIMEOUT = Duration.ofMinutes(5);

  private final SeedSettings settings;
  private final MutexPort mutexPort;
  private final KeyValuePort keyValuePort;
  private final SeedSequence seedSequence;

  /**
   * Seeds if no instance has done so yet.
   *
   * @return which path was taken
   * @throws com.streamfirst.seed.domain.SeedException if seeding was attempted and failed
   */
  public SeedOutcome trySeed() {
    if (!settings.isConfigured()) {
      log.info("Seed skipped (no template configured)");
      return SeedOutcome.NOT_CONFIGURED;
    }

    if (!mutexPort.tryEnter(SEED_COLLECTION_ID, MUTEX_KEY, MUTEX_TIMEOUT)) {
      log.info("Seed skipped (conflict)");
      return SeedOutcome.CONTENDED;
    }

    try {
      if (isCompleted()) {
        log.info("Seed skipped (completed)");
        return SeedOutcome.ALREADY_COMPLETED;
      }

      log.info("Seed begin: template {} for {}", settings.templateName(), settings.solutionType());
      seedSequence.run(settings);
      log.info("Seed end");

      markCompleted();
      return SeedOutcome.SEEDED;
    } finally {
      release();
    }
  }

  private boolean isCompleted() {
    try {
      return keyValuePort.exists(SEED_COLLECTION_ID, COMPLETED_FLAG_KEY);
    } catch (RuntimeException e) {
      log.error("Failed to read seed completion flag", e);
      throw new SeedStepException(
          SeedStepException.Step.COMPLETION_FLAG,
          COMPLETED_FLAG_KEY,
          "Failed to read seed completion flag",
          e);
    }
  }

  private void markCompleted() {
    try {
      keyValuePort.upsert(SEED_COLLECTION_ID, COMPLETED_FLAG_KEY, COMPLETED_FLAG_VALUE, Version.ANY);
    } catch (RuntimeException e) {
      log.error("Failed to set seed completion flag", e);
      throw new SeedStepException(
          SeedStepException.Step.COMPLETION_FLAG,
          COMPLETED_FLAG_KEY,
          "Failed to set seed completion flag",
          e);
    }
  }

  // A failed release must not hide the outcome of the seed; the lease expires on its own.
  private void release() {
    try {
      mutexPort.leave(SEED_COLLECTION_ID, MUTEX_KEY);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to release seed mutex, it will expire after {}", MUTEX_TIMEOUT, e);
    }
  }
}
