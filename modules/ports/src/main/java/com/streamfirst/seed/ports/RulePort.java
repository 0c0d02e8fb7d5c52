package com.streamfirst.seed.ports;

import com.streamfirst.seed.domain.Rule;
import com.streamfirst.seed.domain.Version;

import java.util.Optional;

/**
 * Port for the rules collection of the telemetry service.
 */
public interface RulePort {

    /**
     * Creates or replaces a rule, keyed by its own id.
     *
     * @param rule the rule definition
     * @param expected the version the stored rule must have; {@link Version#ANY} overwrites
     * @throws com.streamfirst.seed.domain.VersionConflictException if the stored version differs
     */
    void upsertRule(Rule rule, Version expected);

    /**
     * Looks up a rule by id.
     */
    Optional<Rule> getRule(String ruleId);
}
