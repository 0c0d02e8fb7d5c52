package com.streamfirst.seed.adapters;

import com.streamfirst.seed.domain.Rule;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.ports.RulePort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of RulePort for testing and development.
 */
@Slf4j
public class InMemoryRuleAdapter extends InMemoryCollection<Rule> implements RulePort {

    public InMemoryRuleAdapter() {
        super("rules");
    }

    @Override
    public void upsertRule(Rule rule, Version expected) {
        put(rule.id(), rule, expected);
        log.info("Upserted rule {} ({})", rule.id(), rule.description());
    }

    @Override
    public Optional<Rule> getRule(String ruleId) {
        return find(ruleId);
    }

    public List<Rule> listRules() {
        return values();
    }
}
