package com.streamfirst.seed.domain;

import java.util.List;

/**
 * Data-quality findings for a seed template. Findings are warnings; they never stop seeding.
 *
 * @param duplicateGroupIds group ids declared more than once, each listed once
 * @param duplicateRuleIds rule ids declared more than once, each listed once
 * @param danglingRules rules whose group id does not name a declared group
 */
public record TemplateReport(List<String> duplicateGroupIds, List<String> duplicateRuleIds,
                             List<Rule> danglingRules) {
    public TemplateReport {
        duplicateGroupIds = List.copyOf(duplicateGroupIds);
        duplicateRuleIds = List.copyOf(duplicateRuleIds);
        danglingRules = List.copyOf(danglingRules);
    }

    public boolean isClean() {
        return duplicateGroupIds.isEmpty() && duplicateRuleIds.isEmpty() && danglingRules.isEmpty();
    }
}
