package com.streamfirst.seed.application;

import com.streamfirst.seed.domain.DeviceGroup;
import com.streamfirst.seed.domain.Rule;
import com.streamfirst.seed.domain.SeedTemplate;
import com.streamfirst.seed.domain.TemplateReport;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks a template for duplicate ids and rules pointing at undeclared groups. Findings are logged
 * as warnings and returned; they never stop seeding.
 */
@Slf4j
public class TemplateValidator {

  public TemplateReport validate(SeedTemplate template) {
    List<String> duplicateGroupIds =
        duplicates(template.getGroups().stream().map(DeviceGroup::id).toList());
    List<String> duplicateRuleIds =
        duplicates(template.getRules().stream().map(Rule::id).toList());

    Set<String> groupIds = new HashSet<>();
    template.getGroups().forEach(group -> groupIds.add(group.id()));
    List<Rule> danglingRules =
        template.getRules().stream().filter(rule -> !groupIds.contains(rule.groupId())).toList();

    if (!duplicateGroupIds.isEmpty()) {
      log.warn("Found duplicated group ID in template {}: {}", template.getName(), duplicateGroupIds);
    }
    if (!duplicateRuleIds.isEmpty()) {
      log.warn("Found duplicated rule ID in template {}: {}", template.getName(), duplicateRuleIds);
    }
    if (!danglingRules.isEmpty()) {
      log.warn("Invalid group ID found in rules of template {}: {}", template.getName(), danglingRules);
    }

    return new TemplateReport(duplicateGroupIds, duplicateRuleIds, danglingRules);
  }

  private static List<String> duplicates(List<String> ids) {
    Set<String> seen = new HashSet<>();
    Set<String> repeated = new LinkedHashSet<>();
    for (String id : ids) {
      if (!seen.add(id)) {
        repeated.add(id);
      }
    }
    return new ArrayList<>(repeated);
  }
}
