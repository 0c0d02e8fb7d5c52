package com.streamfirst.seed.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A default alerting rule declared by a seed template.
 *
 * @param id unique key of the rule
 * @param description human readable description
 * @param groupId the device group the rule applies to; may be null in a malformed template
 * @param attributes remaining template fields (conditions, severity, actions, ...)
 */
public record Rule(String id, String description, String groupId, Map<String, Object> attributes) {
    public Rule {
        Objects.requireNonNull(id, "Rule id cannot be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Rule of(String id, String description, String groupId) {
        return new Rule(id, description, groupId, Map.of());
    }

    @Override
    public String toString() {
        return "Rule{id='" + id + "', description='" + description + "', groupId='" + groupId + "'}";
    }
}
