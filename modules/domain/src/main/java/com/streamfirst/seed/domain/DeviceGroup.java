package com.streamfirst.seed.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A default device group declared by a seed template.
 * Only the identity and display name are interpreted; everything else (conditions, etc.)
 * is carried through to the group store untouched.
 *
 * @param id unique key of the group
 * @param displayName human readable name
 * @param attributes remaining template fields, in template order
 */
public record DeviceGroup(String id, String displayName, Map<String, Object> attributes) {
    public DeviceGroup {
        Objects.requireNonNull(id, "Group id cannot be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static DeviceGroup of(String id, String displayName) {
        return new DeviceGroup(id, displayName, Map.of());
    }

    @Override
    public String toString() {
        return "DeviceGroup{id='" + id + "', displayName='" + displayName + "'}";
    }
}
