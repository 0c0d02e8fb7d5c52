package com.streamfirst.seed.adapters;

import com.streamfirst.seed.domain.DeviceGroup;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.ports.DeviceGroupPort;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of DeviceGroupPort for testing and development.
 */
@Slf4j
public class InMemoryDeviceGroupAdapter extends InMemoryCollection<DeviceGroup> implements DeviceGroupPort {

    public InMemoryDeviceGroupAdapter() {
        super("devicegroups");
    }

    @Override
    public void upsertGroup(String groupId, DeviceGroup group, Version expected) {
        put(groupId, group, expected);
        log.info("Upserted device group {} ({})", groupId, group.displayName());
    }

    @Override
    public Optional<DeviceGroup> getGroup(String groupId) {
        return find(groupId);
    }

    /**
     * All stored groups in first-write order.
     */
    public List<DeviceGroup> listGroups() {
        return values();
    }
}
