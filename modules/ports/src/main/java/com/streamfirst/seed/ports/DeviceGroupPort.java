package com.streamfirst.seed.ports;

import com.streamfirst.seed.domain.DeviceGroup;
import com.streamfirst.seed.domain.Version;

import java.util.Optional;

/**
 * Port for the device group collection of the storage service.
 */
public interface DeviceGroupPort {

    /**
     * Creates or replaces a device group.
     *
     * @param groupId the id to store the group under
     * @param group the group definition
     * @param expected the version the stored group must have; {@link Version#ANY} overwrites
     * @throws com.streamfirst.seed.domain.VersionConflictException if the stored version differs
     */
    void upsertGroup(String groupId, DeviceGroup group, Version expected);

    /**
     * Looks up a device group by id.
     */
    Optional<DeviceGroup> getGroup(String groupId);
}
