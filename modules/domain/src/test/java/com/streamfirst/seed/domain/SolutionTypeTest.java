package com.streamfirst.seed.domain;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SolutionTypeTest {

    @ParameterizedTest
    @ValueSource(strings = {"devicesimulation", "DeviceSimulation", "devicesimulation-nohub", "  DEVICESIMULATION "})
    void deviceSimulationPrefixIgnoresCaseAndWhitespace(String value) {
        assertThat(SolutionType.fromConfig(value)).isEqualTo(SolutionType.DEVICE_SIMULATION);
        assertThat(SolutionType.fromConfig(value).seedsGroupsAndRules()).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"remotemonitoring", "RemoteMonitoring", "simulation", "device-simulation"})
    void everythingElseIsRemoteMonitoring(String value) {
        assertThat(SolutionType.fromConfig(value)).isEqualTo(SolutionType.REMOTE_MONITORING);
        assertThat(SolutionType.fromConfig(value).seedsGroupsAndRules()).isTrue();
    }
}
