package com.streamfirst.seed.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * The declarative seed payload: the device groups, rules and simulations created the first
 * time a deployment starts. Lists keep the order in which the template declares them, which is
 * also the order they are written in.
 */
@Value
public class SeedTemplate {
    /** Template name the payload was loaded from */
    @NonNull String name;

    @NonNull List<DeviceGroup> groups;

    @NonNull List<Rule> rules;

    @NonNull List<SimulationModel> simulations;

    public SeedTemplate(@NonNull String name, List<DeviceGroup> groups, List<Rule> rules,
                        List<SimulationModel> simulations) {
        this.name = name;
        this.groups = groups == null ? List.of() : List.copyOf(groups);
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.simulations = simulations == null ? List.of() : List.copyOf(simulations);
    }

    @Override
    public String toString() {
        return "SeedTemplate{name='" + name + "', groups=" + groups.size()
            + ", rules=" + rules.size() + ", simulations=" + simulations.size() + '}';
    }
}
