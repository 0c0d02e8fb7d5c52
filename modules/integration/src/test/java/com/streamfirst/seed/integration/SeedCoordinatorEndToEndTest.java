package com.streamfirst.seed.integration;

import com.streamfirst.seed.adapters.FileSystemTemplateAdapter;
import com.streamfirst.seed.adapters.InMemoryDeviceGroupAdapter;
import com.streamfirst.seed.adapters.InMemoryKeyValueAdapter;
import com.streamfirst.seed.adapters.InMemoryRuleAdapter;
import com.streamfirst.seed.adapters.InMemorySimulationAdapter;
import com.streamfirst.seed.adapters.KeyValueMutexAdapter;
import com.streamfirst.seed.application.SeedCoordinator;
import com.streamfirst.seed.application.SeedSequence;
import com.streamfirst.seed.application.SeedSettings;
import com.streamfirst.seed.application.SimulationSeeder;
import com.streamfirst.seed.application.TemplateValidator;
import com.streamfirst.seed.domain.DeviceGroup;
import com.streamfirst.seed.domain.InvalidTemplateException;
import com.streamfirst.seed.domain.Rule;
import com.streamfirst.seed.domain.SeedOutcome;
import com.streamfirst.seed.domain.SeedStepException;
import com.streamfirst.seed.domain.SimulationModel;
import com.streamfirst.seed.domain.SolutionType;
import com.streamfirst.seed.domain.TemplateNotFoundException;
import com.streamfirst.seed.domain.VersionedValue;
import com.streamfirst.seed.ports.TemplatePort;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the seed protocol: templates read from disk, coordination records in a shared
 * key/value store, and resources written to in-memory stores. Each {@link SeedCoordinator} built by
 * {@link #instance(String)} stands for one application instance with its own mutex holder id.
 */
@Slf4j
public class SeedCoordinatorEndToEndTest {

    private static final Path DATA_DIRECTORY = Path.of("src/test/resources/data");
    private static final String TEMPLATE = "remote-monitoring";

    // Shared "remote" state
    private ManualClock clock;
    private InMemoryKeyValueAdapter keyValueStore;
    private InMemoryDeviceGroupAdapter groupStore;
    private InMemoryRuleAdapter ruleStore;
    private InMemorySimulationAdapter simulationStore;
    private TemplatePort templateLoader;

    @BeforeEach
    void setupStores() {
        clock = new ManualClock(Instant.parse("2024-06-01T08:00:00Z"));
        keyValueStore = new InMemoryKeyValueAdapter(clock);
        groupStore = new InMemoryDeviceGroupAdapter();
        ruleStore = new InMemoryRuleAdapter();
        simulationStore = new InMemorySimulationAdapter();
        templateLoader = new FileSystemTemplateAdapter(DATA_DIRECTORY);
    }

    /**
     * A fresh deployment gets every group, rule and the default simulation of the template, and the
     * completion flag is set to "true".
     */
    @Test
    void testFirstRunSeedsEverything() {
        SeedOutcome outcome = instance("a").trySeed();

        assertEquals(SeedOutcome.SEEDED, outcome);
        assertEquals(List.of("default_Chillers", "default_Elevators", "default_Trucks"),
            groupStore.listGroups().stream().map(DeviceGroup::id).toList());
        assertEquals(List.of("default_Chiller_Pressure_High", "default_Elevator_Vibration_Stopped"),
            ruleStore.listRules().stream().map(Rule::id).toList());

        Rule pressure = ruleStore.getRule("default_Chiller_Pressure_High").orElseThrow();
        assertEquals("default_Chillers", pressure.groupId());
        assertEquals("Critical", pressure.attributes().get("Severity"));

        SimulationModel simulation = simulationStore.getDefaultSimulation().orElseThrow();
        assertEquals(Boolean.TRUE, simulation.attributes().get("Enabled"));

        assertEquals("true", completionFlag());
        assertFalse(keyValueStore.exists(SeedCoordinator.SEED_COLLECTION_ID, SeedCoordinator.MUTEX_KEY),
            "Mutex should be released after seeding");
    }

    /**
     * Once the flag is set, further instances write nothing to the resource stores.
     */
    @Test
    void testCompletionFlagGatesLaterInstances() {
        instance("a").trySeed();
        long groupWrites = groupStore.getWriteAttempts();
        long ruleWrites = ruleStore.getWriteAttempts();
        long simulationWrites = simulationStore.getWriteAttempts();

        assertEquals(SeedOutcome.ALREADY_COMPLETED, instance("b").trySeed());
        assertEquals(SeedOutcome.ALREADY_COMPLETED, instance("c").trySeed());

        assertEquals(groupWrites, groupStore.getWriteAttempts());
        assertEquals(ruleWrites, ruleStore.getWriteAttempts());
        assertEquals(simulationWrites, simulationStore.getWriteAttempts());
    }

    /**
     * Running the seed sequence twice leaves the stores exactly as one run does.
     */
    @Test
    void testSeedSequenceIsIdempotent() {
        SeedSequence sequence = sequence(templateLoader);
        SeedSettings settings = new SeedSettings(TEMPLATE, SolutionType.REMOTE_MONITORING);

        sequence.run(settings);
        List<DeviceGroup> groupsAfterFirst = groupStore.listGroups();
        List<Rule> rulesAfterFirst = ruleStore.listRules();
        List<SimulationModel> simulationsAfterFirst = simulationStore.listSimulations();

        sequence.run(settings);

        assertEquals(groupsAfterFirst, groupStore.listGroups());
        assertEquals(rulesAfterFirst, ruleStore.listRules());
        assertEquals(simulationsAfterFirst, simulationStore.listSimulations());
        assertEquals(1, simulationStore.getWriteCount(), "Default simulation must be created once");
    }

    /**
     * If the second of three groups fails, the first stays written, the third and all rules are never
     * attempted, and the flag stays unset. A later instance then completes the seed.
     */
    @Test
    void testFailureAbortsAndNextInstanceRetries() {
        groupStore.failOnWrite(2);

        SeedStepException failure = assertThrows(SeedStepException.class, () -> instance("a").trySeed());

        assertEquals(SeedStepException.Step.GROUP, failure.getStep());
        assertEquals("default_Elevators", failure.getEntityId());
        assertEquals(List.of("default_Chillers"),
            groupStore.listGroups().stream().map(DeviceGroup::id).toList());
        assertEquals(2, groupStore.getWriteAttempts());
        assertEquals(0, ruleStore.getWriteAttempts());
        assertEquals(0, simulationStore.getWriteAttempts());
        assertNull(completionFlag());

        assertEquals(SeedOutcome.SEEDED, instance("b").trySeed());
        assertEquals(3, groupStore.size());
        assertEquals(2, ruleStore.size());
        assertEquals("true", completionFlag());
    }

    /**
     * An instance that dies while holding the mutex blocks others only until the lease expires.
     */
    @Test
    void testAbandonedMutexIsReclaimedAfterLease() {
        KeyValueMutexAdapter crashed = new KeyValueMutexAdapter(keyValueStore, clock, "crashed");
        assertTrue(crashed.tryEnter(SeedCoordinator.SEED_COLLECTION_ID, SeedCoordinator.MUTEX_KEY,
            SeedCoordinator.MUTEX_TIMEOUT));

        assertEquals(SeedOutcome.CONTENDED, instance("b").trySeed());
        assertEquals(0, groupStore.getWriteAttempts());

        clock.advance(Duration.ofMinutes(4));
        assertEquals(SeedOutcome.CONTENDED, instance("b").trySeed());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(SeedOutcome.SEEDED, instance("b").trySeed());
    }

    /**
     * A device simulation deployment only creates the default simulation.
     */
    @Test
    void testDeviceSimulationSolutionSeedsSimulationOnly() {
        SeedOutcome outcome = instance("a", new SeedSettings(TEMPLATE, SolutionType.fromConfig("DeviceSimulation")))
            .trySeed();

        assertEquals(SeedOutcome.SEEDED, outcome);
        assertEquals(0, groupStore.getWriteAttempts());
        assertEquals(0, ruleStore.getWriteAttempts());
        assertTrue(simulationStore.getDefaultSimulation().isPresent());
        assertEquals("true", completionFlag());
    }

    /**
     * An existing default simulation is left alone even though the flag was never set.
     */
    @Test
    void testExistingDefaultSimulationIsKept() {
        SimulationModel existing = new SimulationModel("1", Map.of("Name", "user defined"));
        simulationStore.createSimulation(existing);

        assertEquals(SeedOutcome.SEEDED, instance("a").trySeed());

        assertEquals(List.of(existing), simulationStore.listSimulations());
        assertEquals(3, groupStore.size());
    }

    /**
     * Duplicate ids and dangling group references are only warnings: everything is still written,
     * in template order.
     */
    @Test
    void testDataQualityIssuesDoNotStopSeeding() {
        SeedOutcome outcome = instance("a", new SeedSettings("dirty", SolutionType.REMOTE_MONITORING)).trySeed();

        assertEquals(SeedOutcome.SEEDED, outcome);
        assertEquals(2, groupStore.getWriteAttempts());
        assertEquals("Floor1 again", groupStore.getGroup("g1").orElseThrow().displayName());
        assertTrue(ruleStore.getRule("r2").isPresent());
        assertEquals("true", completionFlag());
    }

    /**
     * Template errors are fatal and leave no trace in any store.
     */
    @Test
    void testTemplateErrorsAreFatal() {
        assertThrows(TemplateNotFoundException.class,
            () -> instance("a", new SeedSettings("missing", SolutionType.REMOTE_MONITORING)).trySeed());

        InvalidTemplateException invalid = assertThrows(InvalidTemplateException.class,
            () -> instance("a", new SeedSettings("truncated", SolutionType.REMOTE_MONITORING)).trySeed());
        assertNotNull(invalid.getCause(), "Parse error should be attached");

        assertEquals(0, groupStore.getWriteAttempts() + ruleStore.getWriteAttempts()
            + simulationStore.getWriteAttempts());
        assertNull(completionFlag());
    }

    /**
     * Without a template name nothing happens, not even a mutex acquisition.
     */
    @Test
    void testUnconfiguredTemplateDoesNothing() {
        assertEquals(SeedOutcome.NOT_CONFIGURED, instance("a", SeedSettings.disabled()).trySeed());
        assertEquals(0, keyValueStore.getWriteCount());
    }

    private String completionFlag() {
        return keyValueStore.get(SeedCoordinator.SEED_COLLECTION_ID, SeedCoordinator.COMPLETED_FLAG_KEY)
            .map(VersionedValue::data)
            .orElse(null);
    }

    private SeedCoordinator instance(String holderId) {
        return instance(holderId, new SeedSettings(TEMPLATE, SolutionType.REMOTE_MONITORING));
    }

    private SeedCoordinator instance(String holderId, SeedSettings settings) {
        return new SeedCoordinator(settings, new KeyValueMutexAdapter(keyValueStore, clock, holderId),
            keyValueStore, sequence(templateLoader));
    }

    private SeedSequence sequence(TemplatePort templates) {
        return new SeedSequence(templates, groupStore, ruleStore,
            new SimulationSeeder(templates, simulationStore), new TemplateValidator());
    }
}
