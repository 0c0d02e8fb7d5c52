package com.streamfirst.seed.boot;

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
import com.streamfirst.seed.domain.SolutionType;
import com.streamfirst.seed.ports.DeviceGroupPort;
import com.streamfirst.seed.ports.KeyValuePort;
import com.streamfirst.seed.ports.MutexPort;
import com.streamfirst.seed.ports.RulePort;
import com.streamfirst.seed.ports.SimulationPort;
import com.streamfirst.seed.ports.TemplatePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.system.ApplicationHome;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the seed coordinator against in-memory stores and file system templates.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SeedProperties.class)
public class SeedAppConfiguration {

    static final String DATA_DIRECTORY_NAME = "data";

    // --- Adapter Beans ---

    @Bean
    public KeyValuePort keyValueStore() {
        log.info("Creating key/value store bean (in-memory)");
        return new InMemoryKeyValueAdapter();
    }

    @Bean
    public MutexPort seedMutex(KeyValuePort keyValueStore) {
        return new KeyValueMutexAdapter(keyValueStore);
    }

    @Bean
    public DeviceGroupPort deviceGroupStore() {
        log.info("Creating device group store bean (in-memory)");
        return new InMemoryDeviceGroupAdapter();
    }

    @Bean
    public RulePort ruleStore() {
        log.info("Creating rule store bean (in-memory)");
        return new InMemoryRuleAdapter();
    }

    @Bean
    public SimulationPort simulationStore() {
        log.info("Creating simulation store bean (in-memory)");
        return new InMemorySimulationAdapter();
    }

    @Bean
    public TemplatePort templateLoader(SeedProperties properties) {
        Path dataDirectory = properties.getDataDirectory() != null && !properties.getDataDirectory().isBlank()
            ? Path.of(properties.getDataDirectory())
            : new ApplicationHome(SeedApplication.class).getDir().toPath().resolve(DATA_DIRECTORY_NAME);
        log.info("Loading seed templates from {}", dataDirectory);
        return new FileSystemTemplateAdapter(dataDirectory);
    }

    // --- Application Service Beans ---

    @Bean
    public SeedSettings seedSettings(SeedProperties properties) {
        return new SeedSettings(properties.getTemplate(), SolutionType.fromConfig(properties.getSolutionType()));
    }

    @Bean
    public SeedSequence seedSequence(TemplatePort templateLoader, DeviceGroupPort deviceGroupStore,
                                     RulePort ruleStore, SimulationPort simulationStore) {
        return new SeedSequence(templateLoader, deviceGroupStore, ruleStore,
            new SimulationSeeder(templateLoader, simulationStore), new TemplateValidator());
    }

    @Bean
    public SeedCoordinator seedCoordinator(SeedSettings seedSettings, MutexPort seedMutex,
                                           KeyValuePort keyValueStore, SeedSequence seedSequence) {
        return new SeedCoordinator(seedSettings, seedMutex, keyValueStore, seedSequence);
    }

    // --- Startup ---

    @Bean
    public ApplicationRunner seedOnStartup(SeedProperties properties, SeedCoordinator seedCoordinator) {
        return args -> {
            if (!properties.isRunOnStartup()) {
                log.info("Seeding on startup is disabled");
                return;
            }
            var outcome = seedCoordinator.trySeed();
            log.info("Seed finished: {}", outcome);
        };
    }
}
