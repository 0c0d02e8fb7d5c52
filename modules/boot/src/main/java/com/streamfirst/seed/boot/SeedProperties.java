package com.streamfirst.seed.boot;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Seed settings bound from the {@code seed.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "seed")
public class SeedProperties {

    /** Template to seed from, without the .json extension. Empty disables seeding. */
    private String template = "";

    /** Solution type; values starting with "devicesimulation" seed simulations only. */
    private String solutionType = "";

    /** Directory holding the templates. Defaults to "data" next to the application jar. */
    private String dataDirectory = "";

    /** Whether to attempt seeding when the application starts. */
    private boolean runOnStartup = true;
}
