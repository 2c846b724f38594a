package com.libragraph.keeper.core.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;

import java.util.Map;

/**
 * Builds the MicroProfile {@link Config} used for option overrides and service env lookups.
 */
public final class EnvironmentConfig {

    private EnvironmentConfig() {
    }

    /**
     * Environment variables, system properties and {@code META-INF/microprofile-config.properties}.
     */
    public static Config fromEnvironment() {
        return new SmallRyeConfigBuilder()
                .addDefaultSources()
                .build();
    }

    /** Fixed key/value configuration, mainly for tests and embedded use. */
    public static Config fromMap(Map<String, String> values) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(values, "keeper-in-memory", 500))
                .build();
    }
}
