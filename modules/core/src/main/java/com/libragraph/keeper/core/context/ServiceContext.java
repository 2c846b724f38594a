package com.libragraph.keeper.core.context;

import com.libragraph.keeper.core.config.EnvironmentConfig;
import com.libragraph.keeper.core.logging.ServiceLogger;
import com.libragraph.keeper.core.telemetry.Telemetry;
import com.libragraph.keeper.types.ServiceIdentity;
import com.libragraph.keeper.util.EnvKeys;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.propagation.ContextPropagators;
import org.eclipse.microprofile.config.Config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable execution context handed to every {@link com.libragraph.keeper.core.service.Service}
 * lifecycle call.
 *
 * <p>Each {@code with*} method returns a new context; the receiver is unchanged, so a
 * child sees its parent's bindings while the parent never sees the child's.
 * The supervisor rebuilds the same decorations for every attempt.
 */
public final class ServiceContext {

    private final ServiceIdentity identity;
    private final String envPrefix;
    private final ServiceLogger logger;
    private final Telemetry telemetry;
    private final Lifetime lifetime;
    private final Config config;

    private ServiceContext(ServiceIdentity identity, String envPrefix, ServiceLogger logger,
                           Telemetry telemetry, Lifetime lifetime, Config config) {
        this.identity = identity;
        this.envPrefix = envPrefix;
        this.logger = logger;
        this.telemetry = telemetry;
        this.lifetime = lifetime;
        this.config = config;
    }

    /**
     * Root context: no identity, no env prefix, the default logger, no-op telemetry
     * and configuration read from the process environment.
     */
    public static ServiceContext root(Lifetime lifetime) {
        return root(lifetime, EnvironmentConfig.fromEnvironment());
    }

    public static ServiceContext root(Lifetime lifetime, Config config) {
        return new ServiceContext(ServiceIdentity.of("", "", ""), "", ServiceLogger.defaultLogger(),
                Telemetry.noop(), Objects.requireNonNull(lifetime, "lifetime cannot be null"),
                Objects.requireNonNull(config, "config cannot be null"));
    }

    // -- decoration --

    public ServiceContext withIdentity(ServiceIdentity identity) {
        return new ServiceContext(Objects.requireNonNull(identity), envPrefix, logger, telemetry, lifetime, config);
    }

    public ServiceContext withEnvPrefix(String envPrefix) {
        return new ServiceContext(identity, Objects.requireNonNull(envPrefix), logger, telemetry, lifetime, config);
    }

    /** A null logger keeps the current one. */
    public ServiceContext withLogger(ServiceLogger logger) {
        if (logger == null) {
            return this;
        }
        return new ServiceContext(identity, envPrefix, logger, telemetry, lifetime, config);
    }

    public ServiceContext withTelemetry(Telemetry telemetry) {
        return new ServiceContext(identity, envPrefix, logger, Objects.requireNonNull(telemetry), lifetime, config);
    }

    public ServiceContext withLifetime(Lifetime lifetime) {
        return new ServiceContext(identity, envPrefix, logger, telemetry, Objects.requireNonNull(lifetime), config);
    }

    // -- identity --

    public ServiceIdentity identity() {
        return identity;
    }

    public String name() {
        return identity.name();
    }

    public String namespace() {
        return identity.namespace();
    }

    public String version() {
        return identity.version();
    }

    // -- ambient handles --

    public ServiceLogger logger() {
        return logger;
    }

    public Telemetry telemetry() {
        return telemetry;
    }

    public Tracer tracer() {
        return telemetry.tracer();
    }

    public Meter meter() {
        return telemetry.meter();
    }

    public ContextPropagators propagators() {
        return telemetry.propagators();
    }

    public Config config() {
        return config;
    }

    // -- cancellation --

    public Lifetime lifetime() {
        return lifetime;
    }

    public boolean isCancelled() {
        return lifetime.isCancelled();
    }

    /**
     * Blocks until the context is cancelled, then throws the cancellation error.
     * Meant as the last statement of {@code Service.run}.
     */
    public void awaitCancellation() throws InterruptedException {
        lifetime.await();
        throw Lifetime.cancellation();
    }

    /**
     * Sleeps for {@code duration} unless cancelled first.
     *
     * @return true if the context was cancelled
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        return lifetime.await(duration);
    }

    // -- environment --

    /** Env prefix for this service, normalised and ending in {@code _}, or empty. */
    public String envPrefix() {
        return envPrefix;
    }

    /**
     * Returns the value of {@code <prefix><key>} (normalised), or the empty string.
     */
    public String getEnv(String key) {
        return lookupEnv(key).orElse("");
    }

    public Optional<String> lookupEnv(String key) {
        return config.getOptionalValue(envKey(key), String.class);
    }

    /**
     * Reads {@code <prefix><key>} converted with the MicroProfile Config converters.
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public <T> Optional<T> getEnv(String key, Class<T> type) {
        return config.getOptionalValue(envKey(key), type);
    }

    public String envKey(String key) {
        return EnvKeys.normalize(envPrefix + key);
    }

    @Override
    public String toString() {
        return "ServiceContext[" + identity + ", envPrefix=" + envPrefix
                + ", cancelled=" + lifetime.isCancelled() + "]";
    }
}
