package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.config.EnvironmentConfig;
import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.core.context.Lifetime;
import com.libragraph.keeper.core.error.Errors;
import com.libragraph.keeper.core.logging.JBossLoggerProvider;
import com.libragraph.keeper.core.logging.LoggerProvider;
import com.libragraph.keeper.core.service.Service;
import com.libragraph.keeper.core.telemetry.OpenTelemetrySdkInitializer;
import com.libragraph.keeper.core.telemetry.TelemetryInitializer;
import com.libragraph.keeper.util.Durations;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for running services under supervision.
 *
 * <pre>{@code
 * Supervisor.builder()
 *         .options(SupervisorOptions.builder().graceCount(5).build())
 *         .build()
 *         .runAndExit(new MyService());
 * }</pre>
 *
 * <p>The blocking {@code run*} methods throw the terminal
 * {@link com.libragraph.keeper.core.error.SupervisorException} of a failed run and return
 * the report otherwise. The {@code *AndExit} variants are meant for {@code main}: they
 * cancel on JVM shutdown, print a failure and terminate the process.
 */
public final class Supervisor {

    private static final Logger log = Logger.getLogger(Supervisor.class);

    private final SupervisorOptions options;
    private final TelemetryInitializer telemetry;
    private final LoggerProvider loggerProvider;
    private final Config config;
    private final List<SupervisionListener> listeners;
    private final ProcessExit exit;
    private final PrintStream err;

    private Supervisor(Builder builder) {
        this.options = builder.options;
        this.telemetry = builder.telemetry;
        this.loggerProvider = builder.loggerProvider;
        this.config = builder.config != null ? builder.config : EnvironmentConfig.fromEnvironment();
        this.listeners = List.copyOf(builder.listeners);
        this.exit = builder.exit;
        this.err = builder.err;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A supervisor with default options, OpenTelemetry from the environment and jboss-logging. */
    public static Supervisor create() {
        return builder().build();
    }

    public SupervisionReport run(Service service) {
        return run(service, Lifetime.create());
    }

    public SupervisionReport run(Service service, Lifetime lifetime) {
        return runGroup(List.of(Objects.requireNonNull(service, "service")), lifetime);
    }

    public SupervisionReport runGroup(List<? extends Service> services) {
        return runGroup(services, Lifetime.create());
    }

    /**
     * Runs all services until the first terminates, then stops the rest.
     * Cancelling {@code lifetime} stops every service and yields a successful report.
     */
    public SupervisionReport runGroup(List<? extends Service> services, Lifetime lifetime) {
        SupervisionReport report = new ServiceGroup(services, options, config, loggerProvider, telemetry, listeners)
                .run(lifetime);
        if (report.error() != null) {
            throw report.error();
        }
        return report;
    }

    public void runAndExit(Service service) {
        runGroupAndExit(List.of(Objects.requireNonNull(service, "service")));
    }

    /**
     * Runs the group and, on failure, prints the error and exits with status 1. Returns
     * normally when the group stops cleanly.
     */
    public void runGroupAndExit(List<? extends Service> services) {
        Lifetime lifetime = Lifetime.create();
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.debug("JVM shutdown requested, cancelling services");
            lifetime.cancel();
            try {
                if (!done.await(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warnf("Services still running after %s, exiting anyway", Durations.format(options.shutdownTimeout()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "keeper-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        Throwable failure = null;
        try {
            runGroup(services, lifetime);
        } catch (RuntimeException | Error e) {
            failure = e;
        } finally {
            done.countDown();
            removeHook(hook);
        }

        if (failure == null) {
            return;
        }
        if (Errors.isCancellation(failure)) {
            exit.exit(0);
            return;
        }
        new ErrorPrinter(err).print(failure);
        exit.exit(1);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, shutdown hook stays registered");
        }
    }

    public static final class Builder {

        private SupervisorOptions options = SupervisorOptions.defaults();
        private TelemetryInitializer telemetry = new OpenTelemetrySdkInitializer();
        private LoggerProvider loggerProvider = new JBossLoggerProvider();
        private Config config;
        private final List<SupervisionListener> listeners = new ArrayList<>();
        private ProcessExit exit = ProcessExit.SYSTEM;
        private PrintStream err = System.err;

        private Builder() {
        }

        /** Template options; environment overrides are applied per service on top. */
        public Builder options(SupervisorOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder telemetry(TelemetryInitializer telemetry) {
            this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
            return this;
        }

        public Builder loggerProvider(LoggerProvider loggerProvider) {
            this.loggerProvider = Objects.requireNonNull(loggerProvider, "loggerProvider");
            return this;
        }

        /** Source for option overrides and service env lookups. Defaults to the process environment. */
        public Builder config(Config config) {
            this.config = config;
            return this;
        }

        public Builder listener(SupervisionListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder exit(ProcessExit exit) {
            this.exit = Objects.requireNonNull(exit, "exit");
            return this;
        }

        public Builder errorStream(PrintStream err) {
            this.err = Objects.requireNonNull(err, "err");
            return this;
        }

        public Supervisor build() {
            return new Supervisor(this);
        }
    }
}
