package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.config.OptionsResolver;
import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.core.context.Lifetime;
import com.libragraph.keeper.core.context.ServiceContext;
import com.libragraph.keeper.core.error.ServiceValidationException;
import com.libragraph.keeper.core.logging.LoggerProvider;
import com.libragraph.keeper.core.service.Service;
import com.libragraph.keeper.core.telemetry.TelemetryException;
import com.libragraph.keeper.core.telemetry.TelemetryInitializer;
import com.libragraph.keeper.core.telemetry.TelemetrySession;
import com.libragraph.keeper.types.ServiceIdentity;
import com.libragraph.keeper.util.Durations;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Runs several services side by side, one supervision loop per service, and fails
 * fast: the first loop to terminate decides the result and cancels the others.
 *
 * <p>Identities are validated up front and every violation is reported at once;
 * no thread is started for an invalid group. Telemetry is initialised once for the
 * whole group and shut down when it returns.
 */
class ServiceGroup {

    private static final Logger log = Logger.getLogger(ServiceGroup.class);

    private final List<Service> services;
    private final SupervisorOptions template;
    private final Config config;
    private final LoggerProvider loggerProvider;
    private final TelemetryInitializer telemetry;
    private final List<SupervisionListener> listeners;

    ServiceGroup(List<? extends Service> services, SupervisorOptions template, Config config,
                 LoggerProvider loggerProvider, TelemetryInitializer telemetry,
                 List<SupervisionListener> listeners) {
        this.services = Collections.unmodifiableList(new ArrayList<>(services));
        this.template = template;
        this.config = config;
        this.loggerProvider = loggerProvider;
        this.telemetry = telemetry;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Blocks until the first member terminates and the rest have unwound.
     *
     * @return the report of the member that terminated first
     * @throws ServiceValidationException if identities are empty or duplicated
     * @throws TelemetryException         if telemetry cannot be initialised
     */
    SupervisionReport run(Lifetime parent) {
        List<ServiceIdentity> identities = validate(services);

        Lifetime lifetime = parent.child();
        ServiceContext root = ServiceContext.root(lifetime, config);
        if (identities.size() == 1) {
            root = root.withIdentity(identities.get(0));
        }

        TelemetrySession session = initTelemetry(root);
        try {
            return supervise(identities, session.context(), lifetime);
        } finally {
            lifetime.cancel();
            shutdownTelemetry(session);
        }
    }

    static List<ServiceIdentity> validate(List<Service> services) {
        if (services.isEmpty()) {
            throw new ServiceValidationException(List.of("no services to run"));
        }

        List<String> violations = new ArrayList<>();
        List<ServiceIdentity> identities = new ArrayList<>(services.size());
        Map<String, Integer> firstIndex = new HashMap<>();

        for (int i = 0; i < services.size(); i++) {
            Service svc = services.get(i);
            if (svc == null) {
                violations.add("service #" + i + " is null");
                continue;
            }
            ServiceIdentity id = ServiceIdentity.of(svc.name(), svc.namespace(), svc.version());
            identities.add(id);
            for (String v : id.violations()) {
                violations.add("service #" + i + ": " + v);
            }
            if (id.isValid()) {
                Integer previous = firstIndex.putIfAbsent(id.key(), i);
                if (previous != null) {
                    violations.add("service #" + i + ": duplicate service '" + id.key()
                            + "' (first declared as service #" + previous + ")");
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new ServiceValidationException(violations);
        }
        return identities;
    }

    private SupervisionReport supervise(List<ServiceIdentity> identities, ServiceContext base, Lifetime lifetime) {
        OptionsResolver resolver = new OptionsResolver(config);
        List<SupervisionLoop> loops = new ArrayList<>(services.size());
        Duration shutdownTimeout = Duration.ZERO;

        for (int i = 0; i < services.size(); i++) {
            ServiceIdentity id = identities.get(i);
            SupervisorOptions options = resolver.resolve(template, id);
            ServiceContext ctx = base
                    .withIdentity(id)
                    .withEnvPrefix(options.envPrefix())
                    .withLogger(loggerProvider.create(id, options));
            loops.add(new SupervisionLoop(services.get(i), ctx, options, listeners));
            if (options.shutdownTimeout().compareTo(shutdownTimeout) > 0) {
                shutdownTimeout = options.shutdownTimeout();
            }
        }

        ExecutorService executor = Executors.newFixedThreadPool(loops.size(), threadFactory(identities));
        ExecutorCompletionService<SupervisionReport> completion = new ExecutorCompletionService<>(executor);
        Map<Future<SupervisionReport>, SupervisionLoop> futures = new HashMap<>();
        for (SupervisionLoop loop : loops) {
            futures.put(completion.submit(loop::run), loop);
        }

        Future<SupervisionReport> first;
        try {
            first = completion.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lifetime.cancel();
            awaitMembers(executor, shutdownTimeout);
            throw new CancellationException("supervisor interrupted");
        }

        log.debugf("Service '%s' terminated first, stopping %d sibling(s)",
                futures.get(first).identity(), loops.size() - 1);
        lifetime.cancel();
        awaitMembers(executor, shutdownTimeout);
        return unwrap(first);
    }

    private void awaitMembers(ExecutorService executor, Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.errorf("Services did not stop within %s after cancellation, interrupting",
                        Durations.format(timeout));
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static SupervisionReport unwrap(Future<SupervisionReport> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("supervisor interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Supervision loop failed", cause);
        }
    }

    private TelemetrySession initTelemetry(ServiceContext root) {
        try {
            return telemetry.initialize(root);
        } catch (TelemetryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TelemetryException("failed to initialize telemetry", e);
        }
    }

    private void shutdownTelemetry(TelemetrySession session) {
        try {
            session.shutdown().shutdown(session.context());
        } catch (Exception e) {
            log.errorf(e, "Telemetry shutdown failed");
        }
    }

    private static ThreadFactory threadFactory(List<ServiceIdentity> identities) {
        var names = identities.iterator();
        return task -> {
            String name = names.hasNext()
                    ? "keeper-" + names.next().key().replace('/', '-')
                    : "keeper-worker";
            Thread t = new Thread(task, name);
            t.setDaemon(true);
            return t;
        };
    }
}
