package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.core.context.ServiceContext;
import com.libragraph.keeper.core.error.GraceExhaustedException;
import com.libragraph.keeper.core.error.GraceExhaustedException.Dimension;
import com.libragraph.keeper.core.error.SupervisorException;
import com.libragraph.keeper.core.logging.ServiceLogger;
import com.libragraph.keeper.core.service.Service;
import com.libragraph.keeper.types.ServiceIdentity;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Supervises one service: repeats attempts until one succeeds, a failure is terminal,
 * or the grace budget is spent.
 *
 * <p>A loop is single-use. Its restart counter and grace start live on the instance,
 * so every run gets fresh budget state and a second {@link #run()} is rejected.
 */
public final class SupervisionLoop {

    private static final Logger log = Logger.getLogger(SupervisionLoop.class);

    static final String MDC_SERVICE = "service";
    static final String MDC_NAMESPACE = "namespace";
    static final String MDC_VERSION = "version";

    private final Service service;
    private final ServiceIdentity identity;
    private final ServiceContext context;
    private final SupervisorOptions options;
    private final List<SupervisionListener> listeners;
    private final AttemptRunner runner;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicReference<SupervisionState> state = new AtomicReference<>(SupervisionState.NEW);
    private Instant graceStart;
    private int attempts;
    private int restarts;

    public SupervisionLoop(Service service, ServiceContext context, SupervisorOptions options,
                           List<SupervisionListener> listeners) {
        this(service, context, options, listeners, new AttemptRunner(), Clock.systemUTC());
    }

    SupervisionLoop(Service service, ServiceContext context, SupervisorOptions options,
                    List<SupervisionListener> listeners, AttemptRunner runner, Clock clock) {
        this.service = service;
        this.identity = context.identity();
        this.context = context;
        this.options = options;
        this.listeners = List.copyOf(listeners);
        this.runner = runner;
        this.clock = clock;
    }

    public SupervisionState state() {
        return state.get();
    }

    public ServiceIdentity identity() {
        return identity;
    }

    /**
     * Runs the loop on the calling thread until a terminal state is reached.
     * An unrecovered panic (recovery disabled) escapes as the original throwable.
     *
     * @throws IllegalStateException if this loop was already run
     */
    public SupervisionReport run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Supervision of '" + identity + "' already started");
        }
        graceStart = clock.instant();
        MDC.put(MDC_SERVICE, identity.name());
        MDC.put(MDC_NAMESPACE, identity.namespace());
        MDC.put(MDC_VERSION, identity.version());
        try {
            return loop();
        } catch (RuntimeException | Error e) {
            transition(SupervisionState.TERMINATED_FAILURE);
            throw e;
        } finally {
            MDC.remove(MDC_SERVICE);
            MDC.remove(MDC_NAMESPACE);
            MDC.remove(MDC_VERSION);
        }
    }

    private SupervisionReport loop() {
        ServiceLogger logger = context.logger();

        while (true) {
            attempts++;
            AttemptOutcome outcome = runner.runOnce(service, context, options, this::transition);
            if (outcome instanceof AttemptOutcome.Success) {
                return terminate(SupervisionState.TERMINATED_SUCCESS, null);
            }

            SupervisorException error = outcome.error();
            if (outcome.isFatal() || !options.restartOnError()) {
                logger.error("service failed", "error", error, "fatal", outcome.isFatal());
                return terminate(SupervisionState.TERMINATED_FAILURE, error);
            }

            transition(SupervisionState.DECIDING);
            restarts++;

            // panic restart is all-or-nothing, ahead of the grace budget
            if (outcome.isPanic() && !options.restartOnPanic()) {
                logger.error("service panicked, panic restart disabled", "error", error);
                return terminate(SupervisionState.TERMINATED_FAILURE, error);
            }

            List<Object> attrs = new ArrayList<>(List.of("error", error));
            if (options.hasGracePeriod()) {
                attrs.add("grace_period");
                attrs.add(options.gracePeriod());
            }
            if (options.hasGraceCount()) {
                attrs.add("grace_count");
                attrs.add(options.graceCount());
                attrs.add("grace_count_remaining");
                attrs.add(options.graceCount() - restarts);
            }

            Duration elapsed = Duration.between(graceStart, clock.instant());
            if (options.hasGracePeriod() && elapsed.compareTo(options.gracePeriod()) > 0) {
                logger.error("service failed, exceeded grace period", attrs.toArray());
                return terminate(SupervisionState.TERMINATED_FAILURE,
                        new GraceExhaustedException(Dimension.PERIOD, restarts, elapsed, error));
            }
            if (options.hasGraceCount() && restarts > options.graceCount()) {
                logger.error("service failed, exceeded grace count", attrs.toArray());
                return terminate(SupervisionState.TERMINATED_FAILURE,
                        new GraceExhaustedException(Dimension.COUNT, restarts, elapsed, error));
            }

            Duration delay = outcome.isPanic() ? options.effectivePanicDelay() : options.restartOnErrorDelay();
            attrs.add("restart_delay");
            attrs.add(delay);

            if (delay.isZero()) {
                logger.error("service failed, restarting immediately", attrs.toArray());
            } else {
                logger.error("service failed, restarting after delay", attrs.toArray());
                transition(SupervisionState.DELAYING);
                if (awaitRestart(delay)) {
                    logger.debug("supervision cancelled during restart delay");
                    return terminate(SupervisionState.TERMINATED_SUCCESS, null);
                }
            }
            if (context.isCancelled()) {
                logger.debug("supervision cancelled, not restarting");
                return terminate(SupervisionState.TERMINATED_SUCCESS, null);
            }
        }
    }

    /** Waits out the restart delay; true if cancellation cut it short. */
    private boolean awaitRestart(Duration delay) {
        try {
            return context.lifetime().await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private SupervisionReport terminate(SupervisionState terminal, SupervisorException error) {
        transition(terminal);
        return new SupervisionReport(identity, terminal, attempts, restarts, graceStart, clock.instant(), error);
    }

    private void transition(SupervisionState newState) {
        SupervisionState old = state.getAndSet(newState);
        if (old == newState) {
            return;
        }
        context.logger().debug("supervision state changed", "from", old, "to", newState, "attempt", attempts);
        var event = new SupervisionStateChangedEvent(identity, old, newState, attempts, clock.instant());
        for (SupervisionListener listener : listeners) {
            try {
                listener.onStateChanged(event);
            } catch (RuntimeException e) {
                log.warnf(e, "Supervision listener failed for '%s' (%s -> %s)", identity, old, newState);
            }
        }
    }
}
