package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.config.SupervisorOptions;
import com.libragraph.keeper.core.context.ServiceContext;
import com.libragraph.keeper.core.error.Errors;
import com.libragraph.keeper.core.error.PanicException;
import com.libragraph.keeper.core.error.ServiceFailureException;
import com.libragraph.keeper.core.error.ServiceFailureException.Phase;
import com.libragraph.keeper.core.service.Service;

import java.util.function.Consumer;

/**
 * Runs exactly one {@code init → run → close} attempt and classifies the outcome.
 *
 * <ul>
 *   <li>Checked failures of {@code init} and {@code run} become {@link ServiceFailureException}s.
 *       Both are restartable unless a {@code FatalServiceException} is in the cause chain.</li>
 *   <li>Cancellation from {@code run} is a clean stop.</li>
 *   <li>{@code close} runs whenever {@code init} succeeded; its failure is only logged.</li>
 *   <li>Unchecked throwables are panics: recovered into {@link PanicException} when
 *       {@link SupervisorOptions#recoverPanic()} is set, rethrown otherwise.
 *       {@link VirtualMachineError}s are never recovered.</li>
 * </ul>
 */
class AttemptRunner {

    AttemptOutcome runOnce(Service service, ServiceContext ctx, SupervisorOptions options,
                           Consumer<SupervisionState> phases) {
        Attempt attempt = new Attempt(service, ctx, phases);
        if (!options.recoverPanic()) {
            return attempt.execute();
        }
        try {
            return attempt.execute();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            return AttemptOutcome.panicked(PanicException.recovered(e, attempt.failure));
        }
    }

    private static final class Attempt {

        private final Service service;
        private final ServiceContext ctx;
        private final Consumer<SupervisionState> phases;
        private ServiceFailureException failure;

        Attempt(Service service, ServiceContext ctx, Consumer<SupervisionState> phases) {
            this.service = service;
            this.ctx = ctx;
            this.phases = phases;
        }

        AttemptOutcome execute() {
            phases.accept(SupervisionState.INIT);
            ctx.logger().debug("initializing service");
            try {
                service.init(ctx);
            } catch (RuntimeException e) {
                if (Errors.isCancellation(e)) {
                    ctx.logger().debug("service initialization cancelled");
                    return AttemptOutcome.success();
                }
                throw e;
            } catch (Exception e) {
                if (isInterruptedByCancellation(e)) {
                    return AttemptOutcome.success();
                }
                failure = new ServiceFailureException(Phase.INIT, e);
                return AttemptOutcome.failed(failure);
            }

            phases.accept(SupervisionState.RUNNING);
            ctx.logger().debug("starting service");
            Throwable panic = null;
            try {
                service.run(ctx);
            } catch (RuntimeException e) {
                if (Errors.isCancellation(e)) {
                    ctx.logger().debug("service stopped by cancellation");
                } else {
                    panic = e;
                }
            } catch (Exception e) {
                if (!isInterruptedByCancellation(e)) {
                    failure = new ServiceFailureException(Phase.RUN, e);
                }
            } catch (Error e) {
                panic = e;
            }

            close();

            if (panic instanceof RuntimeException re) {
                throw re;
            }
            if (panic instanceof Error err) {
                throw err;
            }
            return failure == null ? AttemptOutcome.success() : AttemptOutcome.failed(failure);
        }

        private void close() {
            phases.accept(SupervisionState.CLOSING);
            ctx.logger().debug("shutting down service");
            try {
                service.close(ctx);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                ctx.logger().error("service shutdown failed", "error", e);
            }
        }

        // interrupts arrive when a group gives up waiting for a cancelled member
        private boolean isInterruptedByCancellation(Exception e) {
            if (e instanceof InterruptedException && ctx.isCancelled()) {
                ctx.logger().debug("service interrupted after cancellation");
                return true;
            }
            return Errors.isCancellation(e);
        }
    }
}
