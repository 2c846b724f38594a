package com.libragraph.keeper.core.service;

import com.libragraph.keeper.core.context.ServiceContext;

/**
 * A long-running unit hosted by the supervisor.
 *
 * <p>One attempt is {@code init → run → close}. When restarts are enabled the same
 * instance goes through several attempts, so {@link #init} and {@link #close} must
 * tolerate being called more than once.
 *
 * <p>Failure conventions:
 * <ul>
 *   <li>checked exceptions are ordinary failures, eligible for restart;</li>
 *   <li>{@link FatalServiceException} ends supervision regardless of restart settings;</li>
 *   <li>{@link java.util.concurrent.CancellationException} from {@link #run} is a clean stop;</li>
 *   <li>any other unchecked throwable is a panic.</li>
 * </ul>
 */
public interface Service {

    String name();

    /** Logical grouping, e.g. "billing" or "monitoring". */
    String namespace();

    /** SemVer or CalVer tag. Advisory only. */
    String version();

    /**
     * Per-attempt setup. A failure aborts the attempt before {@link #run} and
     * {@link #close} is not called.
     */
    void init(ServiceContext ctx) throws Exception;

    /**
     * Main body. Blocks until {@code ctx} is cancelled or the service fails.
     * Services typically end with {@link ServiceContext#awaitCancellation()}.
     */
    void run(ServiceContext ctx) throws Exception;

    /**
     * Best-effort teardown after {@link #run} returns. Failures are logged, never
     * propagated.
     */
    void close(ServiceContext ctx) throws Exception;
}
