package com.libragraph.keeper.core.telemetry;

import com.libragraph.keeper.core.context.ServiceContext;

/**
 * Sets up telemetry for a supervision run. Called once per run, before any service code;
 * the returned shutdown hook is always invoked when the run ends.
 */
@FunctionalInterface
public interface TelemetryInitializer {

    /**
     * @throws TelemetryException if the pipeline cannot be created; the run then fails
     *                            without starting any service
     */
    TelemetrySession initialize(ServiceContext ctx);

    /** Installs no-op OpenTelemetry handles. */
    static TelemetryInitializer noop() {
        return ctx -> new TelemetrySession(ctx.withTelemetry(Telemetry.noop()), TelemetrySession.NOOP_SHUTDOWN);
    }
}
