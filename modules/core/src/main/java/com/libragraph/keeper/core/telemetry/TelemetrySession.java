package com.libragraph.keeper.core.telemetry;

import com.libragraph.keeper.core.context.ServiceContext;

/**
 * Result of {@link TelemetryInitializer#initialize}: the decorated context and the hook
 * that flushes and releases the telemetry pipeline.
 */
public record TelemetrySession(ServiceContext context, ShutdownHook shutdown) {

    @FunctionalInterface
    public interface ShutdownHook {
        void shutdown(ServiceContext ctx) throws Exception;
    }

    public static final ShutdownHook NOOP_SHUTDOWN = ctx -> { };
}
