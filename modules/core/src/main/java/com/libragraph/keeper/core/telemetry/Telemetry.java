package com.libragraph.keeper.core.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.context.propagation.ContextPropagators;

import java.util.Objects;

/**
 * OpenTelemetry handles exposed to services through their context.
 */
public record Telemetry(OpenTelemetry openTelemetry, Tracer tracer, Meter meter) {

    public static final String INSTRUMENTATION_NAME = "com.libragraph.keeper";

    public Telemetry {
        Objects.requireNonNull(openTelemetry, "openTelemetry cannot be null");
        Objects.requireNonNull(tracer, "tracer cannot be null");
        Objects.requireNonNull(meter, "meter cannot be null");
    }

    public static Telemetry from(OpenTelemetry openTelemetry) {
        return new Telemetry(openTelemetry,
                openTelemetry.getTracer(INSTRUMENTATION_NAME),
                openTelemetry.getMeter(INSTRUMENTATION_NAME));
    }

    public static Telemetry noop() {
        return from(OpenTelemetry.noop());
    }

    public TracerProvider tracerProvider() {
        return openTelemetry.getTracerProvider();
    }

    public MeterProvider meterProvider() {
        return openTelemetry.getMeterProvider();
    }

    public ContextPropagators propagators() {
        return openTelemetry.getPropagators();
    }
}
