package com.libragraph.keeper.core.telemetry;

import com.libragraph.keeper.core.context.ServiceContext;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdkBuilder;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds an OpenTelemetry SDK from the standard {@code OTEL_*} environment variables.
 *
 * <p>Exporters default to {@code none}, so nothing leaves the process until
 * {@code OTEL_TRACES_EXPORTER} / {@code OTEL_METRICS_EXPORTER} are set. The resource
 * carries the service name, namespace and version of the context.
 */
public class OpenTelemetrySdkInitializer implements TelemetryInitializer {

    private static final Logger log = Logger.getLogger(OpenTelemetrySdkInitializer.class);

    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
    static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(10);

    @Override
    public TelemetrySession initialize(ServiceContext ctx) {
        OpenTelemetrySdk sdk;
        try {
            sdk = configure(ctx).build().getOpenTelemetrySdk();
        } catch (RuntimeException e) {
            throw new TelemetryException("failed to initialize OpenTelemetry", e);
        }

        if (ctx.config().getOptionalValue("otel.traces.exporter", String.class).isEmpty()) {
            log.warn("Using a no-op span exporter. Set OTEL_TRACES_EXPORTER and related env vars as required");
        }
        if (ctx.config().getOptionalValue("otel.metrics.exporter", String.class).isEmpty()) {
            log.warn("Using a no-op metric exporter. Set OTEL_METRICS_EXPORTER and related env vars as required");
        }

        return new TelemetrySession(ctx.withTelemetry(Telemetry.from(sdk)), shutdownCtx -> shutdown(sdk));
    }

    // the session's shutdown flushes the SDK; a JVM hook would race it
    static AutoConfiguredOpenTelemetrySdkBuilder configure(ServiceContext ctx) {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(OpenTelemetrySdkInitializer::defaults)
                .addResourceCustomizer((resource, config) -> resource.merge(serviceResource(ctx)))
                .disableShutdownHook();
    }

    static Map<String, String> defaults() {
        return Map.of(
                "otel.traces.exporter", "none",
                "otel.metrics.exporter", "none",
                "otel.logs.exporter", "none",
                "otel.propagators", "tracecontext");
    }

    static Resource serviceResource(ServiceContext ctx) {
        AttributesBuilder attrs = Attributes.builder();
        if (!ctx.name().isEmpty()) {
            attrs.put(SERVICE_NAME, ctx.name());
        }
        if (!ctx.namespace().isEmpty()) {
            attrs.put(SERVICE_NAMESPACE, ctx.namespace());
        }
        if (!ctx.version().isEmpty()) {
            attrs.put(SERVICE_VERSION, ctx.version());
        }
        return Resource.create(attrs.build());
    }

    private static void shutdown(OpenTelemetrySdk sdk) {
        CompletableResultCode result = sdk.shutdown().join(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isSuccess()) {
            throw new TelemetryException("OpenTelemetry shutdown failed or timed out after "
                    + SHUTDOWN_WAIT.toSeconds() + "s");
        }
    }
}
