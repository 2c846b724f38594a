package com.libragraph.keeper.app;

import com.libragraph.keeper.core.context.ServiceContext;
import com.libragraph.keeper.core.logging.ServiceLogger;
import com.libragraph.keeper.core.service.FatalServiceException;
import com.libragraph.keeper.core.service.Service;
import com.libragraph.keeper.util.BuildInfo;
import com.libragraph.keeper.util.Durations;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.trace.Span;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Demo daemon: logs a heartbeat until cancelled, one span and counter increment per beat.
 *
 * <p>Reads {@code HEARTBEAT_INTERVAL} (default 5s) and {@code HEARTBEAT_LIMIT}
 * (default 0, unlimited) under its env prefix, {@code SERVICE_EXAMPLE_} unless overridden.
 */
public class ExampleService implements Service {

    static final String NAME = "example";
    static final String NAMESPACE = "service";
    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    private static final AttributeKey<Long> BEAT = AttributeKey.longKey("heartbeat.count");

    private final AtomicLong beats = new AtomicLong();
    private Duration interval;
    private long limit;
    private LongCounter counter;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String namespace() {
        return NAMESPACE;
    }

    @Override
    public String version() {
        return BuildInfo.versionOr(ExampleService.class, "1.0.0");
    }

    @Override
    public void init(ServiceContext ctx) throws Exception {
        ServiceLogger log = ctx.logger();
        log.info("env prefix", "prefix", ctx.envPrefix());

        String raw = ctx.getEnv("HEARTBEAT_INTERVAL");
        try {
            interval = raw.isEmpty() ? DEFAULT_INTERVAL : Durations.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new FatalServiceException("invalid " + ctx.envKey("HEARTBEAT_INTERVAL") + ": " + raw, e);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new FatalServiceException(ctx.envKey("HEARTBEAT_INTERVAL") + " must be positive, got " + raw);
        }
        limit = ctx.getEnv("HEARTBEAT_LIMIT", Long.class).orElse(0L);

        counter = ctx.meter().counterBuilder("keeper.example.heartbeats")
                .setDescription("Heartbeats emitted by the example service")
                .build();
    }

    @Override
    public void run(ServiceContext ctx) throws Exception {
        ServiceLogger log = ctx.logger();
        log.info("running", "interval", interval, "limit", limit);

        while (!ctx.sleep(interval)) {
            long n = beats.incrementAndGet();
            Span span = ctx.tracer().spanBuilder("heartbeat").setAttribute(BEAT, n).startSpan();
            try {
                counter.add(1);
                log.info("heartbeat", "count", n);
            } finally {
                span.end();
            }
            if (limit > 0 && n >= limit) {
                log.info("heartbeat limit reached", "limit", limit);
                return;
            }
        }
        ctx.awaitCancellation();
    }

    @Override
    public void close(ServiceContext ctx) {
        ctx.logger().info("closing", "beats", beats.get());
    }

    long beats() {
        return beats.get();
    }
}
