package com.libragraph.keeper.core.service;

import com.libragraph.keeper.core.context.ServiceContext;

import java.util.Objects;

/**
 * {@link Service} assembled from an identity and lifecycle callbacks. Init and close
 * callbacks are optional; the run callback is required.
 */
public final class SimpleService implements Service {

    @FunctionalInterface
    public interface Step {
        void apply(ServiceContext ctx) throws Exception;
    }

    private static final Step NOOP = ctx -> { };

    private final String name;
    private final String namespace;
    private final String version;
    private final Step init;
    private final Step run;
    private final Step close;

    private SimpleService(Builder b) {
        this.name = b.name;
        this.namespace = b.namespace;
        this.version = b.version;
        this.init = b.init;
        this.run = Objects.requireNonNull(b.run, "run step must be set");
        this.close = b.close;
    }

    public static Builder builder(String name, String namespace) {
        return new Builder(name, namespace);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public void init(ServiceContext ctx) throws Exception {
        init.apply(ctx);
    }

    @Override
    public void run(ServiceContext ctx) throws Exception {
        run.apply(ctx);
    }

    @Override
    public void close(ServiceContext ctx) throws Exception {
        close.apply(ctx);
    }

    public static final class Builder {
        private final String name;
        private final String namespace;
        private String version = "";
        private Step init = NOOP;
        private Step run;
        private Step close = NOOP;

        private Builder(String name, String namespace) {
            this.name = name;
            this.namespace = namespace;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder onInit(Step init) {
            this.init = Objects.requireNonNull(init);
            return this;
        }

        public Builder onRun(Step run) {
            this.run = Objects.requireNonNull(run);
            return this;
        }

        public Builder onClose(Step close) {
            this.close = Objects.requireNonNull(close);
            return this;
        }

        public SimpleService build() {
            return new SimpleService(this);
        }
    }
}
