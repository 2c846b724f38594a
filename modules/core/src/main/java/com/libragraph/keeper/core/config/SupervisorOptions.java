package com.libragraph.keeper.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable supervision settings for one service run.
 *
 * <p>Build with {@link #builder()} (defaults below), then let {@link OptionsResolver}
 * overlay environment overrides such as {@code <PREFIX>GRACE_COUNT}.
 *
 * @param restartOnError      restart after a failed attempt, within the grace budget (default true)
 * @param restartOnErrorDelay pause before a restart (default 10s)
 * @param restartOnPanic      restart after a recovered panic (default true)
 * @param restartOnPanicDelay pause before a restart caused by a panic; zero falls back to
 *                            {@code restartOnErrorDelay} (default 0)
 * @param recoverPanic        turn unchecked throwables from the service into panic errors
 *                            instead of letting them escape (default true)
 * @param gracePeriod         wall-clock ceiling, from the first attempt, for restarts; zero = unlimited (default 1m)
 * @param graceCount          maximum restarts after the first attempt; zero = unlimited (default 3)
 * @param shutdownTimeout     how long a group waits for members to stop after cancellation (default 30s)
 * @param logDebug            emit debug output from the service logger (default false)
 * @param logJson             render log attributes as a JSON object (default false)
 * @param envPrefix           env prefix; empty derives {@code <namespace>_<name>_}
 * @param envPrefixDisabled   read environment keys without any prefix
 */
public record SupervisorOptions(
        boolean restartOnError,
        Duration restartOnErrorDelay,
        boolean restartOnPanic,
        Duration restartOnPanicDelay,
        boolean recoverPanic,
        Duration gracePeriod,
        int graceCount,
        Duration shutdownTimeout,
        boolean logDebug,
        boolean logJson,
        String envPrefix,
        boolean envPrefixDisabled
) {

    public SupervisorOptions {
        requireNonNegative(restartOnErrorDelay, "restartOnErrorDelay");
        requireNonNegative(restartOnPanicDelay, "restartOnPanicDelay");
        requireNonNegative(gracePeriod, "gracePeriod");
        requireNonNegative(shutdownTimeout, "shutdownTimeout");
        if (graceCount < 0) {
            throw new IllegalArgumentException("graceCount must be >= 0, got: " + graceCount);
        }
        envPrefix = envPrefix == null ? "" : envPrefix;
    }

    public static SupervisorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .restartOnError(restartOnError)
                .restartOnErrorDelay(restartOnErrorDelay)
                .restartOnPanic(restartOnPanic)
                .restartOnPanicDelay(restartOnPanicDelay)
                .recoverPanic(recoverPanic)
                .gracePeriod(gracePeriod)
                .graceCount(graceCount)
                .shutdownTimeout(shutdownTimeout)
                .logDebug(logDebug)
                .logJson(logJson)
                .envPrefix(envPrefix)
                .envPrefixDisabled(envPrefixDisabled);
    }

    /** Delay applied after a panic: the panic delay when set, the error delay otherwise. */
    public Duration effectivePanicDelay() {
        return restartOnPanicDelay.isZero() ? restartOnErrorDelay : restartOnPanicDelay;
    }

    public boolean hasGracePeriod() {
        return !gracePeriod.isZero();
    }

    public boolean hasGraceCount() {
        return graceCount > 0;
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name + " cannot be null");
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + d);
        }
    }

    public static final class Builder {
        private boolean restartOnError = true;
        private Duration restartOnErrorDelay = Duration.ofSeconds(10);
        private boolean restartOnPanic = true;
        private Duration restartOnPanicDelay = Duration.ZERO;
        private boolean recoverPanic = true;
        private Duration gracePeriod = Duration.ofMinutes(1);
        private int graceCount = 3;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private boolean logDebug;
        private boolean logJson;
        private String envPrefix = "";
        private boolean envPrefixDisabled;

        private Builder() {
        }

        public Builder restartOnError(boolean v) {
            this.restartOnError = v;
            return this;
        }

        public Builder restartOnErrorDelay(Duration v) {
            this.restartOnErrorDelay = v;
            return this;
        }

        public Builder restartOnPanic(boolean v) {
            this.restartOnPanic = v;
            return this;
        }

        public Builder restartOnPanicDelay(Duration v) {
            this.restartOnPanicDelay = v;
            return this;
        }

        public Builder recoverPanic(boolean v) {
            this.recoverPanic = v;
            return this;
        }

        public Builder gracePeriod(Duration v) {
            this.gracePeriod = v;
            return this;
        }

        public Builder graceCount(int v) {
            this.graceCount = v;
            return this;
        }

        public Builder shutdownTimeout(Duration v) {
            this.shutdownTimeout = v;
            return this;
        }

        public Builder logDebug(boolean v) {
            this.logDebug = v;
            return this;
        }

        public Builder logJson(boolean v) {
            this.logJson = v;
            return this;
        }

        public Builder envPrefix(String v) {
            this.envPrefix = v;
            return this;
        }

        public Builder envPrefixDisabled(boolean v) {
            this.envPrefixDisabled = v;
            return this;
        }

        public SupervisorOptions build() {
            return new SupervisorOptions(restartOnError, restartOnErrorDelay, restartOnPanic,
                    restartOnPanicDelay, recoverPanic, gracePeriod, graceCount, shutdownTimeout,
                    logDebug, logJson, envPrefix, envPrefixDisabled);
        }
    }
}
