package com.libragraph.keeper.core.config;

import com.libragraph.keeper.types.ServiceIdentity;
import com.libragraph.keeper.util.Durations;
import com.libragraph.keeper.util.EnvKeys;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Resolves the effective {@link SupervisorOptions} for one service: caller options
 * first, then matching environment variables under the service's env prefix.
 *
 * <p>Malformed or negative values are logged and ignored; the caller's value stays.
 */
public class OptionsResolver {

    private static final Logger log = Logger.getLogger(OptionsResolver.class);

    public static final String RESTART_ON_ERROR = "RESTART_ON_ERROR";
    public static final String RESTART_ON_ERROR_DELAY = "RESTART_ON_ERROR_DELAY";
    public static final String RESTART_ON_PANIC = "RESTART_ON_PANIC";
    public static final String RESTART_ON_PANIC_DELAY = "RESTART_ON_PANIC_DELAY";
    public static final String RECOVER_PANIC = "RECOVER_PANIC";
    public static final String GRACE_PERIOD = "GRACE_PERIOD";
    public static final String GRACE_COUNT = "GRACE_COUNT";
    public static final String SHUTDOWN_TIMEOUT = "SHUTDOWN_TIMEOUT";
    public static final String LOG_DEBUG = "LOG_DEBUG";
    public static final String LOG_JSON = "LOG_JSON";

    private final Config config;

    public OptionsResolver(Config config) {
        this.config = config;
    }

    public SupervisorOptions resolve(SupervisorOptions template, ServiceIdentity identity) {
        String prefix = resolvePrefix(template, identity);
        SupervisorOptions.Builder b = template.toBuilder().envPrefix(prefix);

        flag(prefix, RESTART_ON_ERROR, b::restartOnError);
        duration(prefix, RESTART_ON_ERROR_DELAY, b::restartOnErrorDelay);
        flag(prefix, RESTART_ON_PANIC, b::restartOnPanic);
        duration(prefix, RESTART_ON_PANIC_DELAY, b::restartOnPanicDelay);
        flag(prefix, RECOVER_PANIC, b::recoverPanic);
        duration(prefix, GRACE_PERIOD, b::gracePeriod);
        count(prefix, GRACE_COUNT, b::graceCount);
        duration(prefix, SHUTDOWN_TIMEOUT, b::shutdownTimeout);
        flag(prefix, LOG_DEBUG, b::logDebug);
        flag(prefix, LOG_JSON, b::logJson);

        return b.build();
    }

    /**
     * The normalised prefix for {@code identity}: explicit {@code envPrefix} when set,
     * {@code <NAMESPACE>_<NAME>_} otherwise, empty when prefixes are disabled.
     */
    public static String resolvePrefix(SupervisorOptions options, ServiceIdentity identity) {
        if (options.envPrefixDisabled()) {
            return "";
        }
        if (!options.envPrefix().isEmpty()) {
            return EnvKeys.prefix(options.envPrefix());
        }
        return EnvKeys.defaultPrefix(identity.namespace(), identity.name());
    }

    // -- typed lookups --

    private void flag(String prefix, String key, Consumer<Boolean> target) {
        lookup(prefix, key, OptionsResolver::parseFlag).ifPresent(target);
    }

    private void duration(String prefix, String key, Consumer<Duration> target) {
        lookup(prefix, key, raw -> {
            Duration d = Durations.parse(raw);
            if (d.isNegative()) {
                throw new IllegalArgumentException("must not be negative");
            }
            return d;
        }).ifPresent(target);
    }

    private void count(String prefix, String key, Consumer<Integer> target) {
        lookup(prefix, key, raw -> {
            int n = Integer.parseInt(raw.trim());
            if (n < 0) {
                throw new IllegalArgumentException("must not be negative");
            }
            return n;
        }).ifPresent(target);
    }

    private <T> Optional<T> lookup(String prefix, String key, Function<String, T> parser) {
        String name = prefix + key;
        Optional<String> raw = config.getOptionalValue(name, String.class);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            T value = parser.apply(raw.get());
            log.debugf("Option %s overridden from environment: %s", name, raw.get());
            return Optional.of(value);
        } catch (IllegalArgumentException e) {
            log.warnf("Ignoring invalid value for %s: '%s' (%s)", name, raw.get(), e.getMessage());
            return Optional.empty();
        }
    }

    static boolean parseFlag(String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "1", "t", "true", "y", "yes", "on":
                return true;
            case "0", "f", "false", "n", "no", "off":
                return false;
            default:
                throw new IllegalArgumentException("not a boolean");
        }
    }
}
