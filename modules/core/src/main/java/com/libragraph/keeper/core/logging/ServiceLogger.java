package com.libragraph.keeper.core.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.keeper.core.error.Errors;
import com.libragraph.keeper.util.Durations;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logger bound to a service. Messages carry key/value attributes, rendered
 * as {@code key=value} pairs or, in JSON mode, as one JSON object after the message.
 *
 * <p>Debug output is dropped unless the logger was created with debug enabled.
 */
public final class ServiceLogger {

    static final String BAD_KEY = "!BADKEY";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger delegate;
    private final Map<String, Object> bound;
    private final boolean debugEnabled;
    private final boolean json;

    public ServiceLogger(Logger delegate, boolean debugEnabled, boolean json) {
        this(delegate, Collections.emptyMap(), debugEnabled, json);
    }

    private ServiceLogger(Logger delegate, Map<String, Object> bound, boolean debugEnabled, boolean json) {
        this.delegate = delegate;
        this.bound = bound;
        this.debugEnabled = debugEnabled;
        this.json = json;
    }

    /** Logger used before a service logger exists. */
    public static ServiceLogger defaultLogger() {
        return new ServiceLogger(Logger.getLogger("com.libragraph.keeper"), false, false);
    }

    /** Returns a logger that adds {@code keyValues} to every message. */
    public ServiceLogger with(Object... keyValues) {
        Map<String, Object> merged = new LinkedHashMap<>(bound);
        collect(merged, keyValues);
        return new ServiceLogger(delegate, Collections.unmodifiableMap(merged), debugEnabled, json);
    }

    public void debug(String msg, Object... keyValues) {
        if (debugEnabled) {
            delegate.debug(render(msg, keyValues));
        }
    }

    public void info(String msg, Object... keyValues) {
        delegate.info(render(msg, keyValues));
    }

    public void warn(String msg, Object... keyValues) {
        delegate.warn(render(msg, keyValues));
    }

    public void error(String msg, Object... keyValues) {
        delegate.error(render(msg, keyValues));
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public boolean isJson() {
        return json;
    }

    Map<String, Object> boundAttributes() {
        return bound;
    }

    String render(String msg, Object... keyValues) {
        Map<String, Object> attrs = new LinkedHashMap<>(bound);
        collect(attrs, keyValues);
        if (attrs.isEmpty()) {
            return msg;
        }
        if (json) {
            try {
                return msg + " " + MAPPER.writeValueAsString(attrs);
            } catch (JsonProcessingException e) {
                delegate.debugf(e, "JSON rendering of log attributes failed, using text");
            }
        }
        StringBuilder sb = new StringBuilder(msg);
        attrs.forEach((k, v) -> sb.append(' ').append(k).append('=').append(quote(v)));
        return sb.toString();
    }

    private static void collect(Map<String, Object> target, Object[] keyValues) {
        if (keyValues == null) {
            return;
        }
        int i = 0;
        for (; i + 1 < keyValues.length; i += 2) {
            target.put(String.valueOf(keyValues[i]), value(keyValues[i + 1]));
        }
        if (i < keyValues.length) {
            target.put(BAD_KEY, value(keyValues[i]));
        }
    }

    private static Object value(Object v) {
        if (v instanceof Throwable t) {
            return Errors.describe(t);
        }
        if (v instanceof Duration d) {
            return Durations.format(d);
        }
        if (v == null || v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        return v.toString();
    }

    private static String quote(Object v) {
        String s = String.valueOf(v);
        if (s.isEmpty() || s.indexOf(' ') >= 0 || s.indexOf('=') >= 0 || s.indexOf('"') >= 0) {
            return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return s;
    }
}
