package com.libragraph.keeper.core.error;

import com.libragraph.keeper.util.Durations;

import java.time.Duration;

/**
 * Terminal failure raised when a service keeps failing past its restart budget.
 * The cause is the error of the last attempt.
 */
public class GraceExhaustedException extends SupervisorException {

    public enum Dimension {
        PERIOD("grace period"),
        COUNT("grace count");

        private final String label;

        Dimension(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Dimension dimension;
    private final int restarts;
    private final Duration elapsed;

    public GraceExhaustedException(Dimension dimension, int restarts, Duration elapsed, Throwable lastError) {
        super("service failed, exceeded " + dimension.label()
                + " (restarts=" + restarts + ", elapsed=" + Durations.format(elapsed) + ")", lastError);
        this.dimension = dimension;
        this.restarts = restarts;
        this.elapsed = elapsed;
    }

    public Dimension dimension() {
        return dimension;
    }

    public int restarts() {
        return restarts;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
