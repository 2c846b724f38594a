package com.libragraph.keeper.core.error;

/**
 * A checked failure raised by a service's {@code init} or {@code run}, wrapped with
 * the lifecycle phase it came from.
 */
public class ServiceFailureException extends SupervisorException {

    public enum Phase {
        INIT("service initialization failed"),
        RUN("service run failed");

        private final String message;

        Phase(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Phase phase;
    private final boolean fatal;

    public ServiceFailureException(Phase phase, Throwable cause) {
        super(phase.message(), cause);
        this.phase = phase;
        this.fatal = Errors.isFatal(cause);
    }

    public Phase phase() {
        return phase;
    }

    /** True when the cause chain holds a {@code FatalServiceException}. */
    public boolean isFatal() {
        return fatal;
    }
}
