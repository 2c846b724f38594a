package com.libragraph.keeper.core.telemetry;

import com.libragraph.keeper.core.error.SupervisorException;

public class TelemetryException extends SupervisorException {

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }

    public TelemetryException(String message) {
        super(message);
    }
}
