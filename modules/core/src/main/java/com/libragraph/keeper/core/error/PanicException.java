package com.libragraph.keeper.core.error;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * An unchecked throwable recovered from a service lifecycle method.
 * The stack of the original throwable is captured as text; an error the attempt had
 * already produced is attached as suppressed.
 */
public class PanicException extends SupervisorException {

    private final String stack;

    PanicException(Throwable cause) {
        super("panic: " + Errors.describe(cause), cause);
        var sw = new StringWriter();
        cause.printStackTrace(new PrintWriter(sw));
        this.stack = sw.toString();
    }

    public static PanicException recovered(Throwable cause, Throwable related) {
        PanicException panic = new PanicException(cause);
        if (related != null && related != cause) {
            panic.addSuppressed(related);
        }
        return panic;
    }

    /** Stack trace of the recovered throwable. */
    public String stack() {
        return stack;
    }
}
