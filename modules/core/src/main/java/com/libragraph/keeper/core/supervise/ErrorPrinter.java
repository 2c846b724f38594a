package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.error.Errors;

import java.io.PrintStream;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Prints a terminal error for a human reading the console. Frames that belong to the
 * supervision machinery are dropped so the trace starts in service code.
 */
final class ErrorPrinter {

    static final String FILTERED_PACKAGE = ErrorPrinter.class.getPackageName() + ".";

    private final PrintStream out;

    ErrorPrinter(PrintStream out) {
        this.out = out;
    }

    void print(Throwable error) {
        out.println("Error: " + Errors.describe(error));
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        print(error, "", "", seen);
        out.flush();
    }

    private void print(Throwable t, String caption, String indent, Set<Throwable> seen) {
        if (!seen.add(t)) {
            out.println(indent + caption + "[CIRCULAR REFERENCE: " + t + "]");
            return;
        }
        out.println(indent + caption + t);
        for (StackTraceElement frame : t.getStackTrace()) {
            if (!isFiltered(frame)) {
                out.println(indent + "\tat " + frame);
            }
        }
        for (Throwable suppressed : t.getSuppressed()) {
            print(suppressed, "Suppressed: ", indent + "\t", seen);
        }
        Throwable cause = t.getCause();
        if (cause != null) {
            print(cause, "Caused by: ", indent, seen);
        }
    }

    static boolean isFiltered(StackTraceElement frame) {
        return frame.getClassName().startsWith(FILTERED_PACKAGE);
    }
}
