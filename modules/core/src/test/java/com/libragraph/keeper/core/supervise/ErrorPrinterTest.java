package com.libragraph.keeper.core.supervise;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorPrinterTest {

    private static StackTraceElement frame(String className, String method) {
        return new StackTraceElement(className, method, className.substring(className.lastIndexOf('.') + 1) + ".java", 42);
    }

    private static String print(Throwable t) {
        var out = new ByteArrayOutputStream();
        new ErrorPrinter(new PrintStream(out, true, StandardCharsets.UTF_8)).print(t);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void dropsSupervisionFramesAndKeepsServiceFrames() {
        var cause = new IOException("connection refused");
        cause.setStackTrace(new StackTraceElement[]{
                frame("com.example.billing.Poller", "poll"),
                frame("com.libragraph.keeper.core.supervise.AttemptRunner", "runOnce"),
        });
        var error = new IllegalStateException("poll failed", cause);
        error.setStackTrace(new StackTraceElement[]{
                frame("com.libragraph.keeper.core.supervise.SupervisionLoop", "loop"),
                frame("com.example.billing.Main", "main"),
        });

        String printed = print(error);

        assertThat(printed).startsWith("Error: poll failed: connection refused");
        assertThat(printed).contains("\tat com.example.billing.Poller.poll(Poller.java:42)");
        assertThat(printed).contains("\tat com.example.billing.Main.main(Main.java:42)");
        assertThat(printed).contains("Caused by: java.io.IOException: connection refused");
        assertThat(printed).doesNotContain("AttemptRunner").doesNotContain("SupervisionLoop");
    }

    @Test
    void printsSuppressedErrors() {
        var error = new IllegalStateException("panic");
        error.setStackTrace(new StackTraceElement[0]);
        var related = new IOException("earlier failure");
        related.setStackTrace(new StackTraceElement[0]);
        error.addSuppressed(related);

        assertThat(print(error)).contains("\tSuppressed: java.io.IOException: earlier failure");
    }

    @Test
    void frameFilterMatchesOnlyTheSupervisionPackage() {
        assertThat(ErrorPrinter.isFiltered(frame("com.libragraph.keeper.core.supervise.ServiceGroup", "run"))).isTrue();
        assertThat(ErrorPrinter.isFiltered(frame("com.libragraph.keeper.core.context.Lifetime", "await"))).isFalse();
        assertThat(ErrorPrinter.isFiltered(frame("com.libragraph.keeper.core.supervisex.Other", "run"))).isFalse();
    }
}
