package com.libragraph.keeper.app;

import com.libragraph.keeper.core.supervise.Supervisor;

/**
 * Runs {@link ExampleService} under the default supervisor. Stop with SIGINT/SIGTERM.
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        Supervisor.create().runAndExit(new ExampleService());
    }
}
