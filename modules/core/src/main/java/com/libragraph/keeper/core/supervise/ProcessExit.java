package com.libragraph.keeper.core.supervise;

/** Terminates the process. Replaced in tests. */
@FunctionalInterface
public interface ProcessExit {

    ProcessExit SYSTEM = System::exit;

    void exit(int status);
}
