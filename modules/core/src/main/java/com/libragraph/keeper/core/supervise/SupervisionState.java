package com.libragraph.keeper.core.supervise;

/**
 * States of one supervision loop. An attempt moves through
 * {@code INIT → RUNNING → CLOSING}; failures pass through {@code DECIDING} and,
 * when restarting after a pause, {@code DELAYING}.
 */
public enum SupervisionState {
    NEW,
    INIT,
    RUNNING,
    CLOSING,
    DECIDING,
    DELAYING,
    TERMINATED_SUCCESS,
    TERMINATED_FAILURE;

    public boolean isTerminal() {
        return this == TERMINATED_SUCCESS || this == TERMINATED_FAILURE;
    }
}
