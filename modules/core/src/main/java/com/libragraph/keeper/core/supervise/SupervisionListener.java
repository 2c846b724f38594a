package com.libragraph.keeper.core.supervise;

/**
 * Observes supervision loops. Called on the loop's thread; must not block.
 */
@FunctionalInterface
public interface SupervisionListener {

    void onStateChanged(SupervisionStateChangedEvent event);
}
