package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.types.ServiceIdentity;

import java.time.Instant;

/**
 * Published to {@link SupervisionListener}s on every state transition of a loop.
 *
 * @param attempt 1-based attempt the transition belongs to
 */
public record SupervisionStateChangedEvent(
        ServiceIdentity service,
        SupervisionState oldState,
        SupervisionState newState,
        int attempt,
        Instant timestamp
) {}
