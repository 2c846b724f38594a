package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.error.SupervisorException;
import com.libragraph.keeper.types.ServiceIdentity;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Final state of one supervision loop, returned to the caller of a run.
 *
 * @param attempts number of {@code init → run → close} attempts made
 * @param restarts attempts beyond the first that the loop decided on
 */
public record SupervisionReport(
        ServiceIdentity service,
        SupervisionState state,
        int attempts,
        int restarts,
        Instant startedAt,
        Instant finishedAt,
        SupervisorException error
) {

    public Optional<SupervisorException> failure() {
        return Optional.ofNullable(error);
    }

    public boolean succeeded() {
        return state == SupervisionState.TERMINATED_SUCCESS;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
