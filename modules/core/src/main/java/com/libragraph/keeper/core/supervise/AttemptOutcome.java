package com.libragraph.keeper.core.supervise;

import com.libragraph.keeper.core.error.PanicException;
import com.libragraph.keeper.core.error.ServiceFailureException;
import com.libragraph.keeper.core.error.SupervisorException;

/**
 * Classified result of one attempt.
 */
public sealed interface AttemptOutcome {

    /** Clean finish, including a stop by cancellation. */
    record Success() implements AttemptOutcome {}

    record Failed(ServiceFailureException error) implements AttemptOutcome {}

    record Panicked(PanicException error) implements AttemptOutcome {}

    static AttemptOutcome success() {
        return new Success();
    }

    static AttemptOutcome failed(ServiceFailureException error) {
        return new Failed(error);
    }

    static AttemptOutcome panicked(PanicException error) {
        return new Panicked(error);
    }

    /** The attempt's error; null on success. Overridden by the failure records' accessors. */
    default SupervisorException error() {
        return null;
    }

    default boolean isFatal() {
        return this instanceof Failed f && f.error().isFatal();
    }

    default boolean isPanic() {
        return this instanceof Panicked;
    }
}
