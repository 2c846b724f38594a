package com.libragraph.keeper.core.error;

/**
 * Root of the errors that leave a supervision run.
 */
public class SupervisorException extends RuntimeException {

    public SupervisorException(String message, Throwable cause) {
        super(message, cause);
    }

    public SupervisorException(String message) {
        super(message);
    }
}
