package com.libragraph.keeper.core.service;

/**
 * Thrown by a {@link Service} to mark a failure that restarting cannot fix, such as
 * invalid configuration. Supervision stops on the first occurrence.
 */
public class FatalServiceException extends Exception {

    public FatalServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public FatalServiceException(String message) {
        super(message);
    }
}
