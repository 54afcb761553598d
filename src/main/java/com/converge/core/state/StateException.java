package com.converge.core.state;

/**
 * The deployed-resources record could not be read or written.
 */
public class StateException extends RuntimeException {

    public StateException(String message, Throwable cause) {
        super(message, cause);
    }
}
