package com.converge.core.build;

/**
 * A local build step could not complete. Raised before any remote call is made.
 */
public class BuildException extends RuntimeException {

    public BuildException(String message) {
        super(message);
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
