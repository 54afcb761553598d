package com.converge.core.engine;

/**
 * A deployment or teardown of a stage failed. Whatever executed before the
 * failure stays applied; the stage's record is left as it was.
 */
public class DeploymentException extends RuntimeException {

    private final String stage;

    public DeploymentException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
