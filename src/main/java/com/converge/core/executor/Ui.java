package com.converge.core.executor;

/**
 * Sink for progress messages printed while a plan runs.
 */
@FunctionalInterface
public interface Ui {

    void write(String message);
}
