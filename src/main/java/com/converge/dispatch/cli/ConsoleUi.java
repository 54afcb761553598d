package com.converge.dispatch.cli;

import com.converge.core.executor.Ui;

/**
 * Prints executor progress messages to the terminal.
 */
public class ConsoleUi implements Ui {

    @Override
    public void write(String message) {
        ConsoleOutput.progress(message.strip());
    }
}
