package com.converge.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Converge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CONVERGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CONVERGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) >|@ " + message));
    }

    public static void report(String report) {
        System.out.println("──────────────────────────────────");
        System.out.print(report);
    }
}
