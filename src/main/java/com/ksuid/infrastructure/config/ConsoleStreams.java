package com.ksuid.infrastructure.config;

import java.io.PrintStream;

/**
 * Where the command line front end writes results ({@code out}) and diagnostics ({@code err}).
 */
public record ConsoleStreams(PrintStream out, PrintStream err) {

    public static ConsoleStreams system() {
        return new ConsoleStreams(System.out, System.err);
    }
}
