package org.ergoplatform.ergoscript.cli;

import picocli.CommandLine;

/**
 * Reports a failed test run as one line. Rejected configuration (bad {@code ergotest.toml} values,
 * out-of-range options) exits like a usage error so it cannot be mistaken for failing tests;
 * {@code -Dergoscript.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String PREFIX = "ergoscript-test: ";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        if (ex instanceof IllegalArgumentException) {
            err.println(commandLine.getColorScheme().errorText(PREFIX + "invalid configuration: " + describe(ex)));
            printDebugTrace(ex, commandLine);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        err.println(commandLine.getColorScheme().errorText(PREFIX + describe(root)));
        printDebugTrace(ex, commandLine);
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    private static String describe(Throwable error) {
        var message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void printDebugTrace(Exception ex, CommandLine commandLine) {
        if (Boolean.getBoolean("ergoscript.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
    }
}
