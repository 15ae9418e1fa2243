package org.ergoplatform.ergoscript.cli;

import picocli.CommandLine;

/**
 * Entry point of the {@code ergoscript-test} jar. Exits 0 when every selected test passes, 1 when
 * any fails and 2 on invalid usage or configuration.
 */
public final class Main {
    private Main() {}

    public static CommandLine commandLine() {
        return new CommandLine(new TestCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
