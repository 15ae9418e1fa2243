package org.ergoplatform.ergoscript.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.ergoplatform.ergoscript.api.LogLevel;
import org.ergoplatform.ergoscript.api.RunSummary;
import org.ergoplatform.ergoscript.api.TestKit;
import org.ergoplatform.ergoscript.api.TestRunConfiguration;
import org.ergoplatform.ergoscript.config.TestConfigFile;
import org.ergoplatform.ergoscript.imports.ProjectRoots;
import org.ergoplatform.ergoscript.shared.DurationParser;
import org.ergoplatform.ergoscript.testing.TestRunner;
import org.ergoplatform.ergoscript.testing.TraceFormat;
import picocli.CommandLine;

@CommandLine.Command(
    name = "ergoscript-test",
    description = "Run the @test blocks of ErgoScript test files.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TestCommand implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";
    static final String LOG_LEVEL_ENV = "ERGOSCRIPT_LOG_LEVEL";

    @CommandLine.Parameters(
        paramLabel = "PATH",
        description = "Test files or directories (default: <project>/tests or the current directory).",
        arity = "0..*"
    )
    private List<Path> paths = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--filter"},
        description = "Only run tests whose name matches this glob (e.g. 'check*').",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String filter;

    @CommandLine.Option(
        names = "--trace",
        description = "Attach evaluation traces to failed assertions."
    )
    private Boolean trace;

    @CommandLine.Option(
        names = "--trace-format",
        description = "Trace output shape (tree|json|compact).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String traceFormat;

    @CommandLine.Option(
        names = "--trace-all",
        description = "Attach traces to passing assertions too (implies --trace)."
    )
    private Boolean traceAll;

    @CommandLine.Option(
        names = "--timeout",
        description = "Wall-clock limit per test (e.g. 500ms, 30s, 2m; 0 disables).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--cost-limit",
        description = "Evaluation cost budget per assertion.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Long costLimit;

    @CommandLine.Option(
        names = "--script-version",
        description = "ErgoTree version contracts are compiled to (0-3).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Byte scriptVersion;

    @CommandLine.Option(
        names = "--json",
        description = "Print the results as JSON instead of the console report."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = resolveLogLevel();
        if (System.getProperty(LOG_LEVEL_PROPERTY) == null) {
            System.setProperty(LOG_LEVEL_PROPERTY, logLevel.slf4jName());
        }

        Path workingDirectory = Path.of("").toAbsolutePath();
        TestRunConfiguration.Builder builder = TestRunConfiguration.builder()
            .workingDirectory(workingDirectory)
            .logLevel(logLevel);
        ProjectRoots.findProjectRoot(workingDirectory)
            .map(TestConfigFile::load)
            .ifPresent(file -> file.applyTo(builder));
        applyCommandLine(builder);

        TestRunConfiguration configuration = builder.build();
        RunSummary summary = new TestKit().run(configuration);

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(summary.toPrettyJson());
            out.flush();
        } else {
            new ConsoleReporter(out, configuration.traceFormat()).report(summary);
        }
        return summary.status().exitCode();
    }

    private void applyCommandLine(TestRunConfiguration.Builder builder) {
        if (!paths.isEmpty()) {
            builder.testFiles(expandPaths(paths));
        }
        builder.filter(Optional.ofNullable(filter).filter(value -> !value.isBlank()));
        if (trace != null) {
            builder.trace(trace);
        }
        if (traceAll != null) {
            builder.traceAll(traceAll);
            if (traceAll) {
                builder.trace(true);
            }
        }
        if (traceFormat != null) {
            builder.traceFormat(TraceFormat.from(traceFormat));
        }
        if (timeoutRaw != null) {
            builder.timeout(DurationParser.parse(timeoutRaw));
        }
        if (costLimit != null) {
            builder.costLimit(costLimit);
        }
        if (scriptVersion != null) {
            builder.scriptVersion(scriptVersion);
        }
    }

    private List<Path> expandPaths(List<Path> requested) {
        List<Path> files = new ArrayList<>();
        for (Path path : requested) {
            if (Files.isDirectory(path)) {
                files.addAll(TestRunner.discoverTestFiles(path));
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                throw new CommandLine.ParameterException(spec.commandLine(), "No such test file or directory: " + path);
            }
        }
        return files;
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(LOG_LEVEL_ENV);
        }
        if (candidate == null || candidate.isBlank()) {
            candidate = "fatal";
        }
        return LogLevel.from(candidate);
    }
}
