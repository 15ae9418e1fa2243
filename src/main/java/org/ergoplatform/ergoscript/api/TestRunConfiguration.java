package org.ergoplatform.ergoscript.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.ergoplatform.ergoscript.eval.ErgoLikeContext;
import org.ergoplatform.ergoscript.imports.ImportLayout;
import org.ergoplatform.ergoscript.lang.CompileOptions;
import org.ergoplatform.ergoscript.lang.ErgoTree;
import org.ergoplatform.ergoscript.testing.RunnerOptions;
import org.ergoplatform.ergoscript.testing.TraceConfig;
import org.ergoplatform.ergoscript.testing.TraceFormat;

/**
 * Immutable configuration of one test run.
 *
 * @param testFiles files to run; when empty, test files are discovered under the project
 * @param traceAll attach traces to passing assertions too
 * @param scriptVersion ErgoTree version contracts are compiled to
 */
public record TestRunConfiguration(
    Path workingDirectory,
    List<Path> testFiles,
    Optional<String> filter,
    boolean trace,
    TraceFormat traceFormat,
    boolean traceAll,
    Optional<Duration> timeout,
    long costLimit,
    byte scriptVersion,
    String libDir,
    String srcDir,
    LogLevel logLevel
) {
    public TestRunConfiguration {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(traceFormat, "traceFormat");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(libDir, "libDir");
        Objects.requireNonNull(srcDir, "srcDir");
        Objects.requireNonNull(logLevel, "logLevel");
        testFiles = List.copyOf(testFiles);
        if (costLimit <= 0) {
            throw new IllegalArgumentException("Cost limit must be positive, got " + costLimit);
        }
        if (scriptVersion < 0 || scriptVersion > ErgoTree.MAX_VERSION) {
            throw new IllegalArgumentException("Unsupported script version " + scriptVersion);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public TraceConfig traceConfig() {
        return new TraceConfig(trace, traceFormat, !traceAll);
    }

    public RunnerOptions toRunnerOptions(Optional<Path> projectRoot) {
        return new RunnerOptions(
            traceConfig(),
            timeout,
            costLimit,
            CompileOptions.defaults().withTreeVersion(scriptVersion),
            projectRoot,
            new ImportLayout(libDir, srcDir));
    }

    public static final class Builder {
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private List<Path> testFiles = List.of();
        private Optional<String> filter = Optional.empty();
        private boolean trace;
        private TraceFormat traceFormat = TraceFormat.TREE;
        private boolean traceAll;
        private Optional<Duration> timeout = Optional.empty();
        private long costLimit = ErgoLikeContext.DEFAULT_COST_LIMIT;
        private byte scriptVersion = ErgoTree.DEFAULT_VERSION;
        private String libDir = ImportLayout.DEFAULT.libDir();
        private String srcDir = ImportLayout.DEFAULT.srcDir();
        private LogLevel logLevel = LogLevel.FATAL;

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder testFiles(List<Path> testFiles) {
            this.testFiles = testFiles;
            return this;
        }

        public Builder filter(Optional<String> filter) {
            this.filter = filter;
            return this;
        }

        public Builder trace(boolean trace) {
            this.trace = trace;
            return this;
        }

        public Builder traceFormat(TraceFormat traceFormat) {
            this.traceFormat = traceFormat;
            return this;
        }

        public Builder traceAll(boolean traceAll) {
            this.traceAll = traceAll;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder costLimit(long costLimit) {
            this.costLimit = costLimit;
            return this;
        }

        public Builder scriptVersion(byte scriptVersion) {
            this.scriptVersion = scriptVersion;
            return this;
        }

        public Builder libDir(String libDir) {
            this.libDir = libDir;
            return this;
        }

        public Builder srcDir(String srcDir) {
            this.srcDir = srcDir;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public TestRunConfiguration build() {
            return new TestRunConfiguration(
                workingDirectory,
                testFiles,
                filter,
                trace,
                traceFormat,
                traceAll,
                timeout,
                costLimit,
                scriptVersion,
                libDir,
                srcDir,
                logLevel
            );
        }
    }
}
