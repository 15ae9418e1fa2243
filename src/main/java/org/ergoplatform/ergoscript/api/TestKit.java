package org.ergoplatform.ergoscript.api;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.ergoplatform.ergoscript.imports.ProjectRoots;
import org.ergoplatform.ergoscript.lang.ContractCompiler;
import org.ergoplatform.ergoscript.lang.ErgoScriptCompiler;
import org.ergoplatform.ergoscript.testing.TestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point for running ErgoScript test files from code or from the command line.
 */
public final class TestKit {
    private static final Logger logger = LoggerFactory.getLogger(TestKit.class);
    static final String TESTS_DIRECTORY = "tests";

    private final ContractCompiler compiler;

    public TestKit() {
        this(new ErgoScriptCompiler());
    }

    public TestKit(ContractCompiler compiler) {
        this.compiler = compiler;
    }

    public RunSummary run(TestRunConfiguration configuration) {
        var started = Instant.now();
        var projectRoot = ProjectRoots.findProjectRoot(configuration.workingDirectory());
        var files = configuration.testFiles().isEmpty()
            ? discover(configuration.workingDirectory(), projectRoot)
            : configuration.testFiles();
        logger.debug("Running {} test file(s), project root {}", files.size(), projectRoot.map(Path::toString).orElse("<none>"));
        var runner = new TestRunner(compiler, configuration.toRunnerOptions(projectRoot));
        var suites = runner.runTestFiles(files, TestRunner.nameFilter(configuration.filter().orElse(null)));
        return RunSummary.of(suites, started);
    }

    /** {@code *.test.es} files under {@code <project>/tests}, or under the working directory without one. */
    static List<Path> discover(Path workingDirectory, Optional<Path> projectRoot) {
        var testsDirectory = projectRoot.orElse(workingDirectory).resolve(TESTS_DIRECTORY);
        var searchRoot = Files.isDirectory(testsDirectory) ? testsDirectory : workingDirectory;
        return TestRunner.discoverTestFiles(searchRoot);
    }
}
