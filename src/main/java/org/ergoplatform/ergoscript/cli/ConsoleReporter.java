package org.ergoplatform.ergoscript.cli;

import java.io.PrintWriter;
import org.ergoplatform.ergoscript.api.RunSummary;
import org.ergoplatform.ergoscript.testing.AssertionResult;
import org.ergoplatform.ergoscript.testing.TestResult;
import org.ergoplatform.ergoscript.testing.TestSuiteResult;
import org.ergoplatform.ergoscript.testing.TraceFormat;
import org.ergoplatform.ergoscript.testing.TraceFormatter;

/** Human-readable run report. */
final class ConsoleReporter {
    private static final String INDENT = "  ";

    private final PrintWriter out;
    private final TraceFormat traceFormat;

    ConsoleReporter(PrintWriter out, TraceFormat traceFormat) {
        this.out = out;
        this.traceFormat = traceFormat;
    }

    void report(RunSummary summary) {
        if (summary.suites().isEmpty()) {
            out.println("No test files found");
        }
        for (var suite : summary.suites()) {
            reportSuite(suite);
        }
        out.printf("%nTests: %d passed, %d failed (%d files, %dms)%n",
            summary.passed(), summary.failed(), summary.suites().size(), summary.duration().toMillis());
        out.flush();
    }

    private void reportSuite(TestSuiteResult suite) {
        out.println(suite.file());
        if (suite.tests().isEmpty()) {
            out.println(INDENT + (suite.failed() > 0 ? "✗ could not be read" : "(no tests)"));
        }
        for (var test : suite.tests()) {
            reportTest(test);
        }
    }

    private void reportTest(TestResult test) {
        out.printf("%s%s %s (%dms)%n", INDENT, test.passed() ? "✓" : "✗", test.name(), test.durationMillis());
        if (test.assertions().isEmpty()) {
            test.error().ifPresent(error -> out.println(INDENT.repeat(3) + error));
        }
        for (var assertion : test.assertions()) {
            if (!assertion.passed()) {
                out.println(INDENT.repeat(3) + assertion.message());
            }
            assertion.trace().ifPresent(trace -> {
                var report = TraceFormatter.formatEvaluation(trace, traceFormat, assertion.assertion().expression(),
                    expectedResult(assertion));
                for (var line : report.split("\n")) {
                    out.println(INDENT.repeat(3) + line);
                }
            });
        }
    }

    /** The raw contract result that makes the assertion pass. */
    private static boolean expectedResult(AssertionResult result) {
        var assertion = result.assertion();
        boolean expected = !assertion.expectsBoolean() || assertion.expectedText().equals("true");
        return assertion.assertionType().negated() != expected;
    }
}
