package org.ergoplatform.ergoscript.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ergoplatform.ergoscript.testing.AssertionResult;
import org.ergoplatform.ergoscript.testing.TestResult;
import org.ergoplatform.ergoscript.testing.TestSuiteResult;
import org.ergoplatform.ergoscript.testing.TraceFormatter;

/**
 * Outcome of a {@link TestKit} run over one or more test files.
 */
public record RunSummary(Status status, List<TestSuiteResult> suites, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunSummary {
        suites = List.copyOf(suites);
    }

    public static RunSummary of(List<TestSuiteResult> suites, Instant startedAt) {
        boolean failed = suites.stream().anyMatch(suite -> suite.failed() > 0);
        return new RunSummary(failed ? Status.FAILURE : Status.SUCCESS, suites, startedAt, Instant.now());
    }

    public int passed() {
        return suites.stream().mapToInt(TestSuiteResult::passed).sum();
    }

    public int failed() {
        return suites.stream().mapToInt(TestSuiteResult::failed).sum();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("passed", passed());
        serializable.put("failed", failed());
        serializable.put("durationMs", duration().toMillis());
        var files = new ArrayList<Map<String, Object>>();
        for (var suite : suites) {
            files.add(suiteMap(suite));
        }
        serializable.put("suites", files);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    private static Map<String, Object> suiteMap(TestSuiteResult suite) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", suite.file());
        map.put("passed", suite.passed());
        map.put("failed", suite.failed());
        map.put("durationMs", suite.durationMillis());
        var tests = new ArrayList<Map<String, Object>>();
        for (var test : suite.tests()) {
            tests.add(testMap(test));
        }
        map.put("tests", tests);
        return map;
    }

    private static Map<String, Object> testMap(TestResult test) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", test.name());
        map.put("passed", test.passed());
        map.put("durationMs", test.durationMillis());
        test.error().ifPresent(error -> map.put("error", error));
        var assertions = new ArrayList<Map<String, Object>>();
        for (var assertion : test.assertions()) {
            assertions.add(assertionMap(assertion));
        }
        map.put("assertions", assertions);
        return map;
    }

    private static Map<String, Object> assertionMap(AssertionResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("expression", result.assertion().expression());
        result.assertion().description().ifPresent(description -> map.put("description", description));
        map.put("passed", result.passed());
        map.put("message", result.message());
        result.trace().ifPresent(trace -> {
            map.put("totalCost", trace.totalCost());
            map.put("operationCount", trace.operationCount());
            map.put("trace", TraceFormatter.toJson(trace.rootTrace()));
        });
        return map;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
