package org.ergoplatform.ergoscript.testing;

import java.util.Objects;
import java.util.Optional;

/**
 * @param message {@code ✓ label} when passed, otherwise what was expected and what was found
 * @param trace evaluation trace, attached according to the run's {@link TraceConfig}
 */
public record AssertionResult(TestAssertion assertion, boolean passed, String message, Optional<TracedEvaluation> trace) {
    public AssertionResult {
        Objects.requireNonNull(assertion, "assertion");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(trace, "trace");
    }

    static AssertionResult failed(TestAssertion assertion, String message) {
        return new AssertionResult(assertion, false, message, Optional.empty());
    }
}
