package org.ergoplatform.ergoscript.testing;

import java.util.List;

/** A parsed {@code @test def name() = { ... }} block; line and column are 1-based. */
public record TestDefinition(String name, MockContext context, List<TestAssertion> assertions, int line, int column) {
    public TestDefinition {
        assertions = List.copyOf(assertions);
    }
}
