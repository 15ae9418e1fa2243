package org.ergoplatform.ergoscript.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import org.ergoplatform.ergoscript.eval.RegisterId;
import org.ergoplatform.ergoscript.lang.ErgoTree;
import org.ergoplatform.ergoscript.lang.SType;
import org.junit.jupiter.api.Test;

class ContextBuilderTest {
    @Test
    void buildsContextAroundSelf() {
        var self = MockBox.withValue(1_000_000L).withRegister("R4", new RegisterValue.LongValue(42L));
        var mock = new MockContext(150, self, List.of(MockBox.withValue(5), self),
            List.of(MockBox.withValue(900_000L)), List.of(), Optional.empty());
        var contract = ErgoTree.trueTree();

        var context = ContextBuilder.build(mock, Optional.of(contract));
        assertEquals(1, context.selfIndex());
        assertEquals(1_000_000L, context.self().value());
        assertSame(contract, context.self().ergoTree());
        assertEquals(150, context.preHeader().height());
        assertEquals(1, context.spendingTransaction().outputCandidates().size());
        var register = context.self().register(RegisterId.R4).orElseThrow();
        assertEquals(SType.LONG, register.type());
        assertEquals(42L, register.value());
    }

    @Test
    void derivesDistinctDeterministicIds() {
        var self = MockBox.withValue(1);
        var mock = new MockContext(1, self, List.of(self, MockBox.withValue(2)), List.of(), List.of(), Optional.empty());
        var first = ContextBuilder.build(mock, Optional.empty());
        var second = ContextBuilder.build(mock, Optional.empty());
        assertEquals(first.boxesToSpend().get(0).id(), second.boxesToSpend().get(0).id());
        assertNotEquals(first.boxesToSpend().get(0).id(), first.boxesToSpend().get(1).id());
        assertEquals(64, first.self().id().length());
    }

    @Test
    void contextWithoutDeclarationsSpendsItsSelf() {
        var context = ContextBuilder.build(MockContext.empty(), Optional.empty());
        assertEquals(1, context.boxesToSpend().size());
        assertEquals(0, context.selfIndex());
    }

    @Test
    void rejectsEmptyInputs() {
        var self = MockBox.withValue(5).withId("aa");
        var mock = new MockContext(10, self, List.of(), List.of(), List.of(), Optional.empty());
        var error = assertThrows(ContextBuildException.class, () -> ContextBuilder.build(mock, Optional.empty()));
        assertEquals(ContextBuilder.NO_INPUTS, error.getMessage());
    }

    @Test
    void matchesSelfByExplicitId() {
        var self = MockBox.withValue(10).withId("AB01");
        var declaredAgain = MockBox.withValue(10).withId("ab01");
        var mock = new MockContext(1, self, List.of(MockBox.withValue(3), declaredAgain), List.of(), List.of(),
            Optional.empty());
        var context = ContextBuilder.build(mock, Optional.empty());
        assertEquals(1, context.selfIndex());
        assertEquals("ab01", context.self().id());
    }

    @Test
    void failsWhenSelfIsNotAnInput() {
        var mock = new MockContext(1, MockBox.withValue(1), List.of(MockBox.withValue(1)), List.of(), List.of(),
            Optional.empty());
        var error = assertThrows(ContextBuildException.class, () -> ContextBuilder.build(mock, Optional.empty()));
        assertEquals(ContextBuilder.SELF_NOT_FOUND, error.getMessage());
    }

    @Test
    void usesDeclaredPreHeader() {
        var source = String.join("\n",
            "@test def withHeader() = {",
            "  @context {",
            "    HEIGHT = 10",
            "    SELF = Box { value = 1L }",
            "    PREHEADER = PreHeader { timestamp = 1700000000000 height = 12 }",
            "  }",
            "  @assert true",
            "}");
        var mock = TestParser.parseTests(source, "x").get(0).context();
        var context = ContextBuilder.build(mock, Optional.empty());
        assertEquals(1700000000000L, context.preHeader().timestamp());
        assertEquals(12, context.preHeader().height());
    }
}
