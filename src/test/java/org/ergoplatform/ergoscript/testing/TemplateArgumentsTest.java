package org.ergoplatform.ergoscript.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import org.ergoplatform.ergoscript.lang.CompileOptions;
import org.ergoplatform.ergoscript.lang.ContractTemplate;
import org.ergoplatform.ergoscript.lang.ErgoScriptCompiler;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class TemplateArgumentsTest {
    private static ContractTemplate template;

    @BeforeAll
    static void compileTemplate() {
        var source = "@contract def timeLock(deadline: Int = 100, strict: Boolean = false) = "
            + "sigmaProp(HEIGHT > deadline || strict)";
        template = new ErgoScriptCompiler().compile(source, CompileOptions.defaults()).template().orElseThrow();
    }

    @Test
    void readsNamedArguments() {
        assertEquals(Optional.of(Map.of("deadline", 200)), TemplateArguments.extract("timeLock(deadline = 200)", template));
    }

    @Test
    void readsPositionalArguments() {
        assertEquals(Optional.of(Map.of("deadline", 5, "strict", true)),
            TemplateArguments.extract("timeLock(5, true)", template));
    }

    @Test
    void readsLongLiterals() {
        assertEquals(Optional.of(Map.of("deadline", 7L)), TemplateArguments.extract("timeLock(7L)", template));
        assertEquals(Optional.of(Map.of("deadline", 3_000_000_000L)),
            TemplateArguments.extract("timeLock(3000000000)", template));
    }

    @Test
    void ignoresOtherCallsAndEmptyArguments() {
        assertTrue(TemplateArguments.extract("timeLock()", template).isEmpty());
        assertTrue(TemplateArguments.extract("otherLock(1)", template).isEmpty());
        assertTrue(TemplateArguments.extract("timeLock(1, true, 3)", template).isEmpty());
        assertTrue(TemplateArguments.extract("timeLock(deadline = HEIGHT)", template).isEmpty());
    }
}
