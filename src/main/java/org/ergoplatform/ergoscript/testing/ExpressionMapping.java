package org.ergoplatform.ergoscript.testing;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Where one operation of a compiled script was written.
 *
 * @param exprType operation name as used by the evaluator, e.g. {@code GT} or {@code ValDef}
 * @param varBindings names involved in the expression, keyed by role
 * @param expandedLine line in the import-expanded code the operation was compiled from
 */
public record ExpressionMapping(
    int exprHash,
    String exprType,
    SourcePosition sourcePos,
    Map<String, String> varBindings,
    OptionalInt expandedLine
) {
    public ExpressionMapping {
        Objects.requireNonNull(exprType, "exprType");
        Objects.requireNonNull(sourcePos, "sourcePos");
        Objects.requireNonNull(expandedLine, "expandedLine");
        varBindings = Map.copyOf(varBindings);
    }

    /** Line used for nearest-line lookups: the expanded line when known. */
    int referenceLine() {
        return expandedLine.orElse(sourcePos.line());
    }
}
