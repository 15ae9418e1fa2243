package org.ergoplatform.ergoscript.testing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.ergoplatform.ergoscript.imports.ExpandedCode;
import org.ergoplatform.ergoscript.lang.Expr;
import org.ergoplatform.ergoscript.lang.SourceContext;

/**
 * Builds a {@link SourcePositionMap} from the positions the parser attached to a typed tree. When
 * the tree was compiled from import-expanded code, expanded lines are resolved through the line map
 * so positions point into the file the code was imported from.
 *
 * <p>Nodes are visited in post-order, children in evaluation order, the same order in which the
 * evaluator charges their cost.
 */
public final class AstSourceMapper {
    private final String fileName;
    private final Optional<ExpandedCode> expandedCode;
    private final Map<String, ExpressionMapping> byKey = new LinkedHashMap<>();

    public AstSourceMapper(String fileName, Optional<ExpandedCode> expandedCode) {
        this.fileName = fileName;
        this.expandedCode = expandedCode;
    }

    public static SourcePositionMap fromAst(Expr root, String fileName, Optional<ExpandedCode> expandedCode) {
        return new AstSourceMapper(fileName, expandedCode).extractPositions(root);
    }

    public SourcePositionMap extractPositions(Expr root) {
        byKey.clear();
        visit(root);
        var mappings = new ArrayList<>(byKey.values());
        var sourceLines = new HashMap<Integer, String>();
        for (var mapping : mappings) {
            sourceLines.putIfAbsent(mapping.sourcePos().line(), mapping.sourcePos().sourceText());
        }
        return new SourcePositionMap(mappings, sourceLines);
    }

    private void visit(Expr node) {
        for (var child : node.children()) {
            visit(child);
        }
        node.source().ifPresent(source -> record(node, source));
    }

    private void record(Expr node, SourceContext source) {
        var key = node.opName() + ":" + source.line() + ":" + source.column();
        if (byKey.containsKey(key)) {
            return;
        }
        var position = expandedCode.flatMap(code -> code.getOriginalLocation(source.line()))
            .map(origin -> new SourcePosition(origin.originalFile(), origin.originalLine(), source.column(), source.sourceLine()))
            .orElseGet(() -> new SourcePosition(fileName, source.line(), source.column(), source.sourceLine()));
        byKey.put(key, new ExpressionMapping(key.hashCode(), node.opName(), position, bindings(node),
            OptionalInt.of(source.line())));
    }

    private static Map<String, String> bindings(Expr node) {
        if (node instanceof Expr.ValDef valDef) {
            return Map.of("name", valDef.name());
        }
        if (node instanceof Expr.ValUse use) {
            return Map.of("name", use.name());
        }
        return Map.of();
    }
}
