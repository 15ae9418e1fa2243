package org.ergoplatform.ergoscript.imports;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Source text after import expansion, with a line map back to the original files.
 *
 * @param code expanded text
 * @param lineMap 1-based expanded line to its origin; has an entry for every line of {@code code}
 * @param totalLines number of lines in {@code code}
 */
public record ExpandedCode(String code, Map<Integer, SourceLocation> lineMap, int totalLines) {
    public static final String UNKNOWN_FILE = "<unknown>";

    public ExpandedCode {
        lineMap = Map.copyOf(lineMap);
    }

    /** Maps every line of {@code code} to the same line of {@code file}. */
    public static ExpandedCode identity(String code, String file) {
        var lines = code.split("\n", -1);
        var map = new HashMap<Integer, SourceLocation>();
        for (int i = 1; i <= lines.length; i++) {
            map.put(i, new SourceLocation(file, i, 1, List.of()));
        }
        return new ExpandedCode(code, map, lines.length);
    }

    public Optional<SourceLocation> getOriginalLocation(int expandedLine) {
        return Optional.ofNullable(lineMap.get(expandedLine));
    }

    /** Whole lines are spliced, so the column carries over unchanged. */
    public Optional<SourceLocation> getOriginalLocation(int expandedLine, int expandedColumn) {
        return getOriginalLocation(expandedLine).map(location -> location.withColumn(expandedColumn));
    }

    /**
     * Renders {@code file:line[, column C]: message} at the original position, followed by the import
     * chain when the line was imported.
     */
    public String formatError(String message, int expandedLine, OptionalInt expandedColumn) {
        var columnText = expandedColumn.isPresent() ? ", column " + expandedColumn.getAsInt() : "";
        var location = getOriginalLocation(expandedLine, expandedColumn.orElse(1));
        if (location.isEmpty()) {
            return "line " + expandedLine + columnText + ": " + message;
        }
        var loc = location.get();
        var chain = loc.importChain().size() > 1 ? "\n  Import chain: " + String.join(" -> ", loc.importChain()) : "";
        return loc.originalFile() + ":" + loc.originalLine() + columnText + ": " + message + chain;
    }

    public String[] lines() {
        return code.split("\n", -1);
    }
}
