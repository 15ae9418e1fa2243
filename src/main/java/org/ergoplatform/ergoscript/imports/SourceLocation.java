package org.ergoplatform.ergoscript.imports;

import java.util.List;

/** Where a line of expanded code came from, with the files traversed to reach it. */
public record SourceLocation(String originalFile, int originalLine, int originalColumn, List<String> importChain) {
    public SourceLocation {
        importChain = List.copyOf(importChain);
    }

    public SourceLocation withColumn(int column) {
        return new SourceLocation(originalFile, originalLine, column, importChain);
    }
}
