package org.ergoplatform.ergoscript.imports;

/**
 * One {@code #import path;} occurrence. Line and columns are 1-based, {@code endColumn} is
 * exclusive.
 */
public record ImportDirective(String path, int line, int startColumn, int endColumn) {
}
