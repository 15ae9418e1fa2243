package org.ergoplatform.ergoscript.lang;

/**
 * Position of a node in the compiled (possibly import-expanded) source.
 *
 * @param line 1-based line in the compiled text
 * @param column 1-based column in the compiled text
 * @param sourceLine full text of that line
 */
public record SourceContext(int line, int column, String sourceLine) {
    public SourceContext {
        sourceLine = sourceLine == null ? "" : sourceLine;
    }

    public String describe() {
        return "line " + line + ":" + column;
    }
}
