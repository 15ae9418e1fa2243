package org.ergoplatform.ergoscript.shared;

import java.util.Optional;

/**
 * Extracts brace-delimited regions from source text. Braces inside string literals and comments do
 * not count.
 */
public final class BalancedBlocks {

    /**
     * @param body text strictly between the outer braces
     * @param endPosition index just past the closing brace
     */
    public record Block(String body, int endPosition) {
    }

    private BalancedBlocks() {}

    /**
     * Skips whitespace from {@code start}, then expects an opening brace and returns the region up to
     * its matching close. Returns empty when no brace follows or the block never closes.
     */
    public static Optional<Block> extractBalancedBraces(String source, int start) {
        return extract(source, start, '{', '}');
    }

    /** Same as {@link #extractBalancedBraces} for a {@code [ ... ]} region. */
    public static Optional<Block> extractBalancedBrackets(String source, int start) {
        return extract(source, start, '[', ']');
    }

    private static Optional<Block> extract(String source, int start, char open, char close) {
        int pos = Math.max(0, start);
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        if (pos >= source.length() || source.charAt(pos) != open) {
            return Optional.empty();
        }
        int bodyStart = pos + 1;
        int depth = 1;
        int i = bodyStart;
        while (i < source.length()) {
            char c = source.charAt(i);
            char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
            if (c == '"') {
                i = skipString(source, i);
                continue;
            }
            if (c == '/' && next == '/') {
                i = skipLineComment(source, i);
                continue;
            }
            if (c == '/' && next == '*') {
                int end = source.indexOf("*/", i + 2);
                if (end < 0) {
                    return Optional.empty();
                }
                i = end + 2;
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return Optional.of(new Block(source.substring(bodyStart, i), i + 1));
                }
            }
            i++;
        }
        return Optional.empty();
    }

    private static int skipString(String source, int quote) {
        int i = quote + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"' || c == '\n') {
                return i + 1;
            }
            i++;
        }
        return i;
    }

    private static int skipLineComment(String source, int start) {
        int end = source.indexOf('\n', start);
        return end < 0 ? source.length() : end;
    }
}
