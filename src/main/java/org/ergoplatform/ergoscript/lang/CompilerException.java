package org.ergoplatform.ergoscript.lang;

import java.util.Optional;

/**
 * Raised by the front-end for lexical, syntax and type errors. When a position is known the
 * message ends with {@code at line N, column C}.
 */
public class CompilerException extends RuntimeException {
    private final transient SourceContext source;

    public CompilerException(String message, SourceContext source) {
        super(source == null ? message : message + " at line " + source.line() + ", column " + source.column());
        this.source = source;
    }

    public CompilerException(String message) {
        this(message, null);
    }

    public Optional<SourceContext> source() {
        return Optional.ofNullable(source);
    }
}
