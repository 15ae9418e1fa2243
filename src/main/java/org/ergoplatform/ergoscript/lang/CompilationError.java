package org.ergoplatform.ergoscript.lang;

import java.util.ArrayList;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Compiler failure reduced to a message and a best-effort position in the compiled text.
 */
public record CompilationError(String message, OptionalInt line, OptionalInt column) {
    private static final Pattern AT_LINE_COLUMN = Pattern.compile("at line (\\d+), column (\\d+)");
    private static final Pattern POSITION = Pattern.compile("Position (\\d+):(\\d+)");
    private static final Pattern LINE_PREFIX = Pattern.compile("(?m)^line (\\d+):");
    private static final Pattern CARET_LINE = Pattern.compile("^\\s*\\^\\s*$");

    /**
     * Uses the structured position of a {@link CompilerException} when present, otherwise scrapes
     * the message for one of the position formats compilers print.
     */
    public static CompilationError from(Throwable failure) {
        var raw = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        Optional<SourceContext> source = failure instanceof CompilerException ce ? ce.source() : Optional.empty();
        if (source.isPresent()) {
            return new CompilationError(clean(raw), OptionalInt.of(source.get().line()), OptionalInt.of(source.get().column()));
        }
        return fromMessage(raw);
    }

    public static CompilationError fromMessage(String raw) {
        var atLine = AT_LINE_COLUMN.matcher(raw);
        if (atLine.find()) {
            return new CompilationError(clean(raw), parse(atLine.group(1)), parse(atLine.group(2)));
        }
        var position = POSITION.matcher(raw);
        if (position.find()) {
            return new CompilationError(clean(raw), parse(position.group(1)), parse(position.group(2)));
        }
        var linePrefix = LINE_PREFIX.matcher(raw);
        if (linePrefix.find()) {
            return new CompilationError(clean(raw), parse(linePrefix.group(1)), caretColumn(raw));
        }
        return new CompilationError(clean(raw), OptionalInt.empty(), OptionalInt.empty());
    }

    /** Keeps the first line of the message without the position suffix, echoed source and caret. */
    static String clean(String raw) {
        var kept = new ArrayList<String>();
        for (var line : raw.split("\n")) {
            if (CARET_LINE.matcher(line).matches() || line.isBlank()) {
                continue;
            }
            kept.add(LINE_PREFIX.matcher(line).replaceFirst("").strip());
        }
        var message = kept.isEmpty() ? raw.strip() : kept.get(0);
        message = AT_LINE_COLUMN.matcher(message).replaceAll("").strip();
        message = POSITION.matcher(message).replaceAll("").strip();
        return message.isEmpty() ? raw.strip() : message;
    }

    private static OptionalInt caretColumn(String raw) {
        for (var line : raw.split("\n")) {
            if (CARET_LINE.matcher(line).matches()) {
                return OptionalInt.of(line.indexOf('^') + 1);
            }
        }
        return OptionalInt.empty();
    }

    private static OptionalInt parse(String digits) {
        return OptionalInt.of(Integer.parseInt(digits));
    }
}
