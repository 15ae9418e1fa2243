package org.ergoplatform.ergoscript.api;

import java.util.Arrays;
import java.util.Locale;

/**
 * Diagnostic log thresholds accepted by {@code --log-level} and {@code ERGOSCRIPT_LOG_LEVEL}. Test
 * results are printed regardless of the level; only engine logging is filtered.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    /** Quietest setting; the simple SLF4J binding has no fatal level, so it filters at error. */
    FATAL("error");

    private final String slf4jName;

    LogLevel(String slf4jName) {
        this.slf4jName = slf4jName;
    }

    /** Blank means the quiet default; {@code warning} is accepted for {@link #WARN}. */
    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARNING")) {
            return WARN;
        }
        return Arrays.stream(values())
            .filter(level -> level.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported log level: " + value
                + " (expected one of trace, debug, info, warn, error, fatal)"));
    }

    public String slf4jName() {
        return slf4jName;
    }
}
