package org.ergoplatform.ergoscript.testing;

import java.util.Locale;

/** Output shape of a rendered trace. */
public enum TraceFormat {
    TREE,
    JSON,
    COMPACT;

    /**
     * @throws IllegalArgumentException for names other than tree, json and compact
     */
    public static TraceFormat from(String value) {
        if (value == null || value.isBlank()) {
            return TREE;
        }
        try {
            return TraceFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown trace format '" + value + "' (expected tree, json or compact)");
        }
    }
}
