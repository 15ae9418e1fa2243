package org.ergoplatform.ergoscript.data;

/** Runtime value of a two-element tuple. */
public record Pair(Object first, Object second) {
    public Object field(int index) {
        return switch (index) {
            case 1 -> first;
            case 2 -> second;
            default -> throw new IllegalArgumentException("Tuple field _" + index + " does not exist");
        };
    }
}
