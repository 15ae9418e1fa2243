package org.ergoplatform.ergoscript.testing;

public enum AssertionType {
    EQUALS,
    NOT_EQUALS,
    PROVABLE,
    NOT_PROVABLE;

    /** Whether the outcome of the underlying equality check is inverted. */
    public boolean negated() {
        return this == NOT_EQUALS || this == NOT_PROVABLE;
    }
}
