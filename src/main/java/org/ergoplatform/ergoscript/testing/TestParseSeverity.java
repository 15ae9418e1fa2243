package org.ergoplatform.ergoscript.testing;

public enum TestParseSeverity {
    ERROR,
    WARNING
}
