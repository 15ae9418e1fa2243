package org.ergoplatform.ergoscript.testing;

/** A mock context cannot be turned into an evaluation context. Fails the one test it belongs to. */
public class ContextBuildException extends RuntimeException {
    public ContextBuildException(String message) {
        super(message);
    }

    public ContextBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
