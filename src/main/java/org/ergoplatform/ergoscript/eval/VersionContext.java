package org.ergoplatform.ergoscript.eval;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide script version in effect during an evaluation. It is only set inside
 * {@link #withVersions}, which holds a lock for the whole set-evaluate-restore sequence.
 */
public final class VersionContext {
    private static final ReentrantLock LOCK = new ReentrantLock();
    private static VersionContext current;

    private final byte activatedVersion;
    private final byte ergoTreeVersion;

    private VersionContext(byte activatedVersion, byte ergoTreeVersion) {
        this.activatedVersion = activatedVersion;
        this.ergoTreeVersion = ergoTreeVersion;
    }

    public byte activatedVersion() {
        return activatedVersion;
    }

    public byte ergoTreeVersion() {
        return ergoTreeVersion;
    }

    public static <T> T withVersions(byte activatedVersion, byte ergoTreeVersion, Supplier<T> action) {
        LOCK.lock();
        var previous = current;
        try {
            current = new VersionContext(activatedVersion, ergoTreeVersion);
            return action.get();
        } finally {
            current = previous;
            LOCK.unlock();
        }
    }

    public static boolean isSet() {
        LOCK.lock();
        try {
            return current != null;
        } finally {
            LOCK.unlock();
        }
    }

    /**
     * @throws IllegalStateException outside of {@link #withVersions}
     */
    public static VersionContext current() {
        LOCK.lock();
        try {
            if (current == null) {
                throw new IllegalStateException("VersionContext is not set, evaluate inside VersionContext.withVersions");
            }
            return current;
        } finally {
            LOCK.unlock();
        }
    }
}
