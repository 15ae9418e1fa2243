package org.ergoplatform.ergoscript.imports;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** Locates the ErgoScript project a file belongs to. */
public final class ProjectRoots {
    /** Checked in priority order in every directory. */
    public static final List<String> MARKERS = List.of("ergo.json", "ergoproject.json", ".ergoscript", "ergoscript", ".git");

    private ProjectRoots() {}

    /**
     * Walks up from {@code start} (a file or directory) to the first directory holding one of the
     * {@link #MARKERS}.
     */
    public static Optional<Path> findProjectRoot(Path start) {
        if (start == null) {
            return Optional.empty();
        }
        Path current = start.toAbsolutePath().normalize();
        if (!Files.isDirectory(current)) {
            current = current.getParent();
        }
        while (current != null) {
            for (String marker : MARKERS) {
                if (Files.exists(current.resolve(marker))) {
                    return Optional.of(current);
                }
            }
            current = current.getParent();
        }
        return Optional.empty();
    }
}
