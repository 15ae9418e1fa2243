package org.ergoplatform.ergoscript.imports;

import java.util.Objects;

/**
 * Project directories that {@code lib:} and {@code src:} imports resolve against, relative to the
 * project root.
 */
public record ImportLayout(String libDir, String srcDir) {
    public static final ImportLayout DEFAULT = new ImportLayout("lib", "src");

    public ImportLayout {
        Objects.requireNonNull(libDir, "libDir");
        Objects.requireNonNull(srcDir, "srcDir");
    }
}
