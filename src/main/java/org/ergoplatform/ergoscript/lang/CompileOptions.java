package org.ergoplatform.ergoscript.lang;

/**
 * Compiler settings.
 *
 * @param treeVersion ErgoTree version written into the compiled tree
 * @param name contract name used when the source is not a template
 * @param description contract description used when the source is not a template
 */
public record CompileOptions(byte treeVersion, String name, String description) {
    public static CompileOptions defaults() {
        return new CompileOptions(ErgoTree.DEFAULT_VERSION, "contract", "");
    }

    public CompileOptions withTreeVersion(byte version) {
        return new CompileOptions(version, name, description);
    }
}
