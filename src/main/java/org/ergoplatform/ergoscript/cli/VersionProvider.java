package org.ergoplatform.ergoscript.cli;

import org.ergoplatform.ergoscript.lang.ErgoTree;
import picocli.CommandLine;

/** Tool version from the jar manifest, plus the highest script version the evaluator accepts. */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var manifestVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "ergoscript-test " + (manifestVersion == null ? "development" : manifestVersion),
            "script versions 0-" + ErgoTree.MAX_VERSION
        };
    }
}
