package org.ergoplatform.ergoscript.lang;

import java.util.Optional;

/** Output of {@link ContractCompiler#compile}. */
public record CompilationResult(Expr typedExpr, ErgoTree ergoTree, Optional<ContractTemplate> template) {
    public boolean isTemplate() {
        return template.isPresent();
    }
}
