package org.ergoplatform.ergoscript.imports;

import java.util.List;

/** Result of {@link ImportResolver#expandImports}; expansion is best effort, so errors do not abort it. */
public record ImportResult(ExpandedCode expandedCode, List<ImportDirective> imports, List<String> errors) {
    public ImportResult {
        imports = List.copyOf(imports);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
