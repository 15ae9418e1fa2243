package org.ergoplatform.ergoscript.imports;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.ergoplatform.ergoscript.lang.ContractCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code #import path;} directives by splicing the referenced files into the importing
 * source, recording for every produced line where it originally came from.
 *
 * <p>Paths resolve in this order: {@code lib:} and {@code src:} prefixes against the project root,
 * {@code ./} and {@code ../} against the importing file, then {@code <root>/ergoscript/<path>},
 * {@code <root>/<path>}, the importing file's directory and finally the path as given.
 *
 * <p>Each file is spliced in at most once per expansion. A later import of a file that was already
 * expanded, for example through a second branch of a diamond, leaves a comment line in its place.
 * Importing a file that is still being expanded is reported as a circular import.
 */
public final class ImportResolver {
    private static final Logger logger = LoggerFactory.getLogger(ImportResolver.class);
    private static final Pattern IMPORT = Pattern.compile("#import\\s+([^;]+);");

    private ImportResolver() {}

    public static List<ImportDirective> parseImports(String code) {
        var directives = new ArrayList<ImportDirective>();
        var matcher = IMPORT.matcher(code);
        while (matcher.find()) {
            int start = matcher.start();
            int line = 1;
            for (int i = 0; i < start; i++) {
                if (code.charAt(i) == '\n') {
                    line++;
                }
            }
            int lineStart = code.lastIndexOf('\n', start - 1) + 1;
            directives.add(new ImportDirective(matcher.group(1).trim(), line, start - lineStart + 1,
                matcher.end() - lineStart + 1));
        }
        return directives;
    }

    /**
     * @param currentFile file holding {@code code}, or {@code null} for unsaved text
     * @param workspaceRoot project root used by prefixed and root-relative imports, or {@code null}
     */
    public static ImportResult expandImports(String code, Path currentFile, Path workspaceRoot) {
        return expandImports(code, currentFile, workspaceRoot, ImportLayout.DEFAULT);
    }

    public static ImportResult expandImports(String code, Path currentFile, Path workspaceRoot, ImportLayout layout) {
        var chain = new ArrayList<String>();
        if (currentFile != null) {
            chain.add(normalize(currentFile));
        }
        return expand(code, currentFile, workspaceRoot, layout, chain, new HashSet<>(chain));
    }

    private static ImportResult expand(String code, Path currentFile, Path workspaceRoot, ImportLayout layout,
                                       List<String> chain, Set<String> expanded) {
        var fileName = currentFile == null ? ExpandedCode.UNKNOWN_FILE : normalize(currentFile);
        var imports = parseImports(code);
        if (imports.isEmpty()) {
            return new ImportResult(ExpandedCode.identity(code, fileName), List.of(), List.of());
        }
        var importsByLine = new HashMap<Integer, ImportDirective>();
        for (var directive : imports) {
            importsByLine.putIfAbsent(directive.line(), directive);
        }
        var errors = new ArrayList<String>();
        var out = new Emitter();
        var lines = code.split("\n", -1);
        boolean importingTemplate = ContractCompiler.isTemplate(code);
        for (int index = 0; index < lines.length; index++) {
            int sourceLine = index + 1;
            var here = new SourceLocation(fileName, sourceLine, 1, chain);
            var directive = importsByLine.get(sourceLine);
            if (directive == null) {
                out.emit(lines[index], here);
                continue;
            }
            var resolved = resolveImportPath(directive.path(), currentFile, workspaceRoot, layout);
            if (resolved.isEmpty()) {
                errors.add("Could not resolve import path: " + directive.path());
                out.emit("// ERROR: Could not resolve " + directive.path(), here);
                continue;
            }
            var target = normalize(resolved.get());
            if (chain.contains(target)) {
                errors.add("Circular import detected: " + directive.path());
                out.emit("// ERROR: Circular import: " + directive.path(), here);
                continue;
            }
            if (expanded.contains(target)) {
                logger.debug("Skipping repeated import {} from {}", directive.path(), fileName);
                out.emit("// Already imported: " + directive.path(), here);
                continue;
            }
            String content;
            try {
                content = Files.readString(resolved.get());
            } catch (IOException e) {
                errors.add("Failed to read import '" + directive.path() + "': " + e.getMessage());
                out.emit("// ERROR: Failed to read " + directive.path(), here);
                continue;
            }
            expanded.add(target);
            var nestedChain = new ArrayList<>(chain);
            nestedChain.add(target);
            var nested = expand(content, resolved.get(), workspaceRoot, layout, nestedChain, expanded);
            errors.addAll(nested.errors());
            var importedCode = nested.expandedCode().code();
            boolean wrap = !importingTemplate && !ContractCompiler.isTemplate(importedCode);
            logger.debug("Expanding import {} from {} ({} lines)", directive.path(), target, nested.expandedCode().totalLines());
            if (wrap) {
                out.emit("// Imported from " + directive.path(), here);
            }
            var importedLines = importedCode.split("\n", -1);
            for (int i = 0; i < importedLines.length; i++) {
                int importedLine = i + 1;
                var origin = nested.expandedCode().getOriginalLocation(importedLine)
                    .orElse(new SourceLocation(target, importedLine, 1, nestedChain));
                out.emit(importedLines[i], origin);
            }
            if (wrap) {
                out.emit("// End of import " + directive.path(), here);
            }
        }
        for (var error : errors) {
            logger.warn("{}: {}", fileName, error);
        }
        return new ImportResult(out.build(), imports, errors);
    }

    static Optional<Path> resolveImportPath(String importPath, Path currentFile, Path workspaceRoot, ImportLayout layout) {
        try {
            Path currentDir = currentFile == null ? null : currentFile.toAbsolutePath().getParent();
            if (importPath.startsWith("lib:")) {
                return workspaceRoot == null ? Optional.empty() : existing(workspaceRoot.resolve(layout.libDir()).resolve(importPath.substring(4)));
            }
            if (importPath.startsWith("src:")) {
                return workspaceRoot == null ? Optional.empty() : existing(workspaceRoot.resolve(layout.srcDir()).resolve(importPath.substring(4)));
            }
            if (importPath.startsWith("./") || importPath.startsWith("../")) {
                return currentDir == null ? Optional.empty() : existing(currentDir.resolve(importPath).normalize());
            }
            var candidates = new ArrayList<Path>();
            if (workspaceRoot != null) {
                candidates.add(workspaceRoot.resolve("ergoscript").resolve(importPath));
                candidates.add(workspaceRoot.resolve(importPath));
            }
            if (currentDir != null) {
                candidates.add(currentDir.resolve(importPath));
            }
            candidates.add(Path.of(importPath));
            for (var candidate : candidates) {
                var found = existing(candidate);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        } catch (InvalidPathException e) {
            logger.debug("Invalid import path {}: {}", importPath, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Path> existing(Path candidate) {
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    /** Collects expanded lines together with their line-map entries. */
    private static final class Emitter {
        private final List<String> lines = new ArrayList<>();
        private final Map<Integer, SourceLocation> lineMap = new HashMap<>();

        void emit(String line, SourceLocation origin) {
            lines.add(line);
            lineMap.put(lines.size(), origin);
        }

        ExpandedCode build() {
            return new ExpandedCode(String.join("\n", lines), lineMap, lines.size());
        }
    }
}
