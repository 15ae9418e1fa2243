package org.ergoplatform.ergoscript.imports;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImportResolverTest {
    @TempDir
    Path workspace;

    @Test
    void codeWithoutImportsMapsToItself() {
        var result = ImportResolver.expandImports("val a = 1\nval b = 2\na + b", null, null);
        var expanded = result.expandedCode();
        assertFalse(result.hasErrors());
        assertEquals("val a = 1\nval b = 2\na + b", expanded.code());
        assertEquals(3, expanded.totalLines());
        var location = expanded.getOriginalLocation(2).orElseThrow();
        assertEquals(ExpandedCode.UNKNOWN_FILE, location.originalFile());
        assertEquals(2, location.originalLine());
    }

    @Test
    void parsesDirectivePositions() {
        var directives = ImportResolver.parseImports("// header\n  #import lib:utils.es;\n");
        assertEquals(1, directives.size());
        assertEquals("lib:utils.es", directives.get(0).path());
        assertEquals(2, directives.get(0).line());
        assertEquals(3, directives.get(0).startColumn());
    }

    @Test
    void splicesRelativeImportAndTracksOrigins() throws IOException {
        var helper = Files.writeString(workspace.resolve("helper.es"), "val x = 1\nval z = 3");
        var main = workspace.resolve("main.es");
        var code = "#import ./helper.es;\nval y = 2";
        Files.writeString(main, code);

        var result = ImportResolver.expandImports(code, main, workspace);
        var expanded = result.expandedCode();
        assertFalse(result.hasErrors());
        assertEquals("// Imported from ./helper.es\nval x = 1\nval z = 3\n// End of import ./helper.es\nval y = 2",
            expanded.code());

        var imported = expanded.getOriginalLocation(3).orElseThrow();
        assertEquals(helper.toAbsolutePath().normalize().toString(), imported.originalFile());
        assertEquals(2, imported.originalLine());
        assertEquals(2, imported.importChain().size());

        var local = expanded.getOriginalLocation(5).orElseThrow();
        assertEquals(main.toAbsolutePath().normalize().toString(), local.originalFile());
        assertEquals(2, local.originalLine());
    }

    @Test
    void reportsCircularImports() throws IOException {
        var a = workspace.resolve("a.es");
        Files.writeString(a, "#import ./b.es;\nval a = 1");
        Files.writeString(workspace.resolve("b.es"), "#import ./a.es;\nval b = 2");

        var result = ImportResolver.expandImports(Files.readString(a), a, workspace);
        assertTrue(result.hasErrors());
        assertTrue(result.errors().get(0).contains("Circular import"), result.errors().toString());
        assertTrue(result.expandedCode().code().contains("val b = 2"));
        assertTrue(result.expandedCode().code().contains("// ERROR: Circular import: ./a.es"));
    }

    @Test
    void sharedDependencyIsSplicedOnce() throws IOException {
        var shared = Files.writeString(workspace.resolve("d.es"), "def helper(x: Int): Boolean = x > 1");
        Files.writeString(workspace.resolve("b.es"), "#import ./d.es;\nval b = 1");
        var c = Files.writeString(workspace.resolve("c.es"), "#import ./d.es;\nval c = 2");
        var main = workspace.resolve("a.es");
        var code = "#import ./b.es;\n#import ./c.es;\nhelper(5)";
        Files.writeString(main, code);

        var result = ImportResolver.expandImports(code, main, workspace);
        assertFalse(result.hasErrors(), result.errors().toString());
        var expanded = result.expandedCode();
        assertEquals(String.join("\n",
            "// Imported from ./b.es",
            "// Imported from ./d.es",
            "def helper(x: Int): Boolean = x > 1",
            "// End of import ./d.es",
            "val b = 1",
            "// End of import ./b.es",
            "// Imported from ./c.es",
            "// Already imported: ./d.es",
            "val c = 2",
            "// End of import ./c.es",
            "helper(5)"), expanded.code());

        var definition = expanded.getOriginalLocation(3).orElseThrow();
        assertEquals(shared.toAbsolutePath().normalize().toString(), definition.originalFile());
        assertEquals(1, definition.originalLine());
        var placeholder = expanded.getOriginalLocation(8).orElseThrow();
        assertEquals(c.toAbsolutePath().normalize().toString(), placeholder.originalFile());
        assertEquals(1, placeholder.originalLine());
        var tail = expanded.getOriginalLocation(11).orElseThrow();
        assertEquals(main.toAbsolutePath().normalize().toString(), tail.originalFile());
        assertEquals(3, tail.originalLine());
    }

    @Test
    void repeatedImportInOneFileIsSkipped() throws IOException {
        Files.writeString(workspace.resolve("helper.es"), "val x = 1");
        var main = workspace.resolve("main.es");

        var result = ImportResolver.expandImports("#import ./helper.es;\n#import helper.es;\nx", main, workspace);
        assertFalse(result.hasErrors(), result.errors().toString());
        assertEquals("// Imported from ./helper.es\nval x = 1\n// End of import ./helper.es\n"
            + "// Already imported: helper.es\nx", result.expandedCode().code());
    }

    @Test
    void contractInImportingFileSuppressesBoundaryComments() throws IOException {
        var helper = Files.writeString(workspace.resolve("helper.es"), "val two = 2\nval three = 3");
        var main = workspace.resolve("lock.es");
        var code = "#import ./helper.es;\n@contract def lock(h: Int = 1) = sigmaProp(HEIGHT > h + two)";
        Files.writeString(main, code);

        var expanded = ImportResolver.expandImports(code, main, workspace).expandedCode();
        assertEquals("val two = 2\nval three = 3\n@contract def lock(h: Int = 1) = sigmaProp(HEIGHT > h + two)",
            expanded.code());
        assertFalse(expanded.code().contains("// Imported from"));
        assertFalse(expanded.code().contains("// End of import"));
        assertLocation(expanded, 1, helper, 1);
        assertLocation(expanded, 2, helper, 2);
        assertLocation(expanded, 3, main, 2);
    }

    @Test
    void paramDocsInImportedFileSuppressBoundaryComments() throws IOException {
        var helper = Files.writeString(workspace.resolve("helper.es"), "/** @param limit lower bound */\nval two = 2");
        var main = workspace.resolve("main.es");
        var code = "#import ./helper.es;\ntwo";
        Files.writeString(main, code);

        var expanded = ImportResolver.expandImports(code, main, workspace).expandedCode();
        assertEquals("/** @param limit lower bound */\nval two = 2\ntwo", expanded.code());
        assertLocation(expanded, 1, helper, 1);
        assertLocation(expanded, 2, helper, 2);
        assertLocation(expanded, 3, main, 2);
    }

    private static void assertLocation(ExpandedCode expanded, int expandedLine, Path file, int line) {
        var location = expanded.getOriginalLocation(expandedLine).orElseThrow();
        assertEquals(file.toAbsolutePath().normalize().toString(), location.originalFile());
        assertEquals(line, location.originalLine());
    }

    @Test
    void unresolvedImportBecomesComment() {
        var result = ImportResolver.expandImports("#import ./missing.es;\ntrue", workspace.resolve("main.es"), workspace);
        assertEquals(1, result.errors().size());
        assertEquals("Could not resolve import path: ./missing.es", result.errors().get(0));
        assertEquals("// ERROR: Could not resolve ./missing.es\ntrue", result.expandedCode().code());
    }

    @Test
    void resolvesLibPrefixAgainstLayout() throws IOException {
        Files.createDirectories(workspace.resolve("contracts/shared"));
        Files.writeString(workspace.resolve("contracts/shared/math.es"), "val two = 2");
        var layout = new ImportLayout("contracts/shared", "src");

        var result = ImportResolver.expandImports("#import lib:math.es;\ntwo", null, workspace, layout);
        assertFalse(result.hasErrors(), result.errors().toString());
        assertTrue(result.expandedCode().code().contains("val two = 2"));

        var withDefaults = ImportResolver.expandImports("#import lib:math.es;\ntwo", null, workspace);
        assertTrue(withDefaults.hasErrors());
    }

    @Test
    void formatsErrorsAtOriginalPosition() throws IOException {
        var helper = Files.writeString(workspace.resolve("helper.es"), "val x = 1\nval broken = ");
        var main = workspace.resolve("main.es");
        var code = "#import ./helper.es;\nx";
        Files.writeString(main, code);

        var expanded = ImportResolver.expandImports(code, main, workspace).expandedCode();
        var message = expanded.formatError("Unexpected end of input", 3, OptionalInt.of(14));
        assertTrue(message.startsWith(helper.toAbsolutePath().normalize() + ":2, column 14: Unexpected end of input"),
            message);
        assertTrue(message.contains("Import chain: "), message);
    }
}
