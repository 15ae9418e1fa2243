package org.ergoplatform.ergoscript.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.ergoplatform.ergoscript.api.TestRunConfiguration;
import org.ergoplatform.ergoscript.testing.TraceFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestConfigFileTest {
    @Test
    void readsTestTable() {
        var config = TestConfigFile.parse(String.join("\n",
            "[test]",
            "trace = true",
            "trace_format = \"compact\"",
            "timeout = \"30s\"",
            "cost_limit = 500000",
            "script_version = 2",
            "lib_dir = \"shared\""));

        assertEquals(Optional.of(true), config.trace());
        assertEquals(Optional.of(TraceFormat.COMPACT), config.traceFormat());
        assertEquals(Optional.of(Duration.ofSeconds(30)), config.timeout());
        assertEquals(Optional.of(500000L), config.costLimit());
        assertEquals(Optional.of((byte) 2), config.scriptVersion());
        assertEquals(Optional.of("shared"), config.libDir());
        assertTrue(config.srcDir().isEmpty());
    }

    @Test
    void missingTableIsEmpty() {
        assertEquals(TestConfigFile.empty(), TestConfigFile.parse("[other]\nkey = 1"));
    }

    @Test
    void rejectsInvalidToml() {
        var error = assertThrows(IllegalArgumentException.class, () -> TestConfigFile.parse("[test\ntrace = "));
        assertTrue(error.getMessage().startsWith("Invalid ergotest.toml"), error.getMessage());
    }

    @Test
    void rejectsWrongTypes() {
        assertThrows(IllegalArgumentException.class, () -> TestConfigFile.parse("[test]\ntrace = \"yes\""));
        assertThrows(IllegalArgumentException.class, () -> TestConfigFile.parse("[test]\nscript_version = 300"));
    }

    @Test
    void loadsFromProjectRoot(@TempDir Path root) throws IOException {
        assertEquals(TestConfigFile.empty(), TestConfigFile.load(root));
        Files.writeString(root.resolve(TestConfigFile.FILE_NAME), "[test]\ntrace_all = true\n");
        assertEquals(Optional.of(true), TestConfigFile.load(root).traceAll());
    }

    @Test
    void appliesOnlyPresentValues() {
        var builder = TestRunConfiguration.builder().costLimit(42L).srcDir("contracts");
        TestConfigFile.parse("[test]\ntrace = true\nlib_dir = \"vendor\"").applyTo(builder);

        var configuration = builder.build();
        assertTrue(configuration.trace());
        assertEquals(42L, configuration.costLimit());
        assertEquals("vendor", configuration.libDir());
        assertEquals("contracts", configuration.srcDir());
    }
}
