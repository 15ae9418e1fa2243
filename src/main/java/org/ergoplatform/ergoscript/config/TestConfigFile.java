package org.ergoplatform.ergoscript.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;
import org.ergoplatform.ergoscript.api.TestRunConfiguration;
import org.ergoplatform.ergoscript.shared.DurationParser;
import org.ergoplatform.ergoscript.testing.TraceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlTable;

/**
 * The {@code [test]} table of a project's {@code ergotest.toml}. Every key is optional:
 *
 * <pre>
 * [test]
 * trace = true
 * trace_format = "compact"
 * trace_all = false
 * timeout = "30s"
 * cost_limit = 1000000
 * script_version = 3
 * lib_dir = "lib"
 * src_dir = "src"
 * </pre>
 */
public record TestConfigFile(
    Optional<Boolean> trace,
    Optional<TraceFormat> traceFormat,
    Optional<Boolean> traceAll,
    Optional<Duration> timeout,
    Optional<Long> costLimit,
    Optional<Byte> scriptVersion,
    Optional<String> libDir,
    Optional<String> srcDir
) {
    private static final Logger logger = LoggerFactory.getLogger(TestConfigFile.class);

    public static final String FILE_NAME = "ergotest.toml";

    public static TestConfigFile empty() {
        return new TestConfigFile(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    /** Reads {@code ergotest.toml} from {@code projectRoot}; a missing file yields {@link #empty()}. */
    public static TestConfigFile load(Path projectRoot) {
        var file = projectRoot.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return empty();
        }
        try {
            var config = parse(Files.readString(file, StandardCharsets.UTF_8));
            logger.debug("Loaded test configuration from {}", file);
            return config;
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * @throws IllegalArgumentException for TOML syntax errors and values of the wrong type or range
     */
    public static TestConfigFile parse(String raw) {
        var result = Toml.parse(raw);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid " + FILE_NAME + ": " + errors);
        }
        TomlTable table = result.getTable("test");
        if (table == null) {
            return empty();
        }
        try {
            return new TestConfigFile(
                Optional.ofNullable(table.getBoolean("trace")),
                Optional.ofNullable(table.getString("trace_format")).map(TraceFormat::from),
                Optional.ofNullable(table.getBoolean("trace_all")),
                Optional.ofNullable(table.getString("timeout")).flatMap(DurationParser::parse),
                Optional.ofNullable(table.getLong("cost_limit")),
                Optional.ofNullable(table.getLong("script_version")).map(TestConfigFile::toVersion),
                Optional.ofNullable(table.getString("lib_dir")),
                Optional.ofNullable(table.getString("src_dir")));
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid " + FILE_NAME + ": " + ex.getMessage(), ex);
        }
    }

    /** Copies the values present in this file onto {@code builder}. */
    public TestRunConfiguration.Builder applyTo(TestRunConfiguration.Builder builder) {
        trace.ifPresent(builder::trace);
        traceFormat.ifPresent(builder::traceFormat);
        traceAll.ifPresent(builder::traceAll);
        timeout.ifPresent(value -> builder.timeout(Optional.of(value)));
        costLimit.ifPresent(builder::costLimit);
        scriptVersion.ifPresent(builder::scriptVersion);
        libDir.ifPresent(builder::libDir);
        srcDir.ifPresent(builder::srcDir);
        return builder;
    }

    private static byte toVersion(long value) {
        if (value < 0 || value > Byte.MAX_VALUE) {
            throw new IllegalArgumentException("script_version out of range: " + value);
        }
        return (byte) value;
    }
}
