package jsonc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import jsonc.JsoncException.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Reads {@value #FILE_NAME} files and merges them over {@link FormatConfig#defaults()}.
 *
 * <p> The file is JSONC and mirrors the settings table:
 * <pre>{@code
 * {
 *     "version": "1.0",
 *     "indent": {"style": "space", "width": 4},
 *     "posix": {"insert_final_newline": true},
 *     "formatting": {"simple_array_threshold": 60, "control_flow_fields": ["next", "on_error"]},
 *     "file_handling": {"newline": "CRLF", "preserve_comments": true, "encoding": "utf-8", "output_suffix": ""}
 * }
 * }</pre>
 * Every key present replaces the default; lists replace the default list as a whole. Unknown keys are ignored.
 *
 * @since 0.1.0
 */
@Slf4j
public final class FormatConfigLoader {

    public static final String FILE_NAME = "jsoncfmt.json";

    private FormatConfigLoader() {
        throw new UnsupportedOperationException();
    }

    /**
     * Load a config file.
     *
     * @param file config file, read as UTF-8
     * @return defaults with the file's settings applied
     * @throws ConfigException      if the file does not parse or holds invalid settings
     * @throws UncheckedIOException if the file cannot be read
     */
    public static FormatConfig load(Path file) {
        Objects.requireNonNull(file, "file");
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config file " + file, e);
        }
        try {
            var config = parse(text);
            log.debug("Loaded config from {}", file);
            return config;
        } catch (ConfigException e) {
            throw new ConfigException(file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse config text and merge it over the defaults.
     *
     * @param text JSONC config text
     * @return merged config
     * @throws ConfigException if the text does not parse or holds invalid settings
     */
    public static FormatConfig parse(String text) {
        JsoncNode root;
        try {
            root = Jsonc.parse(text);
        } catch (JsoncException e) {
            throw new ConfigException("Invalid config file: " + e.getMessage(), e);
        }
        var builder = FormatConfig.defaults().toBuilder();
        for (var section : object(root, "").entries()) {
            var value = section.value();
            switch (section.key()) {
                case "version" -> string(value, "version");
                case "indent" -> mergeIndent(builder, object(value, "indent"));
                case "posix" -> mergePosix(builder, object(value, "posix"));
                case "formatting" -> mergeFormatting(builder, object(value, "formatting"));
                case "file_handling" -> mergeFileHandling(builder, object(value, "file_handling"));
                default -> log.debug("Ignoring unknown config key '{}'", section.key());
            }
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
    }

    /**
     * Find the config file that applies to a directory: the first {@value #FILE_NAME} found in it or one of its
     * ancestors.
     *
     * @param startDir directory to start from
     * @return the config file, or {@code null} if there is none up to the filesystem root
     */
    public static @Nullable Path discover(Path startDir) {
        for (var dir = startDir.toAbsolutePath().normalize(); dir != null; dir = dir.getParent()) {
            var candidate = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) return candidate;
        }
        return null;
    }

    /**
     * @return the discovered config for {@code startDir}, or the defaults if there is none
     */
    public static FormatConfig loadOrDefault(Path startDir) {
        var file = discover(startDir);
        if (file == null) {
            log.debug("No {} found from {}, using defaults", FILE_NAME, startDir);
            return FormatConfig.defaults();
        }
        return load(file);
    }

    // ============================================================
    // Sections
    // ============================================================

    private static void mergeIndent(FormatConfig.FormatConfigBuilder builder, JsoncObject section) {
        for (var e : section.entries()) {
            var path = "indent." + e.key();
            switch (e.key()) {
                case "style" -> builder.indentStyle(indentStyle(e.value(), path));
                case "width" -> builder.indentWidth(integer(e.value(), path, 1));
                default -> log.debug("Ignoring unknown config key '{}'", path);
            }
        }
    }

    private static void mergePosix(FormatConfig.FormatConfigBuilder builder, JsoncObject section) {
        for (var e : section.entries()) {
            var path = "posix." + e.key();
            if (e.key().equals("insert_final_newline")) builder.insertFinalNewline(bool(e.value(), path));
            else log.debug("Ignoring unknown config key '{}'", path);
        }
    }

    private static void mergeFormatting(FormatConfig.FormatConfigBuilder builder, JsoncObject section) {
        for (var e : section.entries()) {
            var path = "formatting." + e.key();
            switch (e.key()) {
                case "simple_array_threshold" -> builder.simpleArrayThreshold(integer(e.value(), path, 0));
                case "coordinate_fields" -> builder.coordinateFields(strings(e.value(), path));
                case "control_flow_fields" -> builder.controlFlowFields(strings(e.value(), path));
                case "always_multiline_fields" -> builder.alwaysMultilineFields(strings(e.value(), path));
                default -> log.debug("Ignoring unknown config key '{}'", path);
            }
        }
    }

    private static void mergeFileHandling(FormatConfig.FormatConfigBuilder builder, JsoncObject section) {
        for (var e : section.entries()) {
            var path = "file_handling." + e.key();
            switch (e.key()) {
                case "newline" -> builder.newline(newline(e.value(), path));
                case "preserve_comments" -> builder.preserveComments(bool(e.value(), path));
                case "encoding" -> builder.encoding(charset(e.value(), path));
                case "output_suffix" -> builder.outputSuffix(string(e.value(), path));
                default -> log.debug("Ignoring unknown config key '{}'", path);
            }
        }
    }

    // ============================================================
    // Value readers
    // ============================================================

    private static JsoncObject object(JsoncNode node, String path) {
        if (node instanceof JsoncObject o) return o;
        throw invalid(path.isEmpty() ? "root" : path, "an object", node);
    }

    private static String string(JsoncNode node, String path) {
        if (node instanceof JsoncString s) return s.value();
        throw invalid(path, "a string", node);
    }

    private static boolean bool(JsoncNode node, String path) {
        if (node instanceof JsoncBoolean b) return b.value();
        throw invalid(path, "a boolean", node);
    }

    private static int integer(JsoncNode node, String path, int min) {
        if (node instanceof JsoncNumber n && n.value() == Math.rint(n.value()) && n.value() >= min
                && n.value() <= Integer.MAX_VALUE) {
            return (int) n.value();
        }
        throw invalid(path, "an integer >= " + min, node);
    }

    private static Set<String> strings(JsoncNode node, String path) {
        if (!(node instanceof JsoncArray array)) throw invalid(path, "an array of strings", node);
        var values = new LinkedHashSet<String>();
        for (var child : array.children()) {
            if (child instanceof JsoncComment) continue;
            values.add(string(child, path + "[" + values.size() + "]"));
        }
        return values;
    }

    private static FormatConfig.IndentStyle indentStyle(JsoncNode node, String path) {
        return switch (string(node, path)) {
            case "space" -> FormatConfig.IndentStyle.SPACE;
            case "tab" -> FormatConfig.IndentStyle.TAB;
            default -> throw invalid(path, "\"space\" or \"tab\"", node);
        };
    }

    private static FormatConfig.Newline newline(JsoncNode node, String path) {
        return switch (string(node, path).toUpperCase(Locale.ROOT)) {
            case "LF" -> FormatConfig.Newline.LF;
            case "CRLF" -> FormatConfig.Newline.CRLF;
            default -> throw invalid(path, "\"LF\" or \"CRLF\"", node);
        };
    }

    private static Charset charset(JsoncNode node, String path) {
        try {
            return Charset.forName(string(node, path));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigException("Config key '" + path + "' names an unsupported charset: " + node.stringify(), e);
        }
    }

    private static ConfigException invalid(String path, String expected, JsoncNode actual) {
        return new ConfigException(
                "Config key '%s' must be %s, got %s".formatted(path, expected, Jsonc.stripComments(actual).stringify()));
    }
}
