package jsonc;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;

/**
 * Layout and file-handling settings for one format call.
 *
 * <p> Instances are immutable. Start from {@link #defaults()} and override what you need:
 * <pre>{@code
 * FormatConfig config = FormatConfig.defaults().toBuilder()
 *         .indentStyle(FormatConfig.IndentStyle.SPACE)
 *         .indentWidth(4)
 *         .build();
 * }</pre>
 *
 * @param indentStyle           indent character ({@code indent.style})
 * @param indentWidth           indent characters per level, at least 1 ({@code indent.width})
 * @param insertFinalNewline    end the output with exactly one line terminator ({@code posix.insert_final_newline})
 * @param simpleArrayThreshold  longest inline rendering, in characters, a container may have and still stay on one
 *                              line ({@code formatting.simple_array_threshold})
 * @param coordinateFields      keys whose purely numeric arrays always stay inline
 *                              ({@code formatting.coordinate_fields})
 * @param controlFlowFields     keys whose arrays never inline unless they are numeric coordinates
 *                              ({@code formatting.control_flow_fields})
 * @param alwaysMultilineFields keys whose objects never inline ({@code formatting.always_multiline_fields})
 * @param newline               output line terminator ({@code file_handling.newline})
 * @param preserveComments      keep comments in the output ({@code file_handling.preserve_comments})
 * @param encoding              charset used when reading and writing files ({@code file_handling.encoding})
 * @param outputSuffix          when non-empty, files are written next to the source as {@code name<suffix>.ext}
 *                              ({@code file_handling.output_suffix})
 * @since 0.1.0
 */
@Builder(toBuilder = true)
public record FormatConfig(
        IndentStyle indentStyle,
        int indentWidth,
        boolean insertFinalNewline,
        int simpleArrayThreshold,
        Set<String> coordinateFields,
        Set<String> controlFlowFields,
        Set<String> alwaysMultilineFields,
        Newline newline,
        boolean preserveComments,
        Charset encoding,
        String outputSuffix) {

    private static final FormatConfig DEFAULTS = new FormatConfig(
            IndentStyle.TAB,
            1,
            false,
            50,
            orderedSet(List.of(
                    "roi",
                    "roi_offset",
                    "target",
                    "target_offset",
                    "begin",
                    "begin_offset",
                    "end",
                    "end_offset",
                    "lower",
                    "upper")),
            orderedSet(List.of("next", "interrupt", "on_error", "template")),
            orderedSet(List.of("custom_action_param", "custom_param", "parameters", "params", "options", "config")),
            Newline.LF,
            true,
            StandardCharsets.UTF_8,
            "");

    public FormatConfig {
        Objects.requireNonNull(indentStyle, "indentStyle");
        Objects.requireNonNull(newline, "newline");
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(outputSuffix, "outputSuffix");
        if (indentWidth < 1) throw new IllegalArgumentException("indentWidth must be >= 1, got " + indentWidth);
        if (simpleArrayThreshold < 0)
            throw new IllegalArgumentException("simpleArrayThreshold must be >= 0, got " + simpleArrayThreshold);
        coordinateFields = orderedSet(Objects.requireNonNull(coordinateFields, "coordinateFields"));
        controlFlowFields = orderedSet(Objects.requireNonNull(controlFlowFields, "controlFlowFields"));
        alwaysMultilineFields = orderedSet(Objects.requireNonNull(alwaysMultilineFields, "alwaysMultilineFields"));
    }

    public static FormatConfig defaults() {
        return DEFAULTS;
    }

    /**
     * @return the text of one indent level, e.g. {@code "\t"} or {@code "    "}
     */
    public String indentUnit() {
        return String.valueOf(indentStyle.character()).repeat(indentWidth);
    }

    public enum IndentStyle {
        SPACE(' '),
        TAB('\t');

        private final char character;

        IndentStyle(char character) {
            this.character = character;
        }

        public char character() {
            return character;
        }
    }

    public enum Newline {
        LF("\n"),
        CRLF("\r\n");

        private final String sequence;

        Newline(String sequence) {
            this.sequence = sequence;
        }

        public String sequence() {
            return sequence;
        }
    }

    private static Set<String> orderedSet(Iterable<String> values) {
        var set = new LinkedHashSet<String>();
        for (var v : values) set.add(Objects.requireNonNull(v, "field name"));
        return Collections.unmodifiableSet(set);
    }
}
