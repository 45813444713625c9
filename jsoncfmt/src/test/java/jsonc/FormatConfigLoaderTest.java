package jsonc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.IntStream;
import jsonc.JsoncException.ConfigException;
import jsonc.JsoncException.ParseException;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormatConfigLoaderTest {

    @Nested
    class ParseTests {

        @Test
        void mergesOverDefaults() {
            var config = FormatConfigLoader.parse(
                    """
                    // project settings
                    {
                        "version": "1.0",
                        "indent": {"style": "space", "width": 4},
                        "formatting": {
                            "control_flow_fields": ["next", /* also */ "on_error"],
                        },
                        "file_handling": {"newline": "crlf", "output_suffix": ".fmt"}
                    }
                    """);

            assertThat(config)
                    .isEqualTo(FormatConfig.defaults().toBuilder()
                            .indentStyle(FormatConfig.IndentStyle.SPACE)
                            .indentWidth(4)
                            .controlFlowFields(Set.of("next", "on_error"))
                            .newline(FormatConfig.Newline.CRLF)
                            .outputSuffix(".fmt")
                            .build());
            assertThat(config.controlFlowFields()).containsExactly("next", "on_error");
        }

        @Test
        void everyKey() {
            var config = FormatConfigLoader.parse(
                    """
                    {
                        "indent": {"style": "tab", "width": 2},
                        "posix": {"insert_final_newline": true},
                        "formatting": {
                            "simple_array_threshold": 0,
                            "coordinate_fields": ["box"],
                            "control_flow_fields": [],
                            "always_multiline_fields": ["opts"]
                        },
                        "file_handling": {
                            "newline": "LF",
                            "preserve_comments": false,
                            "encoding": "UTF-16LE",
                            "output_suffix": ""
                        }
                    }
                    """);

            assertThat(config.indentUnit()).isEqualTo("\t\t");
            assertThat(config.insertFinalNewline()).isTrue();
            assertThat(config.simpleArrayThreshold()).isZero();
            assertThat(config.coordinateFields()).containsExactly("box");
            assertThat(config.controlFlowFields()).isEmpty();
            assertThat(config.alwaysMultilineFields()).containsExactly("opts");
            assertThat(config.newline()).isEqualTo(FormatConfig.Newline.LF);
            assertThat(config.preserveComments()).isFalse();
            assertThat(config.encoding()).isEqualTo(StandardCharsets.UTF_16LE);
        }

        @Test
        void emptyAndUnknown() {
            assertThat(FormatConfigLoader.parse("")).isEqualTo(FormatConfig.defaults());
            assertThat(FormatConfigLoader.parse("{\"extra\": 1, \"indent\": {\"tabs\": true}}"))
                    .isEqualTo(FormatConfig.defaults());
        }

        @Test
        void invalidValues() {
            // @spotless:off
            var table = new Object[][] {
                    {"[]", "Config key 'root' must be an object, got []"},
                    {"{\"indent\": 1}", "Config key 'indent' must be an object, got 1"},
                    {"{\"indent\": {\"style\": \"tabs\"}}", "Config key 'indent.style' must be \"space\" or \"tab\", got \"tabs\""},
                    {"{\"indent\": {\"width\": 0}}", "Config key 'indent.width' must be an integer >= 1, got 0"},
                    {"{\"indent\": {\"width\": 1.5}}", "Config key 'indent.width' must be an integer >= 1, got 1.5"},
                    {"{\"formatting\": {\"simple_array_threshold\": -1}}", "Config key 'formatting.simple_array_threshold' must be an integer >= 0, got -1"},
                    {"{\"formatting\": {\"coordinate_fields\": [\"roi\", 1]}}", "Config key 'formatting.coordinate_fields[1]' must be a string, got 1"},
                    {"{\"formatting\": {\"next\": 1, \"coordinate_fields\": \"roi\"}}", "Config key 'formatting.coordinate_fields' must be an array of strings, got \"roi\""},
                    {"{\"posix\": {\"insert_final_newline\": \"yes\"}}", "Config key 'posix.insert_final_newline' must be a boolean, got \"yes\""},
                    {"{\"file_handling\": {\"newline\": \"CR\"}}", "Config key 'file_handling.newline' must be \"LF\" or \"CRLF\", got \"CR\""},
                    {"{\"file_handling\": {\"encoding\": \"no-such-charset\"}}", "Config key 'file_handling.encoding' names an unsupported charset: \"no-such-charset\""},
                    {"{\"version\": {/* c */}}", "Config key 'version' must be a string, got {}"},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var input = (String) row[0];
                assertThatCode(() -> FormatConfigLoader.parse(input))
                        .as("Case %d: input=%s", i, input)
                        .isInstanceOf(ConfigException.class)
                        .hasMessage((String) row[1]);
            }));
        }

        @Test
        void unparsableText() {
            assertThatCode(() -> FormatConfigLoader.parse("{\"indent\": "))
                    .isInstanceOf(ConfigException.class)
                    .hasMessage("Invalid config file: Unexpected end of input while expecting a value at line 1")
                    .hasCauseInstanceOf(ParseException.class);
        }
    }

    @Nested
    class FileTests {

        @Test
        @SneakyThrows
        void discoverWalksUp(@TempDir Path dir) {
            var file = Files.writeString(dir.resolve(FormatConfigLoader.FILE_NAME), "{\"indent\": {\"width\": 3}}");
            var nested = Files.createDirectories(dir.resolve("a/b"));

            assertThat(FormatConfigLoader.discover(nested)).isEqualTo(file.toAbsolutePath().normalize());
            assertThat(FormatConfigLoader.loadOrDefault(nested).indentWidth()).isEqualTo(3);
        }

        @Test
        @SneakyThrows
        void nearestFileWins(@TempDir Path dir) {
            Files.writeString(dir.resolve(FormatConfigLoader.FILE_NAME), "{\"indent\": {\"width\": 3}}");
            var nested = Files.createDirectories(dir.resolve("a"));
            Files.writeString(nested.resolve(FormatConfigLoader.FILE_NAME), "{\"indent\": {\"width\": 5}}");

            assertThat(FormatConfigLoader.loadOrDefault(nested).indentWidth()).isEqualTo(5);
            assertThat(FormatConfigLoader.loadOrDefault(dir).indentWidth()).isEqualTo(3);
        }

        @Test
        @SneakyThrows
        void loadPrefixesFileName(@TempDir Path dir) {
            var file = Files.writeString(dir.resolve(FormatConfigLoader.FILE_NAME), "{\"indent\": {\"width\": 0}}");

            assertThatCode(() -> FormatConfigLoader.load(file))
                    .isInstanceOf(ConfigException.class)
                    .hasMessage(file + ": Config key 'indent.width' must be an integer >= 1, got 0");
        }
    }
}
