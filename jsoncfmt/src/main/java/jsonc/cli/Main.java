package jsonc.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import jsonc.FormatConfig;
import jsonc.FormatConfigLoader;
import jsonc.Jsonc;
import jsonc.JsoncException;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Command line front end.
 *
 * <pre>
 * jsoncfmt [--check] [--config FILE] [--pattern NAME]... [PATH]...
 * </pre>
 *
 * Without paths the document is read from stdin and written to stdout. Directories are searched recursively for
 * pipeline documents; files named explicitly are always formatted. A file is only rewritten when its formatted text
 * differs from what is on disk.
 *
 * <p> Exit codes: 0 success, 1 a document failed to format (or would change, with {@code --check}), 2 usage error.
 */
@Slf4j
public final class Main {

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    static final String USAGE_TEXT = """
            Usage: jsoncfmt [options] [path...]

            Formats JSONC pipeline documents. Reads stdin and writes stdout when no path is given.

            Options:
              --check          report files that would change, do not write them
              --config FILE    use FILE instead of the nearest %s
              --pattern NAME   file name pattern marking pipeline documents (repeatable,
                               default: %s)
              -h, --help       print this help
            """.formatted(FormatConfigLoader.FILE_NAME, String.join(", ", PipelineFiles.DEFAULT_PATTERNS));

    private final Options options;
    private final PrintStream err;
    private final Map<Path, FormatConfig> configs = new HashMap<>();

    private Main(Options options, PrintStream err) {
        this.options = options;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE_TEXT);
            return USAGE;
        }
        if (options.help()) {
            out.print(USAGE_TEXT);
            return OK;
        }
        var main = new Main(options, err);
        return options.paths().isEmpty() ? main.formatStdin(in, out) : main.formatPaths();
    }

    // ============================================================
    // stdin
    // ============================================================

    private int formatStdin(InputStream in, PrintStream out) {
        FormatConfig config;
        String text;
        try {
            config = configFor(Path.of("").toAbsolutePath());
        } catch (JsoncException.ConfigException | UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return FAILED;
        }
        try {
            text = decode(in.readAllBytes(), config.encoding());
        } catch (CharacterCodingException e) {
            err.println("error: <stdin>: input is not valid " + config.encoding().name());
            return FAILED;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stdin", e);
        }
        if (text.isBlank()) {
            err.println("error: No input provided");
            return FAILED;
        }
        String formatted;
        try {
            formatted = Jsonc.format(text, config);
        } catch (JsoncException e) {
            err.println("error: <stdin>: " + e.getMessage());
            return FAILED;
        }
        if (options.check()) {
            return formatted.equals(text) ? OK : FAILED;
        }
        ByteBuffer bytes;
        try {
            bytes = encoder(config.encoding()).encode(CharBuffer.wrap(formatted));
        } catch (CharacterCodingException e) {
            err.println("error: <stdin>: output cannot be encoded as " + config.encoding().name());
            return FAILED;
        }
        out.write(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
        out.flush();
        return OK;
    }

    private static String decode(byte[] bytes, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static CharsetEncoder encoder(Charset charset) {
        return charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    // ============================================================
    // Files
    // ============================================================

    enum Outcome {
        UNCHANGED,
        CHANGED,
        SKIPPED,
        FAILED
    }

    record Target(Path file, boolean explicit) {}

    private int formatPaths() {
        boolean failed = false, changed = false;
        for (var target : collectTargets()) {
            if (target == null) {
                failed = true;
                continue;
            }
            switch (formatFile(target)) {
                case CHANGED -> changed = true;
                case FAILED -> failed = true;
                case UNCHANGED, SKIPPED -> {}
            }
        }
        if (failed) return FAILED;
        return options.check() && changed ? FAILED : OK;
    }

    // A null entry stands for a path that does not exist.
    private List<@Nullable Target> collectTargets() {
        var targets = new ArrayList<@Nullable Target>();
        for (var path : options.paths()) {
            if (Files.isDirectory(path)) {
                try (var files = Files.walk(path)) {
                    files.filter(Files::isRegularFile)
                            .filter(PipelineFiles::isJsonFile)
                            .filter(f -> !f.getFileName().toString().equals(FormatConfigLoader.FILE_NAME))
                            .sorted()
                            .forEach(f -> targets.add(new Target(f, false)));
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to list " + path, e);
                }
            } else if (Files.isRegularFile(path)) {
                targets.add(new Target(path, true));
            } else {
                err.println("error: " + path + ": no such file or directory");
                targets.add(null);
            }
        }
        return targets;
    }

    Outcome formatFile(Target target) {
        var file = target.file();
        FormatConfig config;
        String original;
        try {
            config = configFor(file.toAbsolutePath().getParent());
            original = Files.readString(file, config.encoding());
        } catch (JsoncException.ConfigException | UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return Outcome.FAILED;
        } catch (IOException e) {
            err.println("error: " + file + ": cannot read file: " + e.getMessage());
            return Outcome.FAILED;
        }

        if (!target.explicit()) {
            if (!config.outputSuffix().isEmpty() && baseName(file).endsWith(config.outputSuffix())) {
                log.debug("Skipping {}: formatter output", file);
                return Outcome.SKIPPED;
            }
            if (!PipelineFiles.isPipelineFile(file, original, options.patterns())) {
                log.debug("Skipping {}: not a pipeline document", file);
                return Outcome.SKIPPED;
            }
        }
        if (original.isBlank()) {
            log.debug("Skipping {}: empty", file);
            return Outcome.SKIPPED;
        }

        String formatted;
        try {
            formatted = Jsonc.format(original, config);
        } catch (JsoncException e) {
            err.println("error: " + file + ": " + e.getMessage());
            return Outcome.FAILED;
        }

        var output = outputPath(file, config.outputSuffix());
        try {
            var current = output.equals(file) ? original : readIfExists(output, config.encoding());
            if (formatted.equals(current)) return Outcome.UNCHANGED;
            if (options.check()) {
                err.println("would reformat " + file);
                return Outcome.CHANGED;
            }
            Files.writeString(output, formatted, config.encoding());
        } catch (IOException e) {
            err.println("error: " + output + ": cannot write file: " + e.getMessage());
            return Outcome.FAILED;
        }
        log.info("Formatted {}", output);
        return Outcome.CHANGED;
    }

    private FormatConfig configFor(Path dir) {
        var explicit = options.config();
        if (explicit != null) return configs.computeIfAbsent(explicit, FormatConfigLoader::load);
        return configs.computeIfAbsent(dir, FormatConfigLoader::loadOrDefault);
    }

    static Path outputPath(Path file, String suffix) {
        if (suffix.isEmpty()) return file;
        var name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        var renamed = dot < 0 ? name + suffix : name.substring(0, dot) + suffix + name.substring(dot);
        return file.resolveSibling(renamed);
    }

    private static String baseName(Path file) {
        var name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    private static @Nullable String readIfExists(Path file, Charset charset) throws IOException {
        return Files.exists(file) ? Files.readString(file, charset) : null;
    }

    // ============================================================
    // Options
    // ============================================================

    record Options(@Nullable Path config, boolean check, List<String> patterns, List<Path> paths, boolean help) {

        static Options parse(String[] args) {
            Path config = null;
            boolean check = false, help = false;
            var patterns = new ArrayList<String>();
            var paths = new ArrayList<Path>();
            for (int i = 0; i < args.length; i++) {
                var arg = args[i];
                switch (arg) {
                    case "-h", "--help" -> help = true;
                    case "--check" -> check = true;
                    case "--config" -> config = Path.of(value(args, ++i, arg));
                    case "--pattern" -> patterns.add(value(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + arg);
                        paths.add(Path.of(arg));
                    }
                }
            }
            return new Options(
                    config,
                    check,
                    patterns.isEmpty() ? PipelineFiles.DEFAULT_PATTERNS : List.copyOf(patterns),
                    List.copyOf(paths),
                    help);
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
            return args[i];
        }
    }
}
