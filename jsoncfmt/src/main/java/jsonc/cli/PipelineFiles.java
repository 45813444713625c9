package jsonc.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a file looks like a pipeline document.
 *
 * <p> A pipeline document is a {@code .json} or {@code .jsonc} file whose base name contains one of the name
 * patterns, or whose content mentions one of the pipeline keys {@code "roi"}, {@code "recognition"},
 * {@code "action"} or {@code "target"}.
 *
 * @since 0.1.0
 */
public final class PipelineFiles {

    public static final List<String> DEFAULT_PATTERNS = List.of("pipeline", "interface", "task");

    private static final List<String> CONTENT_MARKERS = List.of("\"roi\"", "\"recognition\"", "\"action\"", "\"target\"");

    private PipelineFiles() {
        throw new UnsupportedOperationException();
    }

    public static boolean isJsonFile(Path file) {
        var name = fileName(file);
        return name.endsWith(".json") || name.endsWith(".jsonc");
    }

    /**
     * @param file     the file
     * @param content  the file's text
     * @param patterns case-insensitive substrings matched against the base name
     */
    public static boolean isPipelineFile(Path file, String content, List<String> patterns) {
        if (!isJsonFile(file)) return false;
        var name = fileName(file);
        var baseName = name.substring(0, name.lastIndexOf('.'));
        for (var pattern : patterns) {
            if (baseName.contains(pattern.toLowerCase(Locale.ROOT))) return true;
        }
        return CONTENT_MARKERS.stream().anyMatch(content::contains);
    }

    private static String fileName(Path file) {
        var name = file.getFileName();
        return name == null ? "" : name.toString().toLowerCase(Locale.ROOT);
    }
}
