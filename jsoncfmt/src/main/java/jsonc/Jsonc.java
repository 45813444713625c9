package jsonc;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import jsonc.JsoncException.LexException;
import jsonc.JsoncException.ParseException;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Comment-preserving JSONC formatter for pipeline documents.
 *
 * <p> A format call runs three pure phases: {@link #tokenize(String) tokenize}, {@link #parse(List) parse} and
 * {@link #render(JsoncNode, FormatConfig) render}. None of them touch shared state, so documents may be formatted
 * concurrently with the same {@link FormatConfig}.
 */
@Slf4j
public final class Jsonc {

    private Jsonc() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Format a JSONC document with the default settings.
     *
     * @param text JSONC text, not {@code null}
     * @return formatted text
     * @see #format(String, FormatConfig)
     */
    public static String format(String text) {
        return format(text, FormatConfig.defaults());
    }

    /**
     * Format a JSONC document.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * String out = Jsonc.format("{\"Start\":{\"roi\":[1,2,3,4],\"next\":[\"A\"]}}", FormatConfig.defaults());
     * // {
     * //     "Start": {
     * //         "roi": [1, 2, 3, 4],
     * //         "next": [
     * //             "A"
     * //         ]
     * //     }
     * // }
     * }</pre>
     *
     * @param text   JSONC text, not {@code null}
     * @param config layout settings, not {@code null}
     * @return formatted text
     * @throws LexException   if the text contains a character no token starts with
     * @throws ParseException if the tokens do not form a document
     */
    public static String format(String text, FormatConfig config) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(config, "config");
        var tokens = tokenize(text);
        var ast = parse(tokens);
        if (!config.preserveComments()) ast = stripComments(ast);
        var out = render(ast, config);
        log.debug("Formatted {} tokens into {} characters", tokens.size(), out.length());
        return out;
    }

    /**
     * Split text into tokens. Whitespace is dropped, comments are kept.
     *
     * @param text JSONC text, not {@code null}
     * @return tokens in source order
     * @throws LexException if no token pattern matches at some position
     */
    public static List<Token> tokenize(String text) {
        return new Lexer(Objects.requireNonNull(text, "text")).tokenize();
    }

    /**
     * Tokenize and parse text.
     *
     * @param text JSONC text, not {@code null}
     * @return the document root
     */
    public static JsoncNode parse(String text) {
        return parse(tokenize(text));
    }

    /**
     * Build the document tree from tokens.
     *
     * <p> Comments before the root value become the first children of the root container, comments after it the
     * last ones. A document with no value at all is an empty object holding only its comments.
     *
     * @param tokens tokens from {@link #tokenize(String)}
     * @return the document root
     * @throws ParseException if the tokens do not form a document
     */
    public static JsoncNode parse(List<Token> tokens) {
        return new Parser(Objects.requireNonNull(tokens, "tokens")).parseDocument();
    }

    /**
     * Lay out a document tree.
     *
     * @param root   document root
     * @param config layout settings
     * @return formatted text, with the configured final newline and line terminators applied
     */
    public static String render(JsoncNode root, FormatConfig config) {
        return new Writer(Objects.requireNonNull(config, "config")).render(Objects.requireNonNull(root, "root"));
    }

    /**
     * @return a copy of the tree without any comment node
     */
    public static JsoncNode stripComments(JsoncNode node) {
        if (node instanceof JsoncArray array) {
            var children = new ArrayList<JsoncNode>();
            for (var c : array.children()) {
                if (!(c instanceof JsoncComment)) children.add(stripComments(c));
            }
            return new JsoncArray(children);
        }
        if (node instanceof JsoncObject object) {
            var members = new ArrayList<JsoncObject.Member>();
            for (var e : object.entries()) {
                members.add(new JsoncObject.Entry(e.key(), stripComments(e.value())));
            }
            return new JsoncObject(members);
        }
        return node;
    }

    // ============================================================
    // Tokens
    // ============================================================

    /**
     * A lexical token.
     *
     * @param kind token kind
     * @param text exact source slice, quotes and comment delimiters included
     * @param line 1-based line the token starts on
     */
    public record Token(Kind kind, String text, int line) {

        public enum Kind {
            BRACE_OPEN,
            BRACE_CLOSE,
            BRACKET_OPEN,
            BRACKET_CLOSE,
            COLON,
            COMMA,
            STRING,
            NUMBER,
            BOOLEAN,
            NULL,
            COMMENT
        }
    }

    // ============================================================
    // Lexer
    // ============================================================

    /**
     * First-match lexer. At each position the patterns are tried in a fixed order: comment, string, number,
     * boolean, null, punctuation, whitespace. Every pattern is anchored at the cursor.
     */
    static final class Lexer {
        private final String s;
        private int i = 0, line = 1;

        Lexer(String s) {
            this.s = s;
        }

        List<Token> tokenize() {
            var tokens = new ArrayList<Token>();
            while (!eof()) {
                int end;
                Token.Kind kind;
                if ((end = matchComment()) >= 0) kind = Token.Kind.COMMENT;
                else if ((end = matchString()) >= 0) kind = Token.Kind.STRING;
                else if ((end = matchNumber()) >= 0) kind = Token.Kind.NUMBER;
                else if ((end = matchWord("true")) >= 0 || (end = matchWord("false")) >= 0) kind = Token.Kind.BOOLEAN;
                else if ((end = matchWord("null")) >= 0) kind = Token.Kind.NULL;
                else if ((kind = punctuation(peek())) != null) end = i + 1;
                else if ((end = matchWhitespace()) >= 0) kind = null;
                else throw new LexException(line, peek());

                var text = s.substring(i, end);
                if (kind != null) tokens.add(new Token(kind, text, line));
                line += countNewlines(text);
                i = end;
            }
            return tokens;
        }

        private int matchComment() {
            if (peek() != '/' || i + 1 >= s.length()) return -1;
            char next = s.charAt(i + 1);
            if (next == '/') {
                int j = i + 2;
                while (j < s.length() && !isLineTerminator(s.charAt(j))) j++;
                return j;
            }
            if (next == '*') {
                int close = s.indexOf("*/", i + 2);
                return close < 0 ? -1 : close + 2;
            }
            return -1;
        }

        // Escapes are not validated here; the parser decodes them.
        private int matchString() {
            if (peek() != '"') return -1;
            int j = i + 1;
            while (j < s.length()) {
                char c = s.charAt(j);
                if (c == '"') return j + 1;
                if (c == '\\' && j + 1 < s.length() && !isLineTerminator(s.charAt(j + 1))) j += 2;
                else j++;
            }
            return -1;
        }

        // -?(0|[1-9][0-9]*)(\.[0-9]+)?([eE][+-]?[0-9]+)?
        private int matchNumber() {
            int j = i;
            if (charAt(j) == '-') j++;
            if (charAt(j) == '0') j++;
            else if (charAt(j) >= '1' && charAt(j) <= '9') j = skipDigits(j);
            else return -1;
            if (charAt(j) == '.' && isDigit(charAt(j + 1))) j = skipDigits(j + 1);
            if (charAt(j) == 'e' || charAt(j) == 'E') {
                int k = j + 1;
                if (charAt(k) == '+' || charAt(k) == '-') k++;
                if (isDigit(charAt(k))) j = skipDigits(k);
            }
            return j;
        }

        private int matchWord(String word) {
            return s.startsWith(word, i) ? i + word.length() : -1;
        }

        private int matchWhitespace() {
            int j = i;
            while (j < s.length() && isWhitespace(s.charAt(j))) j++;
            return j > i ? j : -1;
        }

        private static Token.@Nullable Kind punctuation(char c) {
            return switch (c) {
                case '{' -> Token.Kind.BRACE_OPEN;
                case '}' -> Token.Kind.BRACE_CLOSE;
                case '[' -> Token.Kind.BRACKET_OPEN;
                case ']' -> Token.Kind.BRACKET_CLOSE;
                case ':' -> Token.Kind.COLON;
                case ',' -> Token.Kind.COMMA;
                default -> null;
            };
        }

        private int skipDigits(int j) {
            while (isDigit(charAt(j))) j++;
            return j;
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private char charAt(int j) {
            return j < s.length() ? s.charAt(j) : '\0';
        }

        private static int countNewlines(String text) {
            int n = 0;
            for (int k = 0; k < text.length(); k++) {
                if (text.charAt(k) == '\n') n++;
            }
            return n;
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        static boolean isLineTerminator(char c) {
            return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
        }

        // ECMAScript WhiteSpace and LineTerminator
        static boolean isWhitespace(char c) {
            return switch (c) {
                case ' ', '\t', '\n', '\r', '\u000b', '\f', '\u00a0', '\u1680', '\u2028', '\u2029', '\u202f',
                        '\u205f', '\u3000', '\ufeff' -> true;
                default -> c >= '\u2000' && c <= '\u200a';
            };
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * Recursive descent over the token list. Each rule picks its production from the next token alone.
     *
     * <p> Commas are skipped wherever they appear; doubled, missing and trailing commas are all accepted, since
     * comments may sit between a value and the comma that follows it.
     */
    static final class Parser {
        private final List<Token> tokens;
        private int pos = 0;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        JsoncNode parseDocument() {
            var leading = takeComments();
            if (eof()) return new JsoncObject(new ArrayList<>(leading));

            var root = parseValue();
            var trailing = takeComments();
            if (!eof()) {
                var t = peek();
                throw new ParseException("Unexpected token after root value: " + t.text(), t.line());
            }
            if (leading.isEmpty() && trailing.isEmpty()) return root;

            if (root instanceof JsoncObject object) {
                var members = new ArrayList<JsoncObject.Member>(leading);
                members.addAll(object.members());
                members.addAll(trailing);
                return new JsoncObject(members);
            }
            if (root instanceof JsoncArray array) {
                var children = new ArrayList<JsoncNode>(leading);
                children.addAll(array.children());
                children.addAll(trailing);
                return new JsoncArray(children);
            }
            var at = leading.isEmpty() ? lastLine() : tokens.get(0).line();
            throw new ParseException("Comments around a scalar root value cannot be preserved", at);
        }

        JsoncNode parseValue() {
            if (eof()) throw new ParseException("Unexpected end of input while expecting a value", lastLine());
            var t = peek();
            return switch (t.kind()) {
                case BRACE_OPEN -> parseObject();
                case BRACKET_OPEN -> parseArray();
                case STRING -> {
                    pos++;
                    yield new JsoncString(decodeString(t), t.text());
                }
                case NUMBER -> {
                    pos++;
                    yield new JsoncNumber(Double.parseDouble(t.text()), t.text());
                }
                case BOOLEAN -> {
                    pos++;
                    yield new JsoncBoolean(t.text().equals("true"));
                }
                case NULL -> {
                    pos++;
                    yield new JsoncNull();
                }
                case BRACE_CLOSE, BRACKET_CLOSE, COLON, COMMA, COMMENT -> throw new ParseException(
                        "Expected a value but found " + t.text(), t.line());
            };
        }

        JsoncObject parseObject() {
            var open = expect(Token.Kind.BRACE_OPEN, "'{'");
            var members = new ArrayList<JsoncObject.Member>();
            while (true) {
                if (eof()) throw new ParseException("Unclosed object", open.line());
                var t = peek();
                switch (t.kind()) {
                    case BRACE_CLOSE -> {
                        pos++;
                        return new JsoncObject(members);
                    }
                    case COMMENT -> {
                        pos++;
                        members.add(new JsoncComment(t.text()));
                    }
                    case COMMA -> pos++;
                    case STRING -> {
                        pos++;
                        var key = decodeString(t);
                        members.addAll(takeComments());
                        expect(Token.Kind.COLON, "':' after key " + t.text());
                        members.addAll(takeComments());
                        members.add(new JsoncObject.Entry(key, parseValue()));
                    }
                    default -> throw new ParseException(
                            "Expected a string key or comment in object but found " + t.text(), t.line());
                }
            }
        }

        JsoncArray parseArray() {
            var open = expect(Token.Kind.BRACKET_OPEN, "'['");
            var children = new ArrayList<JsoncNode>();
            while (true) {
                if (eof()) throw new ParseException("Unclosed array", open.line());
                var t = peek();
                switch (t.kind()) {
                    case BRACKET_CLOSE -> {
                        pos++;
                        return new JsoncArray(children);
                    }
                    case COMMENT -> {
                        pos++;
                        children.add(new JsoncComment(t.text()));
                    }
                    case COMMA -> pos++;
                    default -> children.add(parseValue());
                }
            }
        }

        private List<JsoncComment> takeComments() {
            var comments = new ArrayList<JsoncComment>();
            while (!eof() && peek().kind() == Token.Kind.COMMENT) {
                comments.add(new JsoncComment(tokens.get(pos++).text()));
            }
            return comments;
        }

        private Token expect(Token.Kind kind, String what) {
            if (eof()) throw new ParseException("Expected " + what + " but reached end of input", lastLine());
            var t = peek();
            if (t.kind() != kind) throw new ParseException("Expected " + what + " but found " + t.text(), t.line());
            pos++;
            return t;
        }

        private boolean eof() {
            return pos >= tokens.size();
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private int lastLine() {
            return tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
        }

        /**
         * Decode a string token with standard JSON escapes.
         */
        static String decodeString(Token t) {
            var raw = t.text();
            var sb = new StringBuilder(raw.length());
            int end = raw.length() - 1;
            for (int k = 1; k < end; k++) {
                char c = raw.charAt(k);
                if (c == '\\') {
                    char e = raw.charAt(++k);
                    switch (e) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> {
                            if (k + 4 >= end) throw new ParseException("Incomplete \\u escape in string", t.line());
                            int cp = 0;
                            for (int h = 1; h <= 4; h++) {
                                int v = Character.digit(raw.charAt(k + h), 16);
                                if (v < 0) throw new ParseException("Invalid \\u escape in string", t.line());
                                cp = (cp << 4) | v;
                            }
                            sb.append((char) cp);
                            k += 4;
                        }
                        default -> throw new ParseException("Invalid escape sequence \\" + e + " in string", t.line());
                    }
                } else if (c < 0x20) {
                    throw new ParseException(
                            "Unescaped control character in string (ASCII " + (int) c + ")", t.line());
                } else {
                    sb.append(c);
                }
            }
            return sb.toString();
        }
    }

    // ============================================================
    // Writer (layout engine)
    // ============================================================

    /**
     * Lays out a tree. Each container is either rendered inline, as {@link JsoncNode#stringify()}, or expanded with
     * one child per line; the choice depends on the key the container sits under, its children and its inline length.
     */
    static final class Writer {
        private final FormatConfig config;
        private final String indentUnit;

        Writer(FormatConfig config) {
            this.config = config;
            this.indentUnit = config.indentUnit();
        }

        String render(JsoncNode root) {
            var out = write(root, 0, "");
            int end = out.length();
            while (end > 0 && (out.charAt(end - 1) == '\n' || out.charAt(end - 1) == '\r')) end--;
            out = out.substring(0, end);
            if (config.insertFinalNewline()) out += "\n";
            out = out.replace("\r\n", "\n");
            return config.newline() == FormatConfig.Newline.LF ? out : out.replace("\n", config.newline().sequence());
        }

        String write(JsoncNode node, int level, String key) {
            if (node instanceof JsoncScalar || node instanceof JsoncComment) return node.stringify();
            if (node instanceof JsoncArray array) {
                return shouldInlineArray(key, array) ? array.stringify() : writeArray(array, level);
            }
            if (node instanceof JsoncObject object) {
                return shouldInlineObject(key, object) ? object.stringify() : writeObject(object, level);
            }
            throw new IllegalStateException("Unknown node type: " + node.getClass().getName());
        }

        boolean shouldInlineArray(String key, JsoncArray array) {
            var children = array.children();
            if (children.isEmpty()) return true;
            if (children.stream().anyMatch(c -> c instanceof JsoncComment || c.isContainer())) return false;
            if (isCoordinateArray(key, array)) return true;
            if (config.controlFlowFields().contains(key)) return false;
            return array.stringify().length() <= config.simpleArrayThreshold();
        }

        boolean shouldInlineObject(String key, JsoncObject object) {
            if (object.members().isEmpty()) return true;
            if (config.alwaysMultilineFields().contains(key)) return false;
            if (object.hasComments()) return false;
            if (object.entries().stream().anyMatch(e -> e.value().isContainer())) return false;
            return object.stringify().length() <= config.simpleArrayThreshold();
        }

        private boolean isCoordinateArray(String key, JsoncArray array) {
            return config.coordinateFields().contains(key)
                    && array.children().stream().allMatch(JsoncNumber.class::isInstance);
        }

        private String writeArray(JsoncArray array, int level) {
            var children = array.children();
            int last = lastValueIndex(children);
            var indent = indentUnit.repeat(level + 1);
            var sb = new StringBuilder("[");
            for (int k = 0; k < children.size(); k++) {
                var child = children.get(k);
                sb.append('\n').append(indent).append(write(child, level + 1, ""));
                if (!(child instanceof JsoncComment) && k != last) sb.append(',');
            }
            return sb.append('\n').append(indentUnit.repeat(level)).append(']').toString();
        }

        private String writeObject(JsoncObject object, int level) {
            var members = object.members();
            int last = lastValueIndex(members);
            var indent = indentUnit.repeat(level + 1);
            var sb = new StringBuilder("{");
            for (int k = 0; k < members.size(); k++) {
                sb.append('\n').append(indent);
                if (members.get(k) instanceof JsoncObject.Entry e) {
                    sb.append(quote(e.key())).append(": ").append(write(e.value(), level + 1, e.key()));
                    if (k != last) sb.append(',');
                } else {
                    sb.append(((JsoncComment) members.get(k)).text());
                }
            }
            return sb.append('\n').append(indentUnit.repeat(level)).append('}').toString();
        }

        private static int lastValueIndex(List<?> children) {
            for (int k = children.size() - 1; k >= 0; k--) {
                if (!(children.get(k) instanceof JsoncComment)) return k;
            }
            return -1;
        }

        static String quote(String s) {
            var sb = new StringBuilder(s.length() + 2).append('"');
            escapeTo(sb, s);
            return sb.append('"').toString();
        }

        static void escapeTo(StringBuilder out, String s) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    default -> {
                        if (c < 0x20 || isLoneSurrogate(s, i)) {
                            out.append(String.format("\\u%04x", (int) c));
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
        }

        private static boolean isLoneSurrogate(String s, int i) {
            char c = s.charAt(i);
            if (Character.isHighSurrogate(c)) {
                return i + 1 >= s.length() || !Character.isLowSurrogate(s.charAt(i + 1));
            }
            if (Character.isLowSurrogate(c)) {
                return i == 0 || !Character.isHighSurrogate(s.charAt(i - 1));
            }
            return false;
        }

        /**
         * Shortest round-trip text for a double, laid out the way ECMAScript prints numbers: plain notation for
         * decimal exponents in [-6, 21), otherwise {@code d.ddde+n}. Non-finite values print as {@code null}.
         */
        static String formatNumber(double d) {
            if (!Double.isFinite(d)) return "null";
            if (d == 0) return "0";
            var bd = shortestDecimal(Math.abs(d));
            var digits = bd.unscaledValue().toString();
            int k = digits.length();
            int n = k - bd.scale();
            var sb = new StringBuilder(d < 0 ? "-" : "");
            if (k <= n && n <= 21) {
                sb.append(digits).append("0".repeat(n - k));
            } else if (0 < n && n <= 21) {
                sb.append(digits, 0, n).append('.').append(digits, n, k);
            } else if (-6 < n && n <= 0) {
                sb.append("0.").append("0".repeat(-n)).append(digits);
            } else {
                int e = n - 1;
                sb.append(digits.charAt(0));
                if (k > 1) sb.append('.').append(digits, 1, k);
                sb.append('e').append(e < 0 ? '-' : '+').append(Math.abs(e));
            }
            return sb.toString();
        }

        private static final RoundingMode[] NEAREST_FIRST = {
            RoundingMode.HALF_EVEN, RoundingMode.FLOOR, RoundingMode.CEILING
        };

        /**
         * Fewest significant digits that read back as {@code d}; among candidates of that length the nearest wins.
         */
        static BigDecimal shortestDecimal(double d) {
            var exact = new BigDecimal(d);
            for (int p = 1; p < 17; p++) {
                for (var mode : NEAREST_FIRST) {
                    var candidate = exact.round(new MathContext(p, mode));
                    if (Double.parseDouble(candidate.toString()) == d) return candidate.stripTrailingZeros();
                }
            }
            // 17 digits always round-trip
            return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
        }
    }
}
