package jsonc;

/**
 * Exception thrown when formatting a JSONC document fails.
 * This is the base exception for all jsoncfmt-related errors.
 *
 * <p> Every subtype is terminal for the current call: no partial output is ever produced.
 *
 * @since 0.1.0
 */
public class JsoncException extends RuntimeException {

    /**
     * Constructs a new JsoncException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsoncException(String message) {
        super(message);
    }

    /**
     * Constructs a new JsoncException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JsoncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Exception thrown when the tokenizer meets a character no lexical pattern accepts.
     */
    public static class LexException extends JsoncException {
        private final int line;
        private final char character;

        public LexException(int line, char character) {
            super(String.format("Unexpected character '%s' at line %d", printable(character), line));
            this.line = line;
            this.character = character;
        }

        public int getLine() {
            return line;
        }

        public char getCharacter() {
            return character;
        }

        private static String printable(char c) {
            if (c < 0x20 || c == 0x7f || Character.isSurrogate(c)) {
                return String.format("\\u%04x", (int) c);
            }
            return String.valueOf(c);
        }
    }

    /**
     * Exception thrown when the token stream does not form a valid document.
     */
    public static class ParseException extends JsoncException {
        private final String reason;
        private final int line;

        public ParseException(String reason, int line) {
            super(String.format("%s at line %d", reason, line));
            this.reason = reason;
            this.line = line;
        }

        /**
         * @return the message without the line suffix
         */
        public String getReason() {
            return reason;
        }

        public int getLine() {
            return line;
        }
    }

    /**
     * Exception thrown when a configuration file holds invalid settings, or does not parse at all.
     */
    public static class ConfigException extends JsoncException {
        public ConfigException(String message) {
            super(message);
        }

        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
