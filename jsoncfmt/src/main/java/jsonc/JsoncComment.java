package jsonc;

/**
 * A line or block comment, kept verbatim with its delimiters.
 *
 * @since 0.1.0
 */
public record JsoncComment(String text) implements JsoncNode, JsoncObject.Member {

    public boolean isBlock() {
        return text.startsWith("/*");
    }

    @Override
    public String stringify() {
        return text;
    }
}
