package jsonc;

/**
 *
 *
 * @since 0.1.0
 */
public record JsoncString(String value, String raw) implements JsoncScalar {

    public JsoncString(String value) {
        this(value, Jsonc.Writer.quote(value));
    }

    @Override
    public String stringify() {
        return Jsonc.Writer.quote(value);
    }
}
