package jsonc;

/**
 *
 *
 * @since 0.1.0
 */
public record JsoncBoolean(boolean value) implements JsoncScalar {

    @Override
    public String raw() {
        return stringify();
    }

    @Override
    public String stringify() {
        return value ? "true" : "false";
    }
}
