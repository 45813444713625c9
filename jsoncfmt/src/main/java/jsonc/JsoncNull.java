package jsonc;

/**
 *
 *
 * @since 0.1.0
 */
public record JsoncNull() implements JsoncScalar {

    @Override
    public String raw() {
        return stringify();
    }

    @Override
    public String stringify() {
        return "null";
    }
}
