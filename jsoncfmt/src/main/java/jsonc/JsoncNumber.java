package jsonc;

/**
 * A number, held as its decoded double.
 *
 * <p> Output is produced from {@link #value()}, not from {@link #raw()}, so {@code 1.50} comes back as {@code 1.5}
 * and {@code 1E2} as {@code 100}.
 *
 * @since 0.1.0
 */
public record JsoncNumber(double value, String raw) implements JsoncScalar {

    public JsoncNumber(double value) {
        this(value, Jsonc.Writer.formatNumber(value));
    }

    @Override
    public String stringify() {
        return Jsonc.Writer.formatNumber(value);
    }
}
