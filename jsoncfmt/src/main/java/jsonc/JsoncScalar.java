package jsonc;

/**
 * A leaf value: string, number, boolean or null.
 *
 * @since 0.1.0
 */
public sealed interface JsoncScalar extends JsoncNode permits JsoncString, JsoncNumber, JsoncBoolean, JsoncNull {

    /**
     * @return the exact source text this value was decoded from
     */
    String raw();
}
