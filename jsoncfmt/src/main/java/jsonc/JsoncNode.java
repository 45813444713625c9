package jsonc;

/**
 * A node of a parsed JSONC document.
 *
 * <p> The variant set is closed: {@link JsoncScalar} leaves, {@link JsoncComment}, {@link JsoncArray} and
 * {@link JsoncObject}. Nodes are immutable and never shared between documents.
 *
 * @since 0.1.0
 */
public sealed interface JsoncNode permits JsoncScalar, JsoncComment, JsoncArray, JsoncObject {

    /**
     * Render this node on a single line.
     *
     * <p> Containers render as {@code [a, b]} and {@code {"k": v}}; comments inside them are skipped.
     * The layout engine uses this form both as output and as the length probe against the inline threshold.
     *
     * @return one-line text, never {@code null}
     */
    String stringify();

    default boolean isContainer() {
        return this instanceof JsoncArray || this instanceof JsoncObject;
    }
}
