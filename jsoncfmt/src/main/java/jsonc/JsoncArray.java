package jsonc;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An array. Children are values and comments interleaved in source order.
 *
 * @since 0.1.0
 */
public record JsoncArray(List<JsoncNode> children) implements JsoncNode {

    public JsoncArray {
        children = List.copyOf(children);
    }

    public boolean hasComments() {
        return children.stream().anyMatch(JsoncComment.class::isInstance);
    }

    @Override
    public String stringify() {
        return children.stream()
                .filter(c -> !(c instanceof JsoncComment))
                .map(JsoncNode::stringify)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
