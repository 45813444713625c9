package jsonc;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An object. Members are entries and comments interleaved in source order.
 *
 * <p> Keys are not required to be unique; duplicates are kept as written.
 *
 * @since 0.1.0
 */
public record JsoncObject(List<Member> members) implements JsoncNode {

    public JsoncObject {
        members = List.copyOf(members);
    }

    /**
     * One slot in an object's member list.
     */
    public sealed interface Member permits Entry, JsoncComment {}

    public record Entry(String key, JsoncNode value) implements Member {}

    public List<Entry> entries() {
        return members.stream()
                .filter(Entry.class::isInstance)
                .map(Entry.class::cast)
                .toList();
    }

    public boolean hasComments() {
        return members.stream().anyMatch(JsoncComment.class::isInstance);
    }

    @Override
    public String stringify() {
        return entries().stream()
                .map(e -> "%s: %s".formatted(Jsonc.Writer.quote(e.key()), e.value().stringify()))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
