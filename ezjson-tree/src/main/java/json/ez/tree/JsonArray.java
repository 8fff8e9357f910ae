package json.ez.tree;

import java.util.List;
import java.util.Objects;

/// A JSON array.
///
/// @param elements the elements in document order, unmodifiable
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    /// @throws NullPointerException if `elements` is `null` or contains `null`
    public JsonArray {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    /// {@return a `JsonArray` holding the given elements}
    public static JsonArray of(List<? extends JsonValue> elements) {
        return new JsonArray(List.copyOf(elements));
    }

    @Override
    public JsonType type() {
        return JsonType.ARRAY;
    }
}
