package json.ez.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A JSON object.
///
/// Members keep the order in which they were declared, although lookups never
/// depend on it.
///
/// @param members the member map, unmodifiable
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    /// @throws NullPointerException if `members` is `null` or holds a `null`
    ///         name or value
    public JsonObject {
        Objects.requireNonNull(members, "members must not be null");
        final var copy = new LinkedHashMap<String, JsonValue>(members.size() * 2);
        members.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "member name must not be null"),
                Objects.requireNonNull(value, () -> "value of member \"" + name + "\" must not be null")));
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return a `JsonObject` holding the given members, in iteration order}
    public static JsonObject of(Map<String, ? extends JsonValue> members) {
        return new JsonObject(Collections.unmodifiableMap(members));
    }

    @Override
    public JsonType type() {
        return JsonType.OBJECT;
    }
}
