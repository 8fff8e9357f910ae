package json.ez.tree;

import java.util.Objects;

/// A JSON string. `value()` is the unescaped content.
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return a `JsonString` holding the given content}
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public JsonType type() {
        return JsonType.STRING;
    }
}
