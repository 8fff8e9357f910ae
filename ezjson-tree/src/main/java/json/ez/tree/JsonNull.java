package json.ez.tree;

/// The JSON `null` literal.
public record JsonNull() implements JsonValue {

    private static final JsonNull INSTANCE = new JsonNull();

    /// {@return the shared `JsonNull` instance}
    public static JsonNull of() {
        return INSTANCE;
    }

    @Override
    public JsonType type() {
        return JsonType.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
