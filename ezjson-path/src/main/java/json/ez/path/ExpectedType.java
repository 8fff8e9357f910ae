package json.ez.path;

import json.ez.tree.JsonType;
import json.ez.tree.JsonValue;

/// The type a lookup asserts for the value it resolves.
///
/// JSON `null` is accepted for every expected type.
public enum ExpectedType {
    ARRAY("array", JsonType.ARRAY),
    OBJECT("object", JsonType.OBJECT),
    NUMBER("number", JsonType.NUMBER),
    STRING("string", JsonType.STRING),
    BOOLEAN("bool", JsonType.BOOLEAN);

    private final String label;
    private final JsonType type;

    ExpectedType(String label, JsonType type) {
        this.label = label;
        this.type = type;
    }

    /// {@return the name used in type mismatch messages}
    public String label() {
        return label;
    }

    /// {@return true if `value` is of this type}
    public boolean matches(JsonValue value) {
        return value.type() == type;
    }
}
