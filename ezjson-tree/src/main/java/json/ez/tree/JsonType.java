package json.ez.tree;

/// The runtime tag of a `JsonValue`.
///
/// Every `JsonValue` reports exactly one tag, so callers can `switch` over
/// `JsonValue#type()` exhaustively instead of chaining `instanceof` checks.
public enum JsonType {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT
}
