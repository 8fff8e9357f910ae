package json.ez.tree;

/// The interface that represents a decoded JSON value.
///
/// The hierarchy is closed: a `JsonValue` is always one of `JsonNull`,
/// `JsonBoolean`, `JsonNumber`, `JsonString`, `JsonArray` or `JsonObject`.
/// Instances are immutable and thread safe, so a decoded tree can be shared
/// between threads without copying.
///
/// A `JsonValue` is usually produced by {@link Json#parse(String)}.
///
/// ## Example Usage
/// ```java
/// JsonValue value = Json.parse("{\"name\":\"Alice\",\"age\":30}");
/// switch (value.type()) {
///     case OBJECT -> System.out.println(((JsonObject) value).members().keySet());
///     case ARRAY -> System.out.println(((JsonArray) value).elements().size());
///     default -> System.out.println(value);
/// }
/// ```
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    /// {@return the runtime tag of this value}
    JsonType type();
}
