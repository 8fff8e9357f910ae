/// Immutable JSON value tree and its decoder.
///
/// {@link json.ez.tree.Json} turns JSON text into a tree of
/// {@link json.ez.tree.JsonValue}s. The tree is a closed set of records:
///
/// | JSON | Java |
/// |------|------|
/// | `null` | {@link json.ez.tree.JsonNull} |
/// | `true` / `false` | {@link json.ez.tree.JsonBoolean} |
/// | number | {@link json.ez.tree.JsonNumber} (original text, converted on demand) |
/// | string | {@link json.ez.tree.JsonString} |
/// | array | {@link json.ez.tree.JsonArray} |
/// | object | {@link json.ez.tree.JsonObject} |
package json.ez.tree;
