package json.ez.path;

import json.ez.tree.JsonArray;
import json.ez.tree.JsonBoolean;
import json.ez.tree.JsonNumber;
import json.ez.tree.JsonObject;
import json.ez.tree.JsonString;
import json.ez.tree.JsonValue;

import java.util.List;
import java.util.Map;

/// Typed accessors for values nested in a decoded JSON document.
///
/// Every accessor takes the document and a path, either as mixed keys or as a
/// prebuilt {@link LookupPath}. A `String` key selects an object member, an
/// `Integer` key selects an array element and {@link LookupOption} flags may
/// lead the keys.
///
/// ```java
/// JsonValue doc = Json.parse(text);
/// String str = EzJson.getString(doc, "data", "subData", "array", 0, "str");
/// long second = EzJson.getLong(doc, "array", 1);
/// boolean flag = EzJson.getBoolean(doc, LookupOption.ERROR_ON_NULL, "data", "subData", "bool");
/// ```
///
/// A JSON `null` is returned as `null` by the accessors returning objects and as
/// `0`, `0.0` or `false` by the ones returning primitives, unless the path
/// carries {@link LookupOption#ERROR_ON_NULL}.
///
/// Failures are reported as {@link JsonKeyException}, {@link JsonNullException}
/// or {@link JsonConversionException}.
public final class EzJson {

    private EzJson() {
        throw new AssertionError("EzJson cannot be instantiated");
    }

    /// {@return the value at `keys`, of any type}
    public static JsonValue getProperty(JsonValue root, Object... keys) {
        return getProperty(root, LookupPath.of(keys));
    }

    /// {@return the value at `path`, of any type}
    public static JsonValue getProperty(JsonValue root, LookupPath path) {
        return PathResolver.resolve(root, null, path);
    }

    /// {@return the value at `keys`, checked against `expected` unless that is `null`}
    public static JsonValue getPropertyWithType(JsonValue root, ExpectedType expected, Object... keys) {
        return getPropertyWithType(root, expected, LookupPath.of(keys));
    }

    /// {@return the value at `path`, checked against `expected` unless that is `null`}
    public static JsonValue getPropertyWithType(JsonValue root, ExpectedType expected, LookupPath path) {
        return PathResolver.resolve(root, expected, path);
    }

    /// {@return the elements of the array at `keys`, or `null` for JSON `null`}
    public static List<JsonValue> getArray(JsonValue root, Object... keys) {
        return getArray(root, LookupPath.of(keys));
    }

    /// {@return the elements of the array at `path`, or `null` for JSON `null`}
    public static List<JsonValue> getArray(JsonValue root, LookupPath path) {
        final JsonValue value = PathResolver.resolve(root, ExpectedType.ARRAY, path);
        return value instanceof JsonArray array ? array.elements() : null;
    }

    /// {@return the members of the object at `keys`, or `null` for JSON `null`}
    public static Map<String, JsonValue> getObject(JsonValue root, Object... keys) {
        return getObject(root, LookupPath.of(keys));
    }

    /// {@return the members of the object at `path`, or `null` for JSON `null`}
    public static Map<String, JsonValue> getObject(JsonValue root, LookupPath path) {
        final JsonValue value = PathResolver.resolve(root, ExpectedType.OBJECT, path);
        return value instanceof JsonObject object ? object.members() : null;
    }

    /// {@return the number at `keys` in its original text, or `null` for JSON `null`}
    public static JsonNumber getNumber(JsonValue root, Object... keys) {
        return getNumber(root, LookupPath.of(keys));
    }

    /// {@return the number at `path` in its original text, or `null` for JSON `null`}
    public static JsonNumber getNumber(JsonValue root, LookupPath path) {
        final JsonValue value = PathResolver.resolve(root, ExpectedType.NUMBER, path);
        return value instanceof JsonNumber number ? number : null;
    }

    /// {@return the integer at `keys`, or `0` for JSON `null`}
    ///
    /// @throws JsonConversionException if the number has a fraction or an
    ///         exponent, or does not fit in a `long`
    public static long getLong(JsonValue root, Object... keys) {
        return getLong(root, LookupPath.of(keys));
    }

    /// {@return the integer at `path`, or `0` for JSON `null`}
    ///
    /// @throws JsonConversionException if the number has a fraction or an
    ///         exponent, or does not fit in a `long`
    public static long getLong(JsonValue root, LookupPath path) {
        final JsonNumber number = getNumber(root, path);
        if (number == null) {
            return 0L;
        }
        try {
            return number.toLong();
        } catch (NumberFormatException e) {
            throw new JsonConversionException(path.lastKey(), number.text(), "long", e);
        }
    }

    /// {@return the number at `keys` as a `double`, or `0.0` for JSON `null`}
    ///
    /// @throws JsonConversionException if the number is outside the finite
    ///         `double` range
    public static double getDouble(JsonValue root, Object... keys) {
        return getDouble(root, LookupPath.of(keys));
    }

    /// {@return the number at `path` as a `double`, or `0.0` for JSON `null`}
    ///
    /// @throws JsonConversionException if the number is outside the finite
    ///         `double` range
    public static double getDouble(JsonValue root, LookupPath path) {
        final JsonNumber number = getNumber(root, path);
        if (number == null) {
            return 0.0;
        }
        try {
            return number.toDouble();
        } catch (NumberFormatException e) {
            throw new JsonConversionException(path.lastKey(), number.text(), "double", e);
        }
    }

    /// {@return the string at `keys`, or an empty string for JSON `null`}
    public static String getString(JsonValue root, Object... keys) {
        return getString(root, LookupPath.of(keys));
    }

    /// {@return the string at `path`, or an empty string for JSON `null`}
    public static String getString(JsonValue root, LookupPath path) {
        final JsonValue value = PathResolver.resolve(root, ExpectedType.STRING, path);
        return value instanceof JsonString string ? string.value() : "";
    }

    /// {@return the boolean at `keys`, or `false` for JSON `null`}
    public static boolean getBoolean(JsonValue root, Object... keys) {
        return getBoolean(root, LookupPath.of(keys));
    }

    /// {@return the boolean at `path`, or `false` for JSON `null`}
    public static boolean getBoolean(JsonValue root, LookupPath path) {
        final JsonValue value = PathResolver.resolve(root, ExpectedType.BOOLEAN, path);
        return value instanceof JsonBoolean bool && bool.value();
    }
}
