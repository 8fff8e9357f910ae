package json.ez.tree;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;

/// A JSON number kept in its original decimal text.
///
/// Decoding never converts a number to a binary type, so neither precision nor
/// range is lost until a caller asks for a particular Java type with
/// {@link #toLong()}, {@link #toDouble()} or {@link #toBigDecimal()}.
/// Two `JsonNumber`s are equal when their texts are equal, so `1.0` and `1`
/// are different values.
///
/// @param text the number exactly as written in the JSON document
/// @spec https://datatracker.ietf.org/doc/html/rfc8259#section-6 RFC 8259:
///      The JavaScript Object Notation (JSON) Data Interchange Format - Numbers
public record JsonNumber(String text) implements JsonValue {

    private static final Pattern NUMBER_GRAMMAR =
            Pattern.compile("-?(?:0|[1-9][0-9]*)(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?");

    /// @throws NullPointerException if `text` is `null`
    /// @throws IllegalArgumentException if `text` is not a JSON number
    public JsonNumber {
        Objects.requireNonNull(text, "text must not be null");
        if (!NUMBER_GRAMMAR.matcher(text).matches()) {
            throw new IllegalArgumentException("Not a JSON number: " + text);
        }
    }

    /// {@return a `JsonNumber` for the given JSON number text}
    ///
    /// @throws IllegalArgumentException if `text` is not a JSON number
    public static JsonNumber of(String text) {
        return new JsonNumber(text);
    }

    /// {@return a `JsonNumber` whose text is `Long.toString(value)`}
    public static JsonNumber of(long value) {
        return new JsonNumber(Long.toString(value));
    }

    /// {@return a `JsonNumber` whose text is `Double.toString(value)`}
    ///
    /// @throws IllegalArgumentException if `value` is NaN or infinite
    public static JsonNumber of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
        return new JsonNumber(Double.toString(value));
    }

    /// {@return this number as a `long`}
    ///
    /// The text must be a plain integer within the `long` range. A fraction
    /// or an exponent is rejected even when the value is whole, e.g. `2.0`.
    ///
    /// @throws NumberFormatException if the text is not a `long`
    public long toLong() {
        return Long.parseLong(text);
    }

    /// {@return this number as the nearest `double`}
    ///
    /// @throws NumberFormatException if the value is outside the finite
    ///         `double` range
    public double toDouble() {
        final double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw new NumberFormatException("Number out of double range: " + text);
        }
        return value;
    }

    /// {@return this number as an exact `BigDecimal`}
    public BigDecimal toBigDecimal() {
        return new BigDecimal(text);
    }

    @Override
    public JsonType type() {
        return JsonType.NUMBER;
    }

    @Override
    public String toString() {
        return text;
    }
}
