package json.ez.path;

/// Thrown when a number was found but cannot be represented as the requested
/// Java type, e.g. `12.5` read as a `long`.
public class JsonConversionException extends JsonLookupException {

    private static final long serialVersionUID = 1L;

    private final String number;
    private final String target;

    /// Creates an exception for the number text `number` found at `key` that
    /// could not be converted to `target`.
    public JsonConversionException(String key, String number, String target, Throwable cause) {
        super("Cannot convert " + number + " to " + target + " for key " + key, key, cause);
        this.number = number;
        this.target = target;
    }

    /// Returns the number as written in the document.
    public String number() {
        return number;
    }

    /// Returns the name of the requested Java type.
    public String target() {
        return target;
    }
}
