package json.ez.path;

/// Thrown when a lookup made with {@link LookupOption#ERROR_ON_NULL} resolves to
/// a JSON `null`.
public class JsonNullException extends JsonLookupException {

    private static final long serialVersionUID = 1L;

    /// Creates an exception for the `null` value found at `key`.
    public JsonNullException(String key) {
        super("Value is null for key " + key, key, null);
    }
}
