package json.ez.path;

/// Base class of every failure reported by a path lookup.
///
/// Catch the subclasses to tell apart a path that does not fit the document
/// ({@link JsonKeyException}), a value that is `null` ({@link JsonNullException})
/// and a number that does not fit the requested Java type
/// ({@link JsonConversionException}).
public abstract class JsonLookupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;

    JsonLookupException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /// Returns the text of the path segment the failure is reported for, or an
    /// empty string when the path has no key or index.
    public String key() {
        return key;
    }
}
