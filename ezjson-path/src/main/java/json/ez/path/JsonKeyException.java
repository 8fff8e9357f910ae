package json.ez.path;

/// Thrown when a path does not fit the document: a container of the wrong
/// kind, a missing member, an index out of bounds, a malformed path, or a
/// value of the wrong type.
public class JsonKeyException extends JsonLookupException {

    private static final long serialVersionUID = 1L;

    /// Why a segment could not be resolved.
    public enum Reason {
        NO_ARRAY_FOUND("No array found"),
        INDEX_OUT_OF_BOUNDS("Array index out of bounds"),
        NO_OBJECT_FOUND("No object found"),
        PROPERTY_NOT_FOUND("Object property not found"),
        OPTION_AFTER_KEY("Options must be specified before the actual keys"),
        NOT_INDEX_OR_KEY("Not an index or key"),
        TYPE_MISMATCH("Property is not of the expected type");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        /// {@return the human readable form used in exception messages}
        public String description() {
            return description;
        }
    }

    private final Reason reason;
    private final int index;

    /// Creates an exception for the segment at `index` whose text is `key`.
    public JsonKeyException(Reason reason, int index, String key) {
        this(reason, reason.description(), index, key);
    }

    private JsonKeyException(Reason reason, String description, int index, String key) {
        super(description + " for key " + key + " (@ index " + index + ")", key, null);
        this.reason = reason;
        this.index = index;
    }

    /// Creates a {@link Reason#TYPE_MISMATCH} naming the expected type.
    static JsonKeyException typeMismatch(ExpectedType expected, int index, String key) {
        return new JsonKeyException(Reason.TYPE_MISMATCH,
                "Property is not of type " + expected.label(), index, key);
    }

    /// Returns the classification of the failure.
    public Reason reason() {
        return reason;
    }

    /// Returns the 0-based position of the failing segment in the path (flags
    /// included), or -1 when the path has no key or index.
    public int index() {
        return index;
    }
}
