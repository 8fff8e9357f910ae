package json.ez.tree;

/// Exception thrown when JSON text cannot be decoded.
/// This is a runtime exception as malformed input is usually a caller error.
public class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    /// Creates a new parse exception without location information.
    public JsonParseException(String message, Throwable cause) {
        this(message, -1, -1, cause);
    }

    /// Creates a new parse exception for the given 1-based line and column.
    public JsonParseException(String message, int line, int column, Throwable cause) {
        super(formatMessage(message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    /// Returns the 1-based line of the error, or -1 if unknown.
    public int line() {
        return line;
    }

    /// Returns the 1-based column of the error, or -1 if unknown.
    public int column() {
        return column;
    }

    private static String formatMessage(String message, int line, int column) {
        if (line < 0 || column < 0) {
            return message;
        }
        return message + " at line " + line + ", column " + column;
    }
}
