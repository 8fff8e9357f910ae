package json.ez.path;

import json.ez.tree.JsonArray;
import json.ez.tree.JsonNull;
import json.ez.tree.JsonObject;
import json.ez.tree.JsonValue;

import java.util.Objects;
import java.util.logging.Logger;

/// Walks a {@link LookupPath} through a `JsonValue` tree.
///
/// Each key or index moves one level down; a failure is reported for the
/// first segment that does not fit. After the walk the value is checked
/// against the expected type, if any, and against the null policy of the path.
/// The tree is only read, so a decoded document can be resolved from many
/// threads at once.
public final class PathResolver {

    private static final Logger LOG = Logger.getLogger(PathResolver.class.getName());

    private PathResolver() {
        throw new AssertionError("PathResolver cannot be instantiated");
    }

    /// Resolves `path` against `root`.
    ///
    /// @param root the document to read
    /// @param expected the type the result must have, or `null` to accept any value
    /// @param path the path to follow
    /// @return the value found; JSON `null` is returned as {@link JsonNull} unless the
    ///         path carries {@link LookupOption#ERROR_ON_NULL}
    /// @throws JsonKeyException if a segment does not fit the document or the value
    ///         found is not of the expected type
    /// @throws JsonNullException if the value found is `null` and the path carries
    ///         {@link LookupOption#ERROR_ON_NULL}
    /// @throws NullPointerException if `root` or `path` is `null`
    public static JsonValue resolve(JsonValue root, ExpectedType expected, LookupPath path) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(path, "path must not be null");
        LOG.fine(() -> "Resolving " + path + (expected == null ? "" : " as " + expected.label()));

        JsonValue current = root;
        final var segments = path.segments();
        for (int i = 0; i < segments.size(); i++) {
            final PathSegment segment = segments.get(i);
            if (segment instanceof PathSegment.Index index) {
                current = element(current, index, i);
            } else if (segment instanceof PathSegment.Key key) {
                current = member(current, key, i);
            }
            // flags were folded into path.options() when the path was built
        }

        if (current instanceof JsonNull) {
            if (path.options().errorOnNull()) {
                throw new JsonNullException(path.lastKey());
            }
            return current;
        }
        if (expected != null && !expected.matches(current)) {
            final JsonValue found = current;
            LOG.finer(() -> "Expected " + expected.label() + " but found " + found.type());
            throw JsonKeyException.typeMismatch(expected, path.lastKeyIndex(), path.lastKey());
        }
        return current;
    }

    private static JsonValue element(JsonValue current, PathSegment.Index index, int position) {
        if (!(current instanceof JsonArray array)) {
            throw new JsonKeyException(JsonKeyException.Reason.NO_ARRAY_FOUND, position, index.label());
        }
        final var elements = array.elements();
        if (index.index() < 0 || index.index() >= elements.size()) {
            throw new JsonKeyException(JsonKeyException.Reason.INDEX_OUT_OF_BOUNDS, position, index.label());
        }
        LOG.finer(() -> "Segment " + position + ": element " + index.index() + " of " + elements.size());
        return elements.get(index.index());
    }

    private static JsonValue member(JsonValue current, PathSegment.Key key, int position) {
        if (!(current instanceof JsonObject object)) {
            throw new JsonKeyException(JsonKeyException.Reason.NO_OBJECT_FOUND, position, key.label());
        }
        final JsonValue value = object.members().get(key.name());
        if (value == null) {
            throw new JsonKeyException(JsonKeyException.Reason.PROPERTY_NOT_FOUND, position, key.label());
        }
        LOG.finer(() -> "Segment " + position + ": member \"" + key.name() + "\"");
        return value;
    }
}
