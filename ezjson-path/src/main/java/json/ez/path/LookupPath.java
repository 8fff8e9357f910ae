package json.ez.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// A validated, immutable sequence of {@link PathSegment}s.
///
/// A path is built from the same mixed keys the {@link EzJson} accessors take:
/// a `String` selects an object member, an `Integer` selects an array element
/// and a {@link LookupOption} sets a flag. `PathSegment` instances are accepted
/// as they are. All flags must precede the first key or index.
///
/// Build a path once and reuse it for any number of documents:
/// ```java
/// LookupPath firstTitle = LookupPath.of("books", 0, "title");
/// String a = EzJson.getString(doc1, firstTitle);
/// String b = EzJson.getString(doc2, firstTitle);
/// ```
public final class LookupPath {

    private static final Logger LOG = Logger.getLogger(LookupPath.class.getName());

    /// The path that resolves to the root itself.
    public static final LookupPath EMPTY = new LookupPath(List.of(), LookupOptions.DEFAULTS, -1);

    private final List<PathSegment> segments;
    private final LookupOptions options;
    private final int lastKeyIndex;

    private LookupPath(List<PathSegment> segments, LookupOptions options, int lastKeyIndex) {
        this.segments = segments;
        this.options = options;
        this.lastKeyIndex = lastKeyIndex;
    }

    /// Builds a path from mixed keys.
    ///
    /// @param keys `String`, `Integer`, `LookupOption` or `PathSegment` values
    /// @return the validated path
    /// @throws JsonKeyException with {@link JsonKeyException.Reason#NOT_INDEX_OR_KEY}
    ///         for a key of any other type (including `null`), or
    ///         {@link JsonKeyException.Reason#OPTION_AFTER_KEY} for a flag that
    ///         follows a key or index
    /// @throws NullPointerException if `keys` is `null`
    public static LookupPath of(Object... keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        return of(Arrays.asList(keys));
    }

    /// Builds a path from a list of mixed keys. See {@link #of(Object...)}.
    public static LookupPath of(List<?> keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        if (keys.isEmpty()) {
            return EMPTY;
        }
        final var segments = new ArrayList<PathSegment>(keys.size());
        final var flags = new ArrayList<LookupOption>();
        int lastKeyIndex = -1;
        for (int i = 0; i < keys.size(); i++) {
            final PathSegment segment = toSegment(keys.get(i), i);
            if (segment instanceof PathSegment.Flag flag) {
                if (lastKeyIndex >= 0) {
                    throw new JsonKeyException(JsonKeyException.Reason.OPTION_AFTER_KEY, i, flag.label());
                }
                flags.add(flag.option());
            } else {
                lastKeyIndex = i;
            }
            segments.add(segment);
        }
        final var path = new LookupPath(List.copyOf(segments), LookupOptions.of(flags), lastKeyIndex);
        LOG.finer(() -> "Built path " + path);
        return path;
    }

    private static PathSegment toSegment(Object key, int index) {
        if (key instanceof PathSegment segment) {
            return segment;
        }
        if (key instanceof String name) {
            return new PathSegment.Key(name);
        }
        if (key instanceof Integer position) {
            return new PathSegment.Index(position);
        }
        if (key instanceof LookupOption option) {
            return new PathSegment.Flag(option);
        }
        throw new JsonKeyException(JsonKeyException.Reason.NOT_INDEX_OR_KEY, index, String.valueOf(key));
    }

    /// {@return every segment in order, flags included}
    public List<PathSegment> segments() {
        return segments;
    }

    /// {@return the settings folded from the flags of this path}
    public LookupOptions options() {
        return options;
    }

    /// {@return the position of the last key or index, or -1 if there is none}
    public int lastKeyIndex() {
        return lastKeyIndex;
    }

    /// {@return the text of the last key or index, or `""` if there is none}
    public String lastKey() {
        return lastKeyIndex < 0 ? "" : segments.get(lastKeyIndex).label();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LookupPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /// {@return the segments in bracket notation, e.g. `[ERROR_ON_NULL, "data", 0]`}
    @Override
    public String toString() {
        return segments.stream()
                .map(segment -> segment instanceof PathSegment.Key key ? '"' + key.name() + '"' : segment.label())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
