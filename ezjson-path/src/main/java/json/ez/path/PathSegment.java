package json.ez.path;

import java.util.Objects;

/// One element of a {@link LookupPath}.
///
/// - `Key`: select a member of a JSON object by name
/// - `Index`: select an element of a JSON array by 0-based position
/// - `Flag`: a {@link LookupOption}; flags do not move through the document
///
/// Strings only ever address objects and integers only ever address arrays;
/// there is no coercion between the two.
public sealed interface PathSegment permits PathSegment.Key, PathSegment.Index, PathSegment.Flag {

    /// {@return the text used for this segment in error messages}
    String label();

    /// {@return a segment selecting the object member `name`}
    static Key key(String name) {
        return new Key(name);
    }

    /// {@return a segment selecting the array element at `index`}
    static Index index(int index) {
        return new Index(index);
    }

    /// {@return a segment carrying the given flag}
    static Flag option(LookupOption option) {
        return new Flag(option);
    }

    /// Selects an object member by name.
    record Key(String name) implements PathSegment {
        public Key {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String label() {
            return name;
        }
    }

    /// Selects an array element by position. Negative positions are accepted
    /// here and reported as out of bounds when resolved.
    record Index(int index) implements PathSegment {
        @Override
        public String label() {
            return Integer.toString(index);
        }
    }

    /// Carries a lookup flag.
    record Flag(LookupOption option) implements PathSegment {
        public Flag {
            Objects.requireNonNull(option, "option must not be null");
        }

        @Override
        public String label() {
            return option.name();
        }
    }
}
