package json.ez.path;

import java.util.Collection;

/// The effective settings of a lookup, folded from the {@link LookupOption}
/// flags of a {@link LookupPath}.
///
/// @param errorOnNull whether a resolved JSON `null` is reported as an error
public record LookupOptions(boolean errorOnNull) {

    /// The settings used when a path carries no flags.
    public static final LookupOptions DEFAULTS = new LookupOptions(false);

    /// {@return the settings enabled by the given flags}
    public static LookupOptions of(Collection<LookupOption> flags) {
        boolean errorOnNull = false;
        for (LookupOption flag : flags) {
            switch (flag) {
                case ERROR_ON_NULL -> errorOnNull = true;
            }
        }
        return errorOnNull ? new LookupOptions(true) : DEFAULTS;
    }
}
