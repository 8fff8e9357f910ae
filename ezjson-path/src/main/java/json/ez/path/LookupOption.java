package json.ez.path;

/// Flags that change how a lookup behaves.
///
/// Flags are passed inline with the keys of a path and must come before the
/// first key or index:
/// ```java
/// EzJson.getString(doc, LookupOption.ERROR_ON_NULL, "data", "str");
/// ```
public enum LookupOption {
    /// Report a resolved JSON `null` as a {@link JsonNullException} instead of
    /// returning it.
    ERROR_ON_NULL
}
