/// Path based lookups over an ezjson tree.
///
/// {@link json.ez.path.EzJson} is the entry point. Paths are flat sequences of
/// object keys and array indexes, optionally led by
/// {@link json.ez.path.LookupOption} flags, and are resolved by
/// {@link json.ez.path.PathResolver}.
package json.ez.path;
