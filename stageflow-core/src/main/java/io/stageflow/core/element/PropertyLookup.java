package io.stageflow.core.element;

/// Outcome of resolving a property path against an element.
///
/// Distinguishes a property that is present with a `null` value from a
/// property that could not be reached at all. Resolution never throws; a
/// missing intermediate segment, a type mismatch or an out-of-range index all
/// produce {@link #notFound()}.
///
/// @param found whether every segment of the path resolved
/// @param value the resolved value, may be null even when found
public record PropertyLookup(boolean found, Object value) {

    private static final PropertyLookup NOT_FOUND = new PropertyLookup(false, null);

    /// Returns the shared "not found" lookup.
    ///
    /// @return lookup with `found == false`, never null
    public static PropertyLookup notFound() {
        return NOT_FOUND;
    }

    /// Creates a lookup for a resolved value.
    ///
    /// @param value the resolved value, may be null
    /// @return lookup with `found == true`, never null
    public static PropertyLookup of(Object value) {
        return new PropertyLookup(true, value);
    }
}
