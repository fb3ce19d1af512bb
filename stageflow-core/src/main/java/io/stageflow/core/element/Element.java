package io.stageflow.core.element;

import java.util.Map;

/// Read-only accessor over a tree-shaped data record under evaluation.
///
/// Elements are addressed with {@link PropertyPath} expressions. Evaluation
/// never mutates an element, and a path that cannot be resolved is reported
/// as "not found" rather than raised.
///
/// ### Contracts
/// - **Invariant**: repeated lookups of the same path return equal results
/// - **Postcondition**: no lookup method throws for any path string
///
/// @see DictElement for the map-backed implementation
/// @see PropertyPath for path syntax
public interface Element {

    /// Resolves a parsed path against this element.
    ///
    /// @param path parsed path, not null
    /// @return lookup outcome, never null
    PropertyLookup lookup(PropertyPath path);

    /// Returns a deep, unmodifiable view of the element data.
    ///
    /// @return element data, never null
    Map<String, Object> toMap();

    /// Resolves a path expression against this element.
    ///
    /// @param path path expression, may be malformed
    /// @return lookup outcome; "not found" for malformed paths, never null
    default PropertyLookup lookup(String path) {
        return PropertyPath.tryParse(path).map(this::lookup).orElse(PropertyLookup.notFound());
    }

    /// Returns the value at `path`.
    ///
    /// @param path path expression, may be malformed
    /// @return resolved value, or null when absent or explicitly null
    default Object getProperty(String path) {
        return lookup(path).value();
    }

    /// Checks whether every segment of `path` resolves.
    ///
    /// @param path path expression, may be malformed
    /// @return true if the property is present (its value may be null)
    default boolean hasProperty(String path) {
        return lookup(path).found();
    }
}
