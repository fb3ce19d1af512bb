package io.stageflow.core.gate;

import io.stageflow.core.element.Element;
import io.stageflow.core.validator.ValidatorRegistry;
import java.util.Set;

/// A node of a gate tree: either a leaf {@link Lock} or a nested {@link Gate}.
///
/// @implNote Implementations are immutable, so a component may be shared by
/// several gates and evaluated concurrently.
public sealed interface GateComponent permits Lock, Gate {

    /// Evaluates this component against an element.
    ///
    /// @param element the record under evaluation, not null
    /// @param validators registry consulted by custom locks, not null
    /// @return the evaluation result, never null
    ComponentResult evaluate(Element element, ValidatorRegistry validators);

    /// Returns every property path read by this component, recursively.
    ///
    /// @return unmodifiable insertion-ordered set, never null
    Set<String> getPropertyPaths();

    /// Returns the number of leaf locks under this component.
    ///
    /// @return 1 for a lock, the recursive lock count for a gate
    int getComplexity();

    /// Returns the nesting depth of this component.
    ///
    /// @return 0 for a lock, 1 + deepest child for a gate
    int getDepth();

    /// Checks whether this component reads the given property path.
    ///
    /// @param propertyPath path expression, not null
    /// @return true if any lock under this component targets the path
    default boolean requiresProperty(String propertyPath) {
        return getPropertyPaths().contains(propertyPath);
    }
}
