package io.stageflow.core.validator;

/// Predicate behind a `custom` lock.
///
/// Receives the resolved property value and the lock's expected value.
/// Implementations may throw; the evaluating lock treats any exception as a
/// failed validation.
@FunctionalInterface
public interface CustomValidator {

    /// Tests a property value.
    ///
    /// @param value resolved property value, may be null
    /// @param expected the lock's expected value, may be null
    /// @return true if the value is acceptable
    boolean test(Object value, Object expected);
}
