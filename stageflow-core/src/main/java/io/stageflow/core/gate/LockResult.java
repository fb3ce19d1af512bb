package io.stageflow.core.gate;

import java.util.List;

/// Outcome of {@link Lock#validate}.
///
/// Failed results carry both a failure description and a remediation hint;
/// passing results carry neither.
///
/// @param success whether the predicate held
/// @param propertyPath the path the lock read, not null
/// @param lockType the lock kind, not null
/// @param propertyFound whether the path resolved on the element
/// @param actualValue the resolved value, null when absent
/// @param expectedValue the lock's expected value, may be null
/// @param errorMessage failure description, null on success
/// @param actionMessage remediation hint, null on success
public record LockResult(
        boolean success,
        String propertyPath,
        LockType lockType,
        boolean propertyFound,
        Object actualValue,
        Object expectedValue,
        String errorMessage,
        String actionMessage)
        implements ComponentResult {

    @Override
    public boolean passed() {
        return success;
    }

    @Override
    public List<String> messages() {
        return errorMessage == null ? List.of() : List.of(errorMessage);
    }

    @Override
    public List<String> actions() {
        return actionMessage == null ? List.of() : List.of(actionMessage);
    }
}
