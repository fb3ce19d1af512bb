package io.stageflow.core.action;

import java.util.Locale;

/// Category of remedial action reported to the caller.
public enum ActionType {
    COMPLETE_FIELD,
    VALIDATE_DATA,
    WAIT_FOR_CONDITION,
    TRANSITION_STAGE,
    RETRY_OPERATION,
    EXTERNAL_ACTION,
    MANUAL_REVIEW;

    /// Returns the lower-case wire name, e.g. `complete_field`.
    ///
    /// @return wire name, never null
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a wire name case-insensitively.
    ///
    /// @param value wire name such as `wait_for_condition`, not null
    /// @return matching type, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static ActionType fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action type: " + value, e);
        }
    }
}
