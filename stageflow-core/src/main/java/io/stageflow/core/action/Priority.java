package io.stageflow.core.action;

import java.util.Locale;

/// Urgency of an {@link Action}, lowest first.
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a wire name case-insensitively.
    ///
    /// @param value wire name such as `high`, not null
    /// @return matching priority, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static Priority fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value, e);
        }
    }
}
