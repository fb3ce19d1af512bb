package io.stageflow.core.gate;

import java.util.Locale;

/// The thirteen kinds of atomic predicate a {@link Lock} can apply.
///
/// Dispatch over this enum uses exhaustive `switch` expressions, so adding a
/// constant is a compile error until every evaluation and message site
/// handles it.
public enum LockType {
    EXISTS("exists", false),
    EQUALS("equals", true),
    GREATER_THAN("greater_than", true),
    LESS_THAN("less_than", true),
    CONTAINS("contains", true),
    REGEX("regex", true),
    TYPE_CHECK("type_check", true),
    RANGE("range", true),
    LENGTH("length", true),
    NOT_EMPTY("not_empty", false),
    IN_LIST("in_list", true),
    NOT_IN_LIST("not_in_list", true),
    CUSTOM("custom", false);

    private final String value;
    private final boolean requiresExpectedValue;

    LockType(String value, boolean requiresExpectedValue) {
        this.value = value;
        this.requiresExpectedValue = requiresExpectedValue;
    }

    /// Returns the wire name, e.g. `greater_than`.
    ///
    /// @return wire name, never null
    public String value() {
        return value;
    }

    /// Whether locks of this type must carry a non-null expected value.
    ///
    /// @return true for comparison-style types
    public boolean requiresExpectedValue() {
        return requiresExpectedValue;
    }

    /// Parses a wire name case-insensitively.
    ///
    /// @param value wire name, not null
    /// @return the matching type, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static LockType fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LockType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown lock type: " + value);
    }
}
