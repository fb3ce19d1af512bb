package io.stageflow.core.schema;

import io.stageflow.core.util.Values;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Declared type of a schema field.
public enum FieldType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    NULL;

    /// Checks a value against this type.
    ///
    /// `NUMBER` accepts any numeric value including integers; a `null` value
    /// matches only `NULL`.
    ///
    /// @param value the value to check, may be null
    /// @return true if the value conforms
    public boolean matches(Object value) {
        if (value == null) {
            return this == NULL;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case INTEGER -> Values.isIntegral(value);
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof List;
            case OBJECT -> value instanceof Map;
            case NULL -> false;
        };
    }

    /// Returns the lower-case wire name, e.g. `integer`.
    ///
    /// @return wire name, never null
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a wire name case-insensitively.
    ///
    /// @param value type name, not null
    /// @return the matching type, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static FieldType fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown field type: " + value, e);
        }
    }
}
