package io.stageflow.core.gate;

import io.stageflow.core.util.Values;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/// Failure and remediation texts for {@link Lock}.
///
/// Both texts are pure functions of the lock and the observed value.
final class LockMessages {

    static final String MISSING = "<missing>";

    private LockMessages() {}

    static String failure(Lock lock, boolean found, Object value) {
        String path = lock.getPropertyPath();
        Object expected = lock.getExpectedValue();
        String actual = found ? String.valueOf(value) : MISSING;
        return switch (lock.getType()) {
            case EXISTS ->
                    lock.isNegatedExists()
                            ? "Property '" + path + "' should not exist but has value: " + actual
                            : "Property '" + path + "' is required but missing or empty";
            case EQUALS ->
                    "Property '" + path + "' should equal '" + expected + "' but is '" + actual + "'";
            case GREATER_THAN ->
                    "Property '" + path + "' should be greater than " + expected + " but is " + actual;
            case LESS_THAN ->
                    "Property '" + path + "' should be less than " + expected + " but is " + actual;
            case CONTAINS ->
                    "Property '" + path + "' should contain '" + expected + "' but is '" + actual + "'";
            case REGEX ->
                    "Property '"
                            + path
                            + "' should match pattern '"
                            + expected
                            + "' but is '"
                            + actual
                            + "'";
            case TYPE_CHECK ->
                    "Property '"
                            + path
                            + "' should be of type '"
                            + typeName(expected)
                            + "' but is '"
                            + (found ? valueTypeName(value) : MISSING)
                            + "' with value '"
                            + actual
                            + "'";
            case RANGE -> {
                if (expected instanceof Collection<?> c && c.size() == 2) {
                    List<?> bounds = new ArrayList<>(c);
                    yield "Property '"
                            + path
                            + "' should be between "
                            + bounds.get(0)
                            + " and "
                            + bounds.get(1)
                            + " but is "
                            + actual;
                }
                yield "Property '" + path + "' should be within range " + expected + " but is " + actual;
            }
            case LENGTH ->
                    "Property '"
                            + path
                            + "' should have length "
                            + lengthConstraint(expected)
                            + " but has length "
                            + measured(found, value);
            case NOT_EMPTY -> "Property '" + path + "' should not be empty but is '" + actual + "'";
            case IN_LIST ->
                    "Property '" + path + "' should be one of " + expected + " but is '" + actual + "'";
            case NOT_IN_LIST ->
                    "Property '"
                            + path
                            + "' should not be one of "
                            + expected
                            + " but is '"
                            + actual
                            + "'";
            case CUSTOM ->
                    "Custom validation '"
                            + lock.getValidatorName()
                            + "' failed for property '"
                            + path
                            + "'";
        };
    }

    static String action(Lock lock) {
        String path = lock.getPropertyPath();
        Object expected = lock.getExpectedValue();
        return switch (lock.getType()) {
            case EXISTS ->
                    lock.isNegatedExists()
                            ? "Remove property: " + path
                            : "Set missing field: " + path;
            case EQUALS -> "Set " + path + " to '" + expected + "'";
            case GREATER_THAN -> "Increase " + path + " to be greater than " + expected;
            case LESS_THAN -> "Decrease " + path + " to be less than " + expected;
            case CONTAINS -> "Ensure " + path + " contains '" + expected + "'";
            case REGEX -> "Update " + path + " to match pattern: " + expected;
            case TYPE_CHECK -> "Change " + path + " to be of type " + typeName(expected);
            case RANGE -> {
                if (expected instanceof Collection<?> c && c.size() == 2) {
                    List<?> bounds = new ArrayList<>(c);
                    yield "Set "
                            + path
                            + " to a value between "
                            + bounds.get(0)
                            + " and "
                            + bounds.get(1);
                }
                yield "Set " + path + " to a value within range " + expected;
            }
            case LENGTH -> {
                if (Values.isIntegral(expected)) {
                    yield "Adjust " + path + " to have exactly " + expected + " elements/characters";
                }
                if (expected instanceof Map<?, ?>) {
                    yield "Adjust "
                            + path
                            + " to have "
                            + lengthConstraint(expected)
                            + " elements/characters";
                }
                yield "Adjust " + path + " length to match " + expected;
            }
            case NOT_EMPTY -> "Provide a non-empty value for " + path;
            case IN_LIST -> "Set " + path + " to one of: " + joined(expected);
            case NOT_IN_LIST -> "Change " + path + " from restricted value";
            case CUSTOM -> "Fix custom validation for " + path;
        };
    }

    private static String lengthConstraint(Object expected) {
        if (expected instanceof Map<?, ?> bounds) {
            List<String> parts = new ArrayList<>();
            if (bounds.containsKey("min")) {
                parts.add("at least " + bounds.get("min"));
            }
            if (bounds.containsKey("max")) {
                parts.add("at most " + bounds.get("max"));
            }
            return String.join(" and ", parts);
        }
        return String.valueOf(expected);
    }

    private static String measured(boolean found, Object value) {
        if (!found) {
            return MISSING;
        }
        OptionalInt length = Values.lengthOf(value);
        return length.isPresent() ? String.valueOf(length.getAsInt()) : "<non-measurable>";
    }

    private static String joined(Object expected) {
        if (expected instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return String.valueOf(expected);
    }

    static String typeName(Object expected) {
        if (expected instanceof Class<?> type) {
            return type.getSimpleName();
        }
        return String.valueOf(expected);
    }

    static String valueTypeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (Values.isIntegral(value)) {
            return "integer";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof List) {
            return "list";
        }
        if (value instanceof Map) {
            return "map";
        }
        if (value instanceof Set) {
            return "set";
        }
        return value.getClass().getSimpleName();
    }
}
