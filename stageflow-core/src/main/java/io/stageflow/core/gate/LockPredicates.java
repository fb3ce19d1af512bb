package io.stageflow.core.gate;

import io.stageflow.core.util.Values;
import io.stageflow.core.validator.ValidatorDefinition;
import io.stageflow.core.validator.ValidatorRegistry;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Per-type predicate logic for {@link Lock}.
///
/// Every method is total: malformed expected values, wrong value types and
/// throwing custom validators all yield `false`.
final class LockPredicates {

    private static final Logger logger = Logger.getLogger(LockPredicates.class.getName());

    private LockPredicates() {}

    /// Applies the lock to a resolved value.
    ///
    /// @param lock the lock, not null
    /// @param found whether the property path resolved
    /// @param value the resolved value, may be null
    /// @param validators registry for custom locks, not null
    /// @return true if the predicate holds
    static boolean test(Lock lock, boolean found, Object value, ValidatorRegistry validators) {
        if (lock.getType() == LockType.EXISTS) {
            boolean present = found && !isBlankValue(value);
            return lock.isNegatedExists() != present;
        }
        if (!found || value == null) {
            return false;
        }
        Object expected = lock.getExpectedValue();
        return switch (lock.getType()) {
            case EXISTS -> true;
            case EQUALS -> Values.valueEquals(value, expected);
            case GREATER_THAN -> compare(value, expected) > 0;
            case LESS_THAN -> compare(value, expected) < 0;
            case CONTAINS -> contains(value, expected);
            case REGEX -> matches(lock.getCompiledPattern(), value);
            case TYPE_CHECK -> isOfType(value, expected);
            case RANGE -> inRange(value, expected);
            case LENGTH -> hasLength(value, expected);
            case NOT_EMPTY -> isNotEmpty(value);
            case IN_LIST -> expected instanceof Collection<?> c && Values.containsValue(c, value);
            case NOT_IN_LIST ->
                    expected instanceof Collection<?> c && !Values.containsValue(c, value);
            case CUSTOM -> runCustom(lock, value, validators);
        };
    }

    /// Values that count as absent for `exists` locks.
    static boolean isBlankValue(Object value) {
        return value == null
                || (value instanceof String s && s.isEmpty())
                || (value instanceof List<?> l && l.isEmpty());
    }

    /// Compares after coercing both sides to double.
    ///
    /// @return sign of `value - expected`, or 0 when either side is not numeric
    ///     or NaN so that both greater-than and less-than fail
    private static int compare(Object value, Object expected) {
        OptionalDouble v = Values.toDouble(value);
        OptionalDouble e = Values.toDouble(expected);
        if (v.isEmpty()
                || e.isEmpty()
                || Double.isNaN(v.getAsDouble())
                || Double.isNaN(e.getAsDouble())) {
            return 0;
        }
        double actual = v.getAsDouble();
        double bound = e.getAsDouble();
        if (actual == bound) {
            return 0;
        }
        return actual < bound ? -1 : 1;
    }

    private static boolean contains(Object value, Object expected) {
        if (value instanceof String s) {
            return expected instanceof String e && s.contains(e);
        }
        if (value instanceof Collection<?> c) {
            return Values.containsValue(c, expected);
        }
        if (value instanceof Map<?, ?> m) {
            return m.containsKey(expected);
        }
        return false;
    }

    private static boolean matches(Optional<Pattern> pattern, Object value) {
        return value instanceof String s && pattern.map(p -> p.matcher(s).lookingAt()).orElse(false);
    }

    static boolean isOfType(Object value, Object expected) {
        if (expected instanceof Class<?> type) {
            return type.isInstance(value);
        }
        if (!(expected instanceof String name)) {
            return false;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "str", "string" -> value instanceof String;
            case "int", "integer" -> Values.isIntegral(value);
            case "float", "double" -> value instanceof Double || value instanceof Float;
            case "number" -> value instanceof Number;
            case "bool", "boolean" -> value instanceof Boolean;
            case "list", "array", "tuple" -> value instanceof List;
            case "dict", "dictionary", "map", "object" -> value instanceof Map;
            case "set" -> value instanceof Set;
            default -> false;
        };
    }

    private static boolean inRange(Object value, Object expected) {
        Optional<double[]> bounds = pair(expected);
        OptionalDouble v = Values.toDouble(value);
        if (bounds.isEmpty() || v.isEmpty()) {
            return false;
        }
        double[] minMax = bounds.get();
        return minMax[0] <= v.getAsDouble() && v.getAsDouble() <= minMax[1];
    }

    private static boolean hasLength(Object value, Object expected) {
        OptionalInt measured = Values.lengthOf(value);
        if (measured.isEmpty()) {
            return false;
        }
        int length = measured.getAsInt();
        if (Values.isIntegral(expected)) {
            return length == ((Number) expected).longValue();
        }
        if (expected instanceof Map<?, ?> bounds) {
            OptionalDouble min = Values.toDouble(bounds.get("min"));
            OptionalDouble max = Values.toDouble(bounds.get("max"));
            if (bounds.get("min") != null && min.isEmpty()
                    || bounds.get("max") != null && max.isEmpty()) {
                return false;
            }
            return (min.isEmpty() || length >= min.getAsDouble())
                    && (max.isEmpty() || length <= max.getAsDouble());
        }
        return pair(expected)
                .map(minMax -> minMax[0] <= length && length <= minMax[1])
                .orElse(false);
    }

    private static boolean isNotEmpty(Object value) {
        if (value instanceof String s) {
            return !s.trim().isEmpty();
        }
        OptionalInt length = Values.lengthOf(value);
        return length.isEmpty() || length.getAsInt() > 0;
    }

    private static boolean runCustom(Lock lock, Object value, ValidatorRegistry validators) {
        Optional<ValidatorDefinition> definition = validators.get(lock.getValidatorName());
        if (definition.isEmpty()) {
            logger.warning(
                    "Validator not registered: "
                            + lock.getValidatorName()
                            + " (property '"
                            + lock.getPropertyPath()
                            + "')");
            return false;
        }
        try {
            return definition.get().validator().test(value, lock.getExpectedValue());
        } catch (RuntimeException e) {
            logger.warning(
                    "Validator '"
                            + lock.getValidatorName()
                            + "' failed for property '"
                            + lock.getPropertyPath()
                            + "': "
                            + e);
            return false;
        }
    }

    /// Reads a two-element `[min, max]` collection of numbers.
    static Optional<double[]> pair(Object expected) {
        if (!(expected instanceof Collection<?> c) || c.size() != 2) {
            return Optional.empty();
        }
        Iterator<?> it = c.iterator();
        OptionalDouble min = Values.toDouble(it.next());
        OptionalDouble max = Values.toDouble(it.next());
        if (min.isEmpty() || max.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new double[] {min.getAsDouble(), max.getAsDouble()});
    }
}
