package io.stageflow.core.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/// Value coercion and comparison helpers shared by locks and schemas.
///
/// Record values arrive as loosely typed trees (maps, lists, boxed numbers,
/// strings), so numeric comparisons coerce both sides to `double` and equality
/// treats numbers of different boxed types as equal when their values match.
///
/// @implNote Stateless utility class. All methods are pure functions.
public final class Values {

    private Values() {}

    /// Coerces a value to `double`.
    ///
    /// Numbers convert directly, booleans map to 1/0 and strings are parsed
    /// after trimming.
    ///
    /// @param value the value to coerce, may be null
    /// @return the numeric value, or empty if coercion is impossible
    public static OptionalDouble toDouble(Object value) {
        if (value instanceof Number n) {
            return OptionalDouble.of(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return OptionalDouble.of(b ? 1.0 : 0.0);
        }
        if (value instanceof String s) {
            try {
                return OptionalDouble.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /// Compares two values for equality, treating numbers by value.
    ///
    /// `1`, `1L` and `1.0` are equal; `"1"` and `1` are not; `0.0` equals
    /// `-0.0`. `NaN` equals nothing, itself included. Lists compare element by
    /// element and maps compare values under equal keys with the same rules,
    /// so `[1]` equals `[1.0]`.
    ///
    /// @param a first value, may be null
    /// @param b second value, may be null
    /// @return true if the values are equal
    public static boolean valueEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isNaN(x) || isNaN(y)) {
                return false;
            }
            return compareNumbers(x, y) == 0;
        }
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            return listEquals(x, y);
        }
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            return mapEquals(x, y);
        }
        return a.equals(b);
    }

    /// Checks collection membership with {@link #valueEquals(Object, Object)}.
    ///
    /// @param candidates the collection to search, may be null
    /// @param value the value to find, may be null
    /// @return true if any candidate equals the value
    public static boolean containsValue(Collection<?> candidates, Object value) {
        if (candidates == null) {
            return false;
        }
        for (Object candidate : candidates) {
            if (valueEquals(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    /// Returns the size of a measurable value.
    ///
    /// Strings measure characters, collections and maps measure entries.
    ///
    /// @param value the value to measure, may be null
    /// @return the length, or empty for values without a length
    public static OptionalInt lengthOf(Object value) {
        if (value instanceof CharSequence s) {
            return OptionalInt.of(s.length());
        }
        if (value instanceof Collection<?> c) {
            return OptionalInt.of(c.size());
        }
        if (value instanceof Map<?, ?> m) {
            return OptionalInt.of(m.size());
        }
        if (value instanceof Object[] array) {
            return OptionalInt.of(array.length);
        }
        return OptionalInt.empty();
    }

    /// Checks whether a value is a boxed integer type.
    ///
    /// `2.0` is not integral even though it has no fractional part.
    ///
    /// @param value the value to check, may be null
    /// @return true for Byte, Short, Integer, Long and BigInteger
    public static boolean isIntegral(Object value) {
        return value instanceof Byte
                || value instanceof Short
                || value instanceof Integer
                || value instanceof Long
                || value instanceof BigInteger;
    }

    /// @return true for a `Double` or `Float` holding NaN
    public static boolean isNaN(Object value) {
        return (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
    }

    private static int compareNumbers(Number x, Number y) {
        if (isIntegral(x) && isIntegral(y)) {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
        }
        double dx = x.doubleValue();
        double dy = y.doubleValue();
        if (dx == dy) {
            return 0;
        }
        return dx < dy ? -1 : 1;
    }

    private static boolean listEquals(List<?> x, List<?> y) {
        if (x.size() != y.size()) {
            return false;
        }
        for (int i = 0; i < x.size(); i++) {
            if (!valueEquals(x.get(i), y.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean mapEquals(Map<?, ?> x, Map<?, ?> y) {
        if (x.size() != y.size()) {
            return false;
        }
        for (Map.Entry<?, ?> entry : x.entrySet()) {
            if (!y.containsKey(entry.getKey())
                    || !valueEquals(entry.getValue(), y.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
