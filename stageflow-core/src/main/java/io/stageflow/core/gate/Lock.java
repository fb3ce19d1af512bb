package io.stageflow.core.gate;

import io.stageflow.core.element.Element;
import io.stageflow.core.element.PropertyLookup;
import io.stageflow.core.element.PropertyPath;
import io.stageflow.core.validator.ValidatorRegistry;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Atomic predicate over one property path of an element.
///
/// A lock resolves its path on the element and applies the rule selected by
/// its {@link LockType}. Validation is total: an unresolvable path, a value
/// of the wrong type, a malformed expected value, an unregistered or
/// throwing custom validator all produce a failed {@link LockResult}, never
/// an exception.
///
/// ### Resolution misses
/// A path that does not resolve passes only an `exists` lock whose expected
/// value is `false`; every other lock fails.
///
/// ### Validation Rules
/// - The property path must parse
/// - Comparison-style types ({@link LockType#requiresExpectedValue()}) need a
///   non-null expected value
/// - `custom` locks need a validator name
///
/// ### Usage
/// {@snippet :
/// Lock adult = Lock.range("age", 18, 65);
/// LockResult result = adult.validate(DictElement.of(Map.of("age", 70)), validators);
/// result.errorMessage(); // "Property 'age' should be between 18 and 65 but is 70"
/// }
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see LockType for per-type semantics
/// @see Gate for composing locks
public final class Lock implements GateComponent {

    private static final Logger logger = Logger.getLogger(Lock.class.getName());

    private final String propertyPath;
    private final PropertyPath path;
    private final LockType type;
    private final Object expectedValue;
    private final String validatorName;
    private final Map<String, Object> metadata;
    private final Optional<Pattern> compiledPattern;

    private Lock(Builder builder) {
        this.propertyPath = Objects.requireNonNull(builder.propertyPath, "Property path required");
        this.type = Objects.requireNonNull(builder.type, "Lock type required");
        this.expectedValue = builder.expectedValue;
        this.validatorName = builder.validatorName;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));

        validate();

        this.path = PropertyPath.parse(propertyPath);
        this.compiledPattern = type == LockType.REGEX ? compile(expectedValue) : Optional.empty();
    }

    private void validate() {
        if (type.requiresExpectedValue() && expectedValue == null) {
            throw new IllegalArgumentException(
                    "Lock type " + type.value() + " requires expected_value");
        }
        if (type == LockType.CUSTOM && (validatorName == null || validatorName.isBlank())) {
            throw new IllegalArgumentException("Custom lock type requires validator_name");
        }
    }

    private Optional<Pattern> compile(Object pattern) {
        try {
            return Optional.of(Pattern.compile(String.valueOf(pattern)));
        } catch (PatternSyntaxException e) {
            logger.warning(
                    "Lock on '" + propertyPath + "' has malformed pattern; it will always fail: "
                            + e.getDescription());
            return Optional.empty();
        }
    }

    /// Validates this lock against an element.
    ///
    /// @param element the record to check, not null
    /// @param validators registry consulted by `custom` locks, not null
    /// @return the outcome with failure and remediation messages on failure, never null
    public LockResult validate(Element element, ValidatorRegistry validators) {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(validators, "validators must not be null");

        PropertyLookup lookup = element.lookup(path);
        Object value = lookup.value();
        boolean success = LockPredicates.test(this, lookup.found(), value, validators);
        if (success) {
            return new LockResult(
                    true, propertyPath, type, lookup.found(), value, expectedValue, null, null);
        }
        return new LockResult(
                false,
                propertyPath,
                type,
                lookup.found(),
                value,
                expectedValue,
                LockMessages.failure(this, lookup.found(), value),
                LockMessages.action(this));
    }

    /// Asynchronous form of {@link #validate(Element, ValidatorRegistry)}.
    ///
    /// Runs synchronously on the caller's thread and returns an already
    /// completed future, for hosts that schedule work through futures.
    ///
    /// @param element the record to check, not null
    /// @param validators registry consulted by `custom` locks, not null
    /// @return completed future holding the same result as `validate`, never null
    public CompletableFuture<LockResult> validateAsync(
            Element element, ValidatorRegistry validators) {
        return CompletableFuture.completedFuture(validate(element, validators));
    }

    @Override
    public LockResult evaluate(Element element, ValidatorRegistry validators) {
        return validate(element, validators);
    }

    @Override
    public Set<String> getPropertyPaths() {
        return Set.of(propertyPath);
    }

    @Override
    public int getComplexity() {
        return 1;
    }

    @Override
    public int getDepth() {
        return 0;
    }

    /// Returns the property path expression.
    ///
    /// @return path expression, never null
    public String getPropertyPath() {
        return propertyPath;
    }

    /// Returns the lock kind.
    ///
    /// @return lock type, never null
    public LockType getType() {
        return type;
    }

    /// Returns the expected value the rule compares against.
    ///
    /// @return expected value, may be null for `exists`, `not_empty` and `custom`
    public Object getExpectedValue() {
        return expectedValue;
    }

    /// Returns the custom validator name.
    ///
    /// @return validator name, null unless this is a `custom` lock
    public String getValidatorName() {
        return validatorName;
    }

    /// Returns free-form annotations.
    ///
    /// @return unmodifiable metadata, never null
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// Returns a one-line description of this lock.
    ///
    /// @return summary such as `range(age, [18, 65])`, never null
    public String getSummary() {
        if (type == LockType.CUSTOM) {
            return "custom(" + propertyPath + ", " + validatorName + ")";
        }
        return expectedValue == null
                ? type.value() + "(" + propertyPath + ")"
                : type.value() + "(" + propertyPath + ", " + expectedValue + ")";
    }

    boolean isNegatedExists() {
        return type == LockType.EXISTS && Boolean.FALSE.equals(expectedValue);
    }

    Optional<Pattern> getCompiledPattern() {
        return compiledPattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lock lock)) return false;
        return propertyPath.equals(lock.propertyPath)
                && type == lock.type
                && Objects.equals(expectedValue, lock.expectedValue)
                && Objects.equals(validatorName, lock.validatorName)
                && metadata.equals(lock.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyPath, type, expectedValue, validatorName, metadata);
    }

    @Override
    public String toString() {
        return "Lock{" + getSummary() + "}";
    }

    /// Requires the property to be present and non-empty.
    public static Lock exists(String propertyPath) {
        return builder().propertyPath(propertyPath).type(LockType.EXISTS).expectedValue(true).build();
    }

    /// Requires the property to be absent, null, empty string or empty list.
    public static Lock notExists(String propertyPath) {
        return builder().propertyPath(propertyPath).type(LockType.EXISTS).expectedValue(false).build();
    }

    public static Lock equalTo(String propertyPath, Object expected) {
        return of(LockType.EQUALS, propertyPath, expected);
    }

    public static Lock greaterThan(String propertyPath, Number bound) {
        return of(LockType.GREATER_THAN, propertyPath, bound);
    }

    public static Lock lessThan(String propertyPath, Number bound) {
        return of(LockType.LESS_THAN, propertyPath, bound);
    }

    public static Lock contains(String propertyPath, Object member) {
        return of(LockType.CONTAINS, propertyPath, member);
    }

    /// Requires a string value matching `pattern` from its first character.
    public static Lock regex(String propertyPath, String pattern) {
        return of(LockType.REGEX, propertyPath, pattern);
    }

    /// Requires the value to be of a type, given as a `Class` or a type name
    /// such as `string`, `integer`, `number`, `boolean`, `list` or `map`.
    public static Lock typeCheck(String propertyPath, Object type) {
        return of(LockType.TYPE_CHECK, propertyPath, type);
    }

    /// Requires a numeric value within `[min, max]`, both inclusive.
    public static Lock range(String propertyPath, Number min, Number max) {
        return of(LockType.RANGE, propertyPath, List.of(min, max));
    }

    /// Requires a length: an exact count, a `[min, max]` list or a `{min, max}` map.
    public static Lock length(String propertyPath, Object constraint) {
        return of(LockType.LENGTH, propertyPath, constraint);
    }

    public static Lock notEmpty(String propertyPath) {
        return builder().propertyPath(propertyPath).type(LockType.NOT_EMPTY).build();
    }

    public static Lock inList(String propertyPath, Collection<?> allowed) {
        return of(LockType.IN_LIST, propertyPath, List.copyOf(allowed));
    }

    public static Lock notInList(String propertyPath, Collection<?> blocked) {
        return of(LockType.NOT_IN_LIST, propertyPath, List.copyOf(blocked));
    }

    /// Delegates to the validator registered under `validatorName`.
    public static Lock custom(String propertyPath, String validatorName) {
        return custom(propertyPath, validatorName, null);
    }

    public static Lock custom(String propertyPath, String validatorName, Object expected) {
        return builder()
                .propertyPath(propertyPath)
                .type(LockType.CUSTOM)
                .validatorName(validatorName)
                .expectedValue(expected)
                .build();
    }

    /// Creates a lock of any type.
    ///
    /// @param type lock kind, not null
    /// @param propertyPath path expression, not null
    /// @param expected expected value, may be null where the type allows
    /// @return new lock, never null
    /// @throws IllegalArgumentException if the combination is invalid
    public static Lock of(LockType type, String propertyPath, Object expected) {
        return builder().propertyPath(propertyPath).type(type).expectedValue(expected).build();
    }

    /// Creates a new lock builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Lock instances.
    ///
    /// Required fields: `propertyPath`, `type`
    public static final class Builder {
        private String propertyPath;
        private LockType type;
        private Object expectedValue;
        private String validatorName;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder propertyPath(String propertyPath) {
            this.propertyPath = propertyPath;
            return this;
        }

        public Builder type(LockType type) {
            this.type = type;
            return this;
        }

        public Builder expectedValue(Object expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder validatorName(String validatorName) {
            this.validatorName = validatorName;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        /// Builds the immutable lock.
        ///
        /// @return new Lock instance, never null
        /// @throws NullPointerException if propertyPath or type is null
        /// @throws IllegalArgumentException if the path is malformed or a
        ///     required expected value or validator name is missing
        public Lock build() {
            return new Lock(this);
        }
    }
}
