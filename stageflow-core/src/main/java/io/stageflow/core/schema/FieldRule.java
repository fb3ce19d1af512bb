package io.stageflow.core.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Per-field validation rule of a {@link Schema}.
///
/// Each constraint is optional. Numeric bounds apply to any value coercible
/// to a number; length bounds and the pattern apply to strings only; the
/// enumeration applies to any value.
///
/// @param min inclusive lower numeric bound, may be null
/// @param max inclusive upper numeric bound, may be null
/// @param minLength minimum string length, may be null
/// @param maxLength maximum string length, may be null
/// @param pattern regular expression matched from the start of the string, may be null
/// @param allowedValues enumeration of accepted values, may be null
public record FieldRule(
        Number min,
        Number max,
        Integer minLength,
        Integer maxLength,
        String pattern,
        List<Object> allowedValues) {

    public FieldRule {
        allowedValues =
                allowedValues == null ? null : Collections.unmodifiableList(new ArrayList<>(allowedValues));
        if (minLength != null && minLength < 0) {
            throw new IllegalArgumentException("min_length cannot be negative");
        }
        if (maxLength != null && maxLength < 0) {
            throw new IllegalArgumentException("max_length cannot be negative");
        }
    }

    /// Compiles {@link #pattern()}.
    ///
    /// @return the compiled pattern; empty if no pattern is set or it is malformed
    Optional<Pattern> compiledPattern() {
        if (pattern == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            return Optional.empty();
        }
    }

    /// Creates a new rule builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for FieldRule; every constraint is optional.
    public static final class Builder {
        private Number min;
        private Number max;
        private Integer minLength;
        private Integer maxLength;
        private String pattern;
        private List<Object> allowedValues;

        private Builder() {}

        public Builder min(Number min) {
            this.min = min;
            return this;
        }

        public Builder max(Number max) {
            this.max = max;
            return this;
        }

        public Builder minLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder allowedValues(Collection<?> allowedValues) {
            this.allowedValues = allowedValues == null ? null : new ArrayList<>(allowedValues);
            return this;
        }

        public FieldRule build() {
            return new FieldRule(min, max, minLength, maxLength, pattern, allowedValues);
        }
    }
}
