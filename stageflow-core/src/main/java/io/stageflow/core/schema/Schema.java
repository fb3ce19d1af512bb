package io.stageflow.core.schema;

import io.stageflow.core.element.DictElement;
import io.stageflow.core.element.Element;
import io.stageflow.core.element.PropertyLookup;
import io.stageflow.core.element.PropertyPath;
import io.stageflow.core.util.Values;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/// Structural contract an element must satisfy to occupy a stage.
///
/// Validation accumulates every violation rather than stopping at the first:
/// required-field presence, declared-type match for present fields, then
/// per-field rules for present fields. An absent optional field is never an
/// error.
///
/// ### Validation Rules
/// - Name must be non-blank
/// - Required and optional fields are disjoint
/// - Default values are declared only for optional fields
/// - Every field path parses
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see FieldType for type names
/// @see FieldRule for per-field constraints
public final class Schema {

    private final String name;
    private final Set<String> requiredFields;
    private final Set<String> optionalFields;
    private final Map<String, FieldType> fieldTypes;
    private final Map<String, Object> defaultValues;
    private final Map<String, FieldRule> rules;
    private final Map<String, Object> metadata;
    private final Map<String, Optional<Pattern>> patterns;

    private Schema(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Schema name required");
        this.requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredFields));
        this.optionalFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.optionalFields));
        this.fieldTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fieldTypes));
        this.defaultValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultValues));
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rules));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));

        validate();

        Map<String, Optional<Pattern>> compiled = new LinkedHashMap<>();
        rules.forEach((field, rule) -> compiled.put(field, rule.compiledPattern()));
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    private void validate() {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Schema must have a name");
        }
        Set<String> overlap = new LinkedHashSet<>(requiredFields);
        overlap.retainAll(optionalFields);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException(
                    "Fields cannot be both required and optional: " + overlap);
        }
        Set<String> invalidDefaults = new LinkedHashSet<>(defaultValues.keySet());
        invalidDefaults.removeAll(optionalFields);
        if (!invalidDefaults.isEmpty()) {
            throw new IllegalArgumentException(
                    "Default values provided for non-optional fields: " + invalidDefaults);
        }
        getAllFields().forEach(PropertyPath::parse);
        fieldTypes.keySet().forEach(PropertyPath::parse);
        rules.keySet().forEach(PropertyPath::parse);
    }

    /// Validates an element against this schema.
    ///
    /// @param element the record to check, not null
    /// @return every violation in check order, empty if valid, never null
    public List<String> validate(Element element) {
        Objects.requireNonNull(element, "element must not be null");
        List<String> errors = new ArrayList<>();

        for (String field : requiredFields) {
            if (!element.hasProperty(field)) {
                errors.add("Required field missing: " + field);
            }
        }

        fieldTypes.forEach(
                (field, type) -> {
                    PropertyLookup lookup = element.lookup(field);
                    if (lookup.found() && !type.matches(lookup.value())) {
                        errors.add(
                                "Field '" + field + "' has invalid type: expected " + type.value());
                    }
                });

        rules.forEach(
                (field, rule) -> {
                    PropertyLookup lookup = element.lookup(field);
                    if (lookup.found()) {
                        errors.addAll(checkRule(field, lookup.value(), rule));
                    }
                });

        return errors;
    }

    /// Checks whether an element satisfies this schema.
    ///
    /// @param element the record to check, not null
    /// @return true if {@link #validate(Element)} reports no errors
    public boolean isValid(Element element) {
        return validate(element).isEmpty();
    }

    private List<String> checkRule(String field, Object value, FieldRule rule) {
        List<String> errors = new ArrayList<>();
        OptionalDouble numeric = Values.toDouble(value);

        if (rule.min() != null) {
            if (numeric.isEmpty()) {
                errors.add("Field '" + field + "' cannot be compared to minimum value");
            } else if (numeric.getAsDouble() < rule.min().doubleValue()) {
                errors.add("Field '" + field + "' below minimum value " + rule.min());
            }
        }
        if (rule.max() != null) {
            if (numeric.isEmpty()) {
                errors.add("Field '" + field + "' cannot be compared to maximum value");
            } else if (numeric.getAsDouble() > rule.max().doubleValue()) {
                errors.add("Field '" + field + "' above maximum value " + rule.max());
            }
        }
        if (value instanceof String s) {
            if (rule.minLength() != null && s.length() < rule.minLength()) {
                errors.add("Field '" + field + "' below minimum length " + rule.minLength());
            }
            if (rule.maxLength() != null && s.length() > rule.maxLength()) {
                errors.add("Field '" + field + "' above maximum length " + rule.maxLength());
            }
            if (rule.pattern() != null) {
                Optional<Pattern> pattern = patterns.get(field);
                if (pattern.isEmpty()) {
                    errors.add("Invalid pattern for field '" + field + "'");
                } else if (!pattern.get().matcher(s).lookingAt()) {
                    errors.add("Field '" + field + "' does not match required pattern");
                }
            }
        }
        if (rule.allowedValues() != null && !Values.containsValue(rule.allowedValues(), value)) {
            errors.add("Field '" + field + "' must be one of: " + rule.allowedValues());
        }
        return errors;
    }

    /// Returns a copy of the element with defaults filled in for absent optional fields.
    ///
    /// Defaults whose path contains a list index are skipped; intermediate
    /// maps are created for nested key paths.
    ///
    /// @param element the source record, not null
    /// @return a new element, or the same instance when nothing was added
    public Element applyDefaults(Element element) {
        Objects.requireNonNull(element, "element must not be null");
        Map<String, Object> data = mutableCopy(element.toMap());
        boolean changed = false;
        for (Map.Entry<String, Object> entry : defaultValues.entrySet()) {
            if (!element.hasProperty(entry.getKey())) {
                changed |= put(data, PropertyPath.parse(entry.getKey()), entry.getValue());
            }
        }
        return changed ? DictElement.of(data) : element;
    }

    @SuppressWarnings("unchecked")
    private static boolean put(Map<String, Object> root, PropertyPath path, Object value) {
        List<PropertyPath.Segment> segments = path.getSegments();
        if (segments.stream().anyMatch(PropertyPath.Segment::isIndex)) {
            return false;
        }
        Map<String, Object> current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            String key = segments.get(i).key();
            Object next = current.get(key);
            if (next == null && !current.containsKey(key)) {
                next = new LinkedHashMap<String, Object>();
                current.put(key, next);
            }
            if (!(next instanceof Map)) {
                return false;
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments.get(segments.size() - 1).key(), value);
        return true;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mutableCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach(
                (k, v) -> copy.put(k, v instanceof Map ? mutableCopy((Map<String, Object>) v) : v));
        return copy;
    }

    public String getName() {
        return name;
    }

    /// @return unmodifiable required field paths in declaration order, never null
    public Set<String> getRequiredFields() {
        return requiredFields;
    }

    /// @return unmodifiable optional field paths in declaration order, never null
    public Set<String> getOptionalFields() {
        return optionalFields;
    }

    /// Returns required and optional fields together.
    ///
    /// @return unmodifiable union, required fields first, never null
    public Set<String> getAllFields() {
        Set<String> all = new LinkedHashSet<>(requiredFields);
        all.addAll(optionalFields);
        return Collections.unmodifiableSet(all);
    }

    public boolean isFieldRequired(String field) {
        return requiredFields.contains(field);
    }

    public Optional<FieldType> getFieldType(String field) {
        return Optional.ofNullable(fieldTypes.get(field));
    }

    /// Returns the default for an optional field.
    ///
    /// @param field field path, not null
    /// @return default value, or null if none is declared
    public Object getDefaultValue(String field) {
        return defaultValues.get(field);
    }

    public Map<String, FieldType> getFieldTypes() {
        return fieldTypes;
    }

    public Map<String, Object> getDefaultValues() {
        return defaultValues;
    }

    public Map<String, FieldRule> getRules() {
        return rules;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Schema{name='"
                + name
                + "', required="
                + requiredFields
                + ", optional="
                + optionalFields
                + "}";
    }

    /// Creates a new schema builder.
    ///
    /// @param name schema name, not null or blank
    /// @return new builder instance, never null
    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /// Builder for constructing immutable Schema instances.
    ///
    /// Required fields: `name`
    public static final class Builder {
        private String name;
        private final Set<String> requiredFields = new LinkedHashSet<>();
        private final Set<String> optionalFields = new LinkedHashSet<>();
        private final Map<String, FieldType> fieldTypes = new LinkedHashMap<>();
        private final Map<String, Object> defaultValues = new LinkedHashMap<>();
        private final Map<String, FieldRule> rules = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder required(String... fields) {
            Collections.addAll(requiredFields, fields);
            return this;
        }

        public Builder optional(String... fields) {
            Collections.addAll(optionalFields, fields);
            return this;
        }

        /// Declares a field type without changing whether the field is required.
        public Builder type(String field, FieldType type) {
            fieldTypes.put(field, Objects.requireNonNull(type, "type must not be null"));
            return this;
        }

        /// Declares a default; the field must also be declared optional.
        public Builder defaultValue(String field, Object value) {
            defaultValues.put(field, value);
            return this;
        }

        public Builder rule(String field, FieldRule rule) {
            rules.put(field, Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        /// Builds the immutable schema.
        ///
        /// @return new Schema instance, never null
        /// @throws NullPointerException if name is null
        /// @throws IllegalArgumentException if a validation rule is violated
        public Schema build() {
            return new Schema(this);
        }
    }
}
