package io.stageflow.core.gate;

import io.stageflow.core.StageFlowConfig;
import io.stageflow.core.element.Element;
import io.stageflow.core.validator.ValidatorRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Named, ordered AND-composition of locks and nested gates.
///
/// Components are evaluated in declaration order and evaluation stops at the
/// first failing component. A gate passes iff every component passes.
///
/// ### Legacy operators
/// Definitions written for older engines may tag a gate with `or`, `xor` or
/// `not`. The tag is accepted and stored under the `legacy_operator`
/// metadata key, but evaluation always uses AND semantics.
///
/// ### Validation Rules
/// - Name must be non-blank
/// - At least one component
/// - No nested gate may reuse the name of a gate that encloses it
///
/// ### Usage
/// {@snippet :
/// Gate contact = Gate.allOf("contact", Lock.exists("email"), Lock.exists("phone"));
/// GateResult result = contact.evaluate(element, validators);
/// }
///
/// @implNote Immutable and thread-safe after construction. Since components
/// must exist before the gate that holds them, a gate cannot contain itself.
///
/// @see Lock for leaf predicates
/// @see GateResult for the evaluation outcome
public final class Gate implements GateComponent {

    private static final Logger logger = Logger.getLogger(Gate.class.getName());

    /// Metadata key recording a non-AND operator tag.
    public static final String LEGACY_OPERATOR_KEY = "legacy_operator";

    private final String name;
    private final String description;
    private final List<GateComponent> components;
    private final String targetStage;
    private final Map<String, Object> metadata;
    private final Set<String> propertyPaths;
    private final int complexity;
    private final int depth;

    private Gate(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Gate name required");
        this.description = builder.description;
        this.components = List.copyOf(builder.components);
        this.targetStage = builder.targetStage;

        Map<String, Object> meta = new LinkedHashMap<>(builder.metadata);
        if (builder.operator != null && !"and".equals(builder.operator)) {
            meta.put(LEGACY_OPERATOR_KEY, builder.operator);
            logger.warning(
                    "Gate '"
                            + name
                            + "' declares operator '"
                            + builder.operator
                            + "'; evaluating with AND semantics");
        }
        this.metadata = Collections.unmodifiableMap(meta);

        validate();

        Set<String> paths = new LinkedHashSet<>();
        components.forEach(c -> paths.addAll(c.getPropertyPaths()));
        this.propertyPaths = Collections.unmodifiableSet(paths);
        this.complexity = components.stream().mapToInt(GateComponent::getComplexity).sum();
        this.depth = 1 + components.stream().mapToInt(GateComponent::getDepth).max().orElse(0);
    }

    private void validate() {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Gate name cannot be empty");
        }
        if (components.isEmpty()) {
            throw new IllegalArgumentException("Gate '" + name + "' must have at least one component");
        }
        Deque<String> enclosing = new ArrayDeque<>();
        enclosing.push(name);
        checkNesting(components, enclosing);
    }

    private static void checkNesting(List<GateComponent> children, Deque<String> enclosing) {
        for (GateComponent child : children) {
            if (child instanceof Gate nested) {
                if (enclosing.contains(nested.name)) {
                    throw new IllegalArgumentException(
                            "Gate '" + nested.name + "' cannot contain itself");
                }
                enclosing.push(nested.name);
                checkNesting(nested.components, enclosing);
                enclosing.pop();
            }
        }
    }

    /// Evaluates components in order, stopping at the first failure.
    ///
    /// @param element the record to check, not null
    /// @param validators registry consulted by custom locks, not null
    /// @return the gate outcome, never null
    @Override
    public GateResult evaluate(Element element, ValidatorRegistry validators) {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(validators, "validators must not be null");

        List<GateComponent> passed = new ArrayList<>();
        List<GateComponent> failed = new ArrayList<>();
        List<ComponentResult> results = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        List<String> actions = new ArrayList<>();

        for (GateComponent component : components) {
            ComponentResult result = component.evaluate(element, validators);
            results.add(result);
            messages.addAll(result.messages());
            actions.addAll(result.actions());
            if (result.passed()) {
                passed.add(component);
            } else {
                failed.add(component);
                break;
            }
        }

        return new GateResult(
                name,
                failed.isEmpty(),
                passed,
                failed,
                results,
                messages,
                actions,
                results.size() < components.size(),
                results.size(),
                components.size());
    }

    /// Reports structural advisories against the default thresholds.
    ///
    /// @return warnings, empty if the gate is within limits, never null
    public List<String> validateStructure() {
        return validateStructure(
                StageFlowConfig.DEFAULT_MAX_GATE_DEPTH, StageFlowConfig.DEFAULT_MAX_GATE_COMPLEXITY);
    }

    /// Reports structural advisories. Never fails; deep or large gates remain evaluable.
    ///
    /// @param maxDepth nesting depth above which a warning is reported
    /// @param maxComplexity leaf lock count above which a warning is reported
    /// @return warnings, empty if the gate is within limits, never null
    public List<String> validateStructure(int maxDepth, int maxComplexity) {
        List<String> warnings = new ArrayList<>();
        if (depth > maxDepth) {
            warnings.add(
                    "Gate '"
                            + name
                            + "' nesting depth "
                            + depth
                            + " exceeds recommended maximum "
                            + maxDepth);
        }
        if (complexity > maxComplexity) {
            warnings.add(
                    "Gate '"
                            + name
                            + "' has "
                            + complexity
                            + " locks, above recommended maximum "
                            + maxComplexity);
        }
        Set<Lock> seen = new LinkedHashSet<>();
        for (GateComponent component : components) {
            if (component instanceof Lock lock && !seen.add(lock)) {
                warnings.add("Gate '" + name + "' repeats lock " + lock.getSummary());
            }
        }
        return warnings;
    }

    @Override
    public Set<String> getPropertyPaths() {
        return propertyPaths;
    }

    @Override
    public int getComplexity() {
        return complexity;
    }

    @Override
    public int getDepth() {
        return depth;
    }

    /// Returns the deepest nesting level under this gate.
    ///
    /// @return 1 for a gate holding only locks
    public int maxDepth() {
        return depth;
    }

    public String getName() {
        return name;
    }

    /// @return description text (default ""), never null
    public String getDescription() {
        return description;
    }

    /// @return unmodifiable component list in evaluation order, never empty
    public List<GateComponent> getComponents() {
        return components;
    }

    /// Returns the stage this gate leads to, when declared.
    ///
    /// @return target stage name, may be null
    public String getTargetStage() {
        return targetStage;
    }

    /// @return unmodifiable metadata, never null
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// Returns a one-line description of this gate.
    ///
    /// @return summary naming component counts and required paths, never null
    public String getSummary() {
        long locks = components.stream().filter(c -> c instanceof Lock).count();
        long gates = components.size() - locks;
        StringBuilder summary = new StringBuilder("Gate '").append(name).append("': ");
        summary.append(locks).append(locks == 1 ? " lock" : " locks");
        if (gates > 0) {
            summary.append(", ").append(gates).append(gates == 1 ? " nested gate" : " nested gates");
        }
        summary.append(" (AND), requires: ").append(String.join(", ", propertyPaths));
        return summary.toString();
    }

    @Override
    public String toString() {
        return "Gate{name='" + name + "', components=" + components.size() + "}";
    }

    /// Creates a gate from components, in order.
    ///
    /// @param name gate name, not null or blank
    /// @param components at least one component
    /// @return new gate, never null
    public static Gate allOf(String name, GateComponent... components) {
        return builder().name(name).components(List.of(components)).build();
    }

    /// Creates a new gate builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Gate instances.
    ///
    /// Required fields: `name`, at least one component
    public static final class Builder {
        private String name;
        private String description = "";
        private final List<GateComponent> components = new ArrayList<>();
        private String targetStage;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String operator;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder component(GateComponent component) {
            this.components.add(Objects.requireNonNull(component, "component must not be null"));
            return this;
        }

        public Builder components(List<? extends GateComponent> components) {
            components.forEach(this::component);
            return this;
        }

        public Builder targetStage(String targetStage) {
            this.targetStage = targetStage;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        /// Records a logical operator tag. Only `and` has meaning; other tags
        /// are kept as metadata.
        ///
        /// @param operator operator name such as `and` or `or`, may be null
        /// @return this builder for chaining
        public Builder operator(String operator) {
            this.operator = operator != null ? operator.trim().toLowerCase(Locale.ROOT) : null;
            return this;
        }

        /// Builds the immutable gate.
        ///
        /// @return new Gate instance, never null
        /// @throws NullPointerException if name is null
        /// @throws IllegalArgumentException if name is blank, no components
        ///     were added, or a nested gate reuses an enclosing gate's name
        public Gate build() {
            return new Gate(this);
        }
    }
}
