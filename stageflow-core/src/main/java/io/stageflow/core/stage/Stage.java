package io.stageflow.core.stage;

import io.stageflow.core.action.Action;
import io.stageflow.core.element.Element;
import io.stageflow.core.gate.Gate;
import io.stageflow.core.gate.GateResult;
import io.stageflow.core.schema.Schema;
import io.stageflow.core.state.EvaluationState;
import io.stageflow.core.template.SimpleTemplateResolver;
import io.stageflow.core.template.TemplateResolver;
import io.stageflow.core.validator.ValidatorRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// A workflow checkpoint: an optional schema plus an ordered set of gates.
///
/// ### Pass rule
/// A stage passes when its schema (if any) is valid and
/// - it has no gates, or
/// - `allowPartial` is set and at least one gate passes, or
/// - every gate passes.
///
/// Every gate is evaluated regardless of the schema outcome or of other
/// gates; only components inside a single gate short-circuit.
///
/// ### Completion
/// With gates, completion is the mean of the fraction of gates passed and
/// the schema score (1.0 valid, 0.0 invalid). Without gates it is the schema
/// score alone, and a stage with neither gates nor schema is always complete.
///
/// ### Validation Rules
/// - Name must be non-blank
/// - Gate names must be unique within the stage
///
/// @implNote Immutable and thread-safe after construction. Built once from a
/// process definition and reused for every evaluation.
///
/// @see Gate
/// @see Schema
/// @see ActionTemplate
public final class Stage {

    private static final TemplateResolver DEFAULT_RESOLVER = new SimpleTemplateResolver();

    private final String name;
    private final String description;
    private final List<Gate> gates;
    private final Schema schema;
    private final boolean allowPartial;
    private final Map<EvaluationState, List<ActionTemplate>> actionTemplates;
    private final Map<String, Object> metadata;
    private final TemplateResolver templateResolver;

    private Stage(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Stage name required");
        this.description = builder.description;
        this.gates = List.copyOf(builder.gates);
        this.schema = builder.schema;
        this.allowPartial = builder.allowPartial;
        Map<EvaluationState, List<ActionTemplate>> templates = new EnumMap<>(EvaluationState.class);
        builder.actionTemplates.forEach((state, list) -> templates.put(state, List.copyOf(list)));
        this.actionTemplates = Collections.unmodifiableMap(templates);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.templateResolver = builder.templateResolver;

        validate();
    }

    private void validate() {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Stage must have a name");
        }
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Gate gate : gates) {
            if (!seen.add(gate.getName())) {
                duplicates.add(gate.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException(
                    "Duplicate gate names in stage '" + name + "': " + duplicates);
        }
    }

    /// Evaluates an element against this stage.
    ///
    /// @param element the record to check, not null
    /// @param validators registry consulted by custom locks, not null
    /// @return the stage outcome, never null
    public StageResult evaluate(Element element, ValidatorRegistry validators) {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(validators, "validators must not be null");

        List<String> schemaErrors = schema != null ? schema.validate(element) : List.of();
        boolean schemaValid = schemaErrors.isEmpty();

        List<GateResult> gateResults = new ArrayList<>(gates.size());
        List<String> messages = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        int passed = 0;
        for (Gate gate : gates) {
            GateResult result = gate.evaluate(element, validators);
            gateResults.add(result);
            messages.addAll(result.messages());
            actions.addAll(result.actions());
            if (result.passed()) {
                passed++;
            }
        }

        boolean gatesSatisfied;
        if (gates.isEmpty()) {
            gatesSatisfied = true;
        } else if (allowPartial) {
            gatesSatisfied = passed > 0;
        } else {
            gatesSatisfied = passed == gates.size();
        }

        double schemaScore = schemaValid ? 1.0 : 0.0;
        double completion =
                gates.isEmpty() ? schemaScore : ((double) passed / gates.size() + schemaScore) / 2.0;

        return new StageResult(
                name,
                schemaValid,
                schemaErrors,
                gateResults,
                schemaValid && gatesSatisfied,
                messages,
                actions,
                completion);
    }

    /// Checks whether the element carries every field the schema requires.
    ///
    /// Used to scope an element to candidate stages before full evaluation.
    ///
    /// @param element the record to check, not null
    /// @return true if there is no schema or all required fields are present
    public boolean isCompatibleWithElement(Element element) {
        if (schema == null) {
            return true;
        }
        for (String field : schema.getRequiredFields()) {
            if (!element.hasProperty(field)) {
                return false;
            }
        }
        return true;
    }

    /// Returns the completion fraction for an element.
    ///
    /// @param element the record to check, not null
    /// @param validators registry consulted by custom locks, not null
    /// @return value in `[0.0, 1.0]`
    public double getCompletionFraction(Element element, ValidatorRegistry validators) {
        return evaluate(element, validators).completionFraction();
    }

    /// Resolves the action templates declared for a state.
    ///
    /// @param state the evaluation state, not null
    /// @param element the record supplying property values, not null
    /// @param context extra template variables, not null
    /// @return resolved actions in declaration order; empty if none are declared
    public List<Action> resolveActions(
            EvaluationState state, Element element, Map<String, Object> context) {
        List<ActionTemplate> templates = actionTemplates.getOrDefault(state, List.of());
        List<Action> actions = new ArrayList<>(templates.size());
        for (ActionTemplate template : templates) {
            actions.add(template.resolve(element, context, templateResolver));
        }
        return actions;
    }

    /// Returns every property path the stage reads: schema required fields
    /// followed by gate lock paths.
    ///
    /// @return unmodifiable insertion-ordered set, never null
    public Set<String> getRequiredProperties() {
        Set<String> properties = new LinkedHashSet<>();
        if (schema != null) {
            properties.addAll(schema.getRequiredFields());
        }
        gates.forEach(g -> properties.addAll(g.getPropertyPaths()));
        return Collections.unmodifiableSet(properties);
    }

    /// Collects structural advisories from every gate.
    ///
    /// @param maxDepth nesting depth threshold
    /// @param maxComplexity lock count threshold
    /// @return warnings in gate order, never null
    public List<String> validateStructure(int maxDepth, int maxComplexity) {
        List<String> warnings = new ArrayList<>();
        gates.forEach(g -> warnings.addAll(g.validateStructure(maxDepth, maxComplexity)));
        return warnings;
    }

    public Optional<Gate> getGate(String gateName) {
        return gates.stream().filter(g -> g.getName().equals(gateName)).findFirst();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /// @return unmodifiable gates in evaluation order, never null
    public List<Gate> getGates() {
        return gates;
    }

    /// @return the schema, or empty if the stage declares none
    public Optional<Schema> getSchema() {
        return Optional.ofNullable(schema);
    }

    public boolean isAllowPartial() {
        return allowPartial;
    }

    /// @return templates per state; states without templates are absent, never null
    public Map<EvaluationState, List<ActionTemplate>> getActionTemplates() {
        return actionTemplates;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// Returns a one-line description of this stage.
    ///
    /// @return summary naming gates and schema, never null
    public String getSummary() {
        StringBuilder summary = new StringBuilder("Stage '").append(name).append("': ");
        summary.append(gates.size()).append(gates.size() == 1 ? " gate" : " gates");
        if (allowPartial) {
            summary.append(" (partial)");
        }
        if (schema != null) {
            summary.append(", schema '").append(schema.getName()).append("'");
        }
        return summary.toString();
    }

    @Override
    public String toString() {
        return "Stage{name='" + name + "', gates=" + gates.size() + "}";
    }

    /// Creates a new stage builder.
    ///
    /// @param name stage name, not null or blank
    /// @return new builder instance, never null
    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /// Builder for constructing immutable Stage instances.
    ///
    /// Required fields: `name`
    public static final class Builder {
        private String name;
        private String description = "";
        private final List<Gate> gates = new ArrayList<>();
        private Schema schema;
        private boolean allowPartial;
        private final Map<EvaluationState, List<ActionTemplate>> actionTemplates =
                new EnumMap<>(EvaluationState.class);
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private TemplateResolver templateResolver = DEFAULT_RESOLVER;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder gate(Gate gate) {
            this.gates.add(Objects.requireNonNull(gate, "gate must not be null"));
            return this;
        }

        public Builder gates(List<Gate> gates) {
            gates.forEach(this::gate);
            return this;
        }

        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        /// Lets the stage pass when at least one gate passes.
        public Builder allowPartial(boolean allowPartial) {
            this.allowPartial = allowPartial;
            return this;
        }

        public Builder actionTemplate(EvaluationState state, ActionTemplate template) {
            Objects.requireNonNull(state, "state must not be null");
            Objects.requireNonNull(template, "template must not be null");
            actionTemplates.computeIfAbsent(state, s -> new ArrayList<>()).add(template);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver =
                    Objects.requireNonNull(templateResolver, "templateResolver must not be null");
            return this;
        }

        /// Builds the immutable stage.
        ///
        /// @return new Stage instance, never null
        /// @throws NullPointerException if name is null
        /// @throws IllegalArgumentException if name is blank or gate names repeat
        public Stage build() {
            return new Stage(this);
        }
    }
}
