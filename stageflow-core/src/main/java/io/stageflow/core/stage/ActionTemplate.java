package io.stageflow.core.stage;

import io.stageflow.core.action.Action;
import io.stageflow.core.action.ActionType;
import io.stageflow.core.action.Priority;
import io.stageflow.core.element.Element;
import io.stageflow.core.element.PropertyLookup;
import io.stageflow.core.template.TemplateResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Stage-declared action whose description is a `{var}` template.
///
/// Variables come from three sources, in increasing precedence:
/// 1. a placeholder naming a property path present on the element
/// 2. caller-supplied context (e.g. `next_stage`, `completion`)
/// 3. `templateVars`, mapping a variable name to a property path; an
///    unresolvable path binds the empty string
///
/// Placeholders matched by none of these are left verbatim. Resolution never
/// throws.
///
/// {@snippet :
/// ActionTemplate template = ActionTemplate.builder()
///         .type(ActionType.COMPLETE_FIELD)
///         .description("Send verification mail to {email}")
///         .build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
public final class ActionTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    private final ActionType type;
    private final String description;
    private final Priority priority;
    private final List<String> conditions;
    private final Map<String, String> templateVars;
    private final Map<String, Object> metadata;

    private ActionTemplate(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Action type required");
        this.description = Objects.requireNonNull(builder.description, "Description required");
        this.priority = Objects.requireNonNull(builder.priority, "Priority required");
        this.conditions = List.copyOf(builder.conditions);
        this.templateVars = Collections.unmodifiableMap(new LinkedHashMap<>(builder.templateVars));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));

        if (description.isBlank()) {
            throw new IllegalArgumentException("Action description cannot be empty");
        }
    }

    /// Resolves this template into a concrete action.
    ///
    /// @param element the record supplying property values, not null
    /// @param context caller-supplied variables, may be null
    /// @param resolver placeholder substitution strategy, not null
    /// @return the resolved action, never null
    public Action resolve(Element element, Map<String, Object> context, TemplateResolver resolver) {
        Map<String, Object> variables = new LinkedHashMap<>();
        collectElementPlaceholders(element, description, variables);
        conditions.forEach(c -> collectElementPlaceholders(element, c, variables));
        if (context != null) {
            variables.putAll(context);
        }
        templateVars.forEach(
                (variable, path) -> {
                    PropertyLookup lookup = element.lookup(path);
                    variables.put(variable, lookup.found() ? lookup.value() : "");
                });

        List<String> resolvedConditions = new ArrayList<>(conditions.size());
        for (String condition : conditions) {
            resolvedConditions.add(resolver.resolve(condition, variables));
        }
        return new Action(
                type,
                resolver.resolve(description, variables),
                priority,
                resolvedConditions,
                metadata);
    }

    private static void collectElementPlaceholders(
            Element element, String text, Map<String, Object> variables) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            PropertyLookup lookup = element.lookup(name);
            if (lookup.found()) {
                variables.put(name, lookup.value());
            }
        }
    }

    public ActionType getType() {
        return type;
    }

    /// @return the unresolved description template, never null
    public String getDescription() {
        return description;
    }

    public Priority getPriority() {
        return priority;
    }

    public List<String> getConditions() {
        return conditions;
    }

    /// @return variable name to property path bindings, never null
    public Map<String, String> getTemplateVars() {
        return templateVars;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// Creates a new template builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable ActionTemplate instances.
    ///
    /// Required fields: `type`, `description`
    public static final class Builder {
        private ActionType type;
        private String description;
        private Priority priority = Priority.NORMAL;
        private final List<String> conditions = new ArrayList<>();
        private final Map<String, String> templateVars = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder type(ActionType type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder condition(String condition) {
            this.conditions.add(Objects.requireNonNull(condition, "condition must not be null"));
            return this;
        }

        public Builder conditions(List<String> conditions) {
            conditions.forEach(this::condition);
            return this;
        }

        /// Binds `{variable}` to the value at `propertyPath`.
        public Builder templateVar(String variable, String propertyPath) {
            this.templateVars.put(variable, propertyPath);
            return this;
        }

        public Builder templateVars(Map<String, String> templateVars) {
            this.templateVars.putAll(templateVars);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        /// Builds the immutable template.
        ///
        /// @return new ActionTemplate instance, never null
        /// @throws NullPointerException if type or description is null
        /// @throws IllegalArgumentException if description is blank
        public ActionTemplate build() {
            return new ActionTemplate(this);
        }
    }
}
