package io.stageflow.core.process;

import io.stageflow.core.action.Action;
import io.stageflow.core.state.EvaluationState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Outcome of one {@link Process#evaluate} call.
///
/// ### Contracts
/// - **Precondition**: `state` and `elementId` must not be null
/// - **Postcondition**: All fields immutable after construction
/// - **Invariant**: for FULFILLING, QUALIFYING and AWAITING results an unset
///   `proposedStage` defaults to `currentStage`
///
/// ### Usage
/// {@snippet :
/// StatusResult result = process.evaluate(element);
/// if (result.getState() == EvaluationState.FULFILLING) {
///     result.getActions().forEach(a -> System.out.println(a.description()));
/// }
/// }
public final class StatusResult {

    private final EvaluationState state;
    private final String elementId;
    private final String currentStage;
    private final String proposedStage;
    private final List<Action> actions;
    private final List<String> errors;
    private final List<String> warnings;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    private StatusResult(Builder builder) {
        this.state = Objects.requireNonNull(builder.state, "State required");
        this.elementId = Objects.requireNonNull(builder.elementId, "Element id required");
        this.currentStage = builder.currentStage;
        this.proposedStage =
                builder.proposedStage == null && defaultsProposedStage(state)
                        ? builder.currentStage
                        : builder.proposedStage;
        this.actions = List.copyOf(builder.actions);
        this.errors = List.copyOf(builder.errors);
        this.warnings = List.copyOf(builder.warnings);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    private static boolean defaultsProposedStage(EvaluationState state) {
        return switch (state) {
            case FULFILLING, QUALIFYING, AWAITING -> true;
            case SCOPING, ADVANCING, REGRESSING, COMPLETED -> false;
        };
    }

    public EvaluationState getState() {
        return state;
    }

    public String getElementId() {
        return elementId;
    }

    /// @return stage the element occupies; null for SCOPING and COMPLETED
    public String getCurrentStage() {
        return currentStage;
    }

    public String getProposedStage() {
        return proposedStage;
    }

    public List<Action> getActions() {
        return actions;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /// Converts this result into a plain nested map with wire-style keys.
    ///
    /// @return insertion-ordered map, never null
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("state", state.value());
        map.put("element_id", elementId);
        map.put("current_stage", currentStage);
        map.put("proposed_stage", proposedStage);
        List<Map<String, Object>> actionMaps = new ArrayList<>(actions.size());
        actions.forEach(a -> actionMaps.add(a.toMap()));
        map.put("actions", actionMaps);
        map.put("errors", errors);
        map.put("warnings", warnings);
        map.put("metadata", metadata);
        map.put("timestamp", timestamp.toString());
        return map;
    }

    /// Returns a builder pre-filled with this result's fields.
    public Builder toBuilder() {
        return new Builder()
                .state(state)
                .elementId(elementId)
                .currentStage(currentStage)
                .proposedStage(proposedStage)
                .actions(actions)
                .errors(errors)
                .warnings(warnings)
                .metadata(metadata)
                .timestamp(timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatusResult that)) return false;
        return state == that.state
                && elementId.equals(that.elementId)
                && Objects.equals(currentStage, that.currentStage)
                && Objects.equals(proposedStage, that.proposedStage)
                && actions.equals(that.actions)
                && errors.equals(that.errors)
                && warnings.equals(that.warnings)
                && metadata.equals(that.metadata)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, elementId, currentStage, proposedStage, actions, errors, timestamp);
    }

    @Override
    public String toString() {
        return "StatusResult{state="
                + state
                + ", elementId='"
                + elementId
                + "', currentStage="
                + currentStage
                + ", proposedStage="
                + proposedStage
                + ", actions="
                + actions.size()
                + ", errors="
                + errors
                + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EvaluationState state;
        private String elementId;
        private String currentStage;
        private String proposedStage;
        private final List<Action> actions = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant timestamp;

        private Builder() {}

        public Builder state(EvaluationState state) {
            this.state = state;
            return this;
        }

        public Builder elementId(String elementId) {
            this.elementId = elementId;
            return this;
        }

        public Builder currentStage(String currentStage) {
            this.currentStage = currentStage;
            return this;
        }

        public Builder proposedStage(String proposedStage) {
            this.proposedStage = proposedStage;
            return this;
        }

        public Builder action(Action action) {
            this.actions.add(action);
            return this;
        }

        public Builder actions(List<Action> actions) {
            this.actions.clear();
            this.actions.addAll(actions);
            return this;
        }

        public Builder error(String error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors.clear();
            this.errors.addAll(errors);
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.clear();
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            this.metadata.putAll(metadata);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public StatusResult build() {
            return new StatusResult(this);
        }
    }
}
