package io.stageflow.core.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Append-only log of the states an element has been reported in.
///
/// @implNote **Not thread-safe**. Instances held by a {@link StateHistoryStore}
/// are only mutated under the store's lock; callers receive copies.
///
/// @see StateTransition for individual entries
public class ElementHistory {

    private final String elementId;
    private final Instant createdAt;
    private List<StateTransition> transitions = new ArrayList<>();

    /// Creates an empty history.
    ///
    /// @param elementId element identifier, not null
    /// @param createdAt creation time, not null
    public ElementHistory(String elementId, Instant createdAt) {
        this.elementId = Objects.requireNonNull(elementId, "elementId must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /// Appends a transition.
    ///
    /// @apiNote **Side effects**: Modifies internal transition list
    ///
    /// @param transition the entry to record, not null
    /// @return this history for chaining, never null
    public ElementHistory addTransition(StateTransition transition) {
        transitions.add(Objects.requireNonNull(transition, "transition must not be null"));
        return this;
    }

    public String getElementId() {
        return elementId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /// Returns all recorded transitions, oldest first.
    ///
    /// @return immutable copy of the transitions list, never null
    public List<StateTransition> getTransitions() {
        return List.copyOf(transitions);
    }

    /// @return the most recent transition, or empty if none is recorded
    public Optional<StateTransition> getLastTransition() {
        return transitions.isEmpty()
                ? Optional.empty()
                : Optional.of(transitions.get(transitions.size() - 1));
    }

    /// @return the most recently recorded state, or empty if none is recorded
    public Optional<EvaluationState> getCurrentState() {
        return getLastTransition().map(StateTransition::toState);
    }

    /// Returns the most recent stage name recorded by any transition.
    ///
    /// @return last non-null stage, or empty if no transition named a stage
    public Optional<String> getCurrentStage() {
        for (int i = transitions.size() - 1; i >= 0; i--) {
            String stage = transitions.get(i).stageName();
            if (stage != null) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    /// @return number of REGRESSING entries
    public long getRegressionCount() {
        return transitions.stream().filter(StateTransition::isRegression).count();
    }

    public int size() {
        return transitions.size();
    }

    /// Creates a mutable copy of this history.
    ///
    /// @return a new ElementHistory with copied data, never null
    public ElementHistory copy() {
        ElementHistory history = new ElementHistory(elementId, createdAt);
        history.transitions = new ArrayList<>(transitions);
        return history;
    }
}
