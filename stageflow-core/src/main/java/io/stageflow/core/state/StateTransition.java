package io.stageflow.core.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One entry of an element's state history.
///
/// @param timestamp when the transition was recorded, not null
/// @param fromState previous recorded state, null for the first entry
/// @param toState state reached, not null
/// @param stageName stage associated with the new state, may be null
/// @param reason short explanation, not null
/// @param metadata extra details such as the next or previous stage, never null
public record StateTransition(
        Instant timestamp,
        EvaluationState fromState,
        EvaluationState toState,
        String stageName,
        String reason,
        Map<String, Object> metadata) {

    public StateTransition {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(toState, "toState must not be null");
        reason = reason != null ? reason : "";
        metadata =
                metadata == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /// @return true if the element fell back to an earlier stage
    public boolean isRegression() {
        return toState == EvaluationState.REGRESSING;
    }

    /// @return true if the element moved forward into another stage
    public boolean isProgression() {
        return toState == EvaluationState.ADVANCING || toState == EvaluationState.COMPLETED;
    }

    /// @return true if the process completed
    public boolean isCompletion() {
        return toState == EvaluationState.COMPLETED;
    }

    /// @return true if the state differs from the previous entry
    public boolean isStateChange() {
        return fromState != toState;
    }
}
