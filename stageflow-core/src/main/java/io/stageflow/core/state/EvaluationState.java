package io.stageflow.core.state;

import java.util.Locale;

/// Workflow state reported for an element after one evaluation.
///
/// `SCOPING` is the entry state (no stage could be determined) and
/// `COMPLETED` the exit state (the final stage is satisfied).
/// `QUALIFYING` and `ADVANCING` are transient: they occur while an
/// evaluation walks forward through stages the element already satisfies.
public enum EvaluationState {
    /// No stage determined yet, or evaluation failed.
    SCOPING,
    /// The current stage's requirements are not met.
    FULFILLING,
    /// The current stage is satisfied and the next one is being checked.
    QUALIFYING,
    /// The current stage is satisfied but the element cannot enter the next one.
    AWAITING,
    /// Moving from a satisfied stage into the next.
    ADVANCING,
    /// The element fell back to an earlier stage than previously recorded.
    REGRESSING,
    /// The final stage is satisfied.
    COMPLETED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a wire name case-insensitively.
    ///
    /// @param value state name such as `awaiting`, not null
    /// @return the matching state, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static EvaluationState fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown evaluation state: " + value, e);
        }
    }

    /// Whether no further progress is possible without a new process.
    ///
    /// @return true only for `COMPLETED`
    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
