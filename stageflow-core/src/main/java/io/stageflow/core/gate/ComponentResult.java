package io.stageflow.core.gate;

import java.util.List;

/// Result of evaluating a {@link GateComponent}.
public sealed interface ComponentResult permits LockResult, GateResult {

    /// Whether the component was satisfied.
    ///
    /// @return true on success
    boolean passed();

    /// Failure descriptions produced during evaluation.
    ///
    /// @return unmodifiable list, empty when passed, never null
    List<String> messages();

    /// Remediation hints produced during evaluation.
    ///
    /// @return unmodifiable list, empty when passed, never null
    List<String> actions();
}
