package io.stageflow.core.gate;

import java.util.List;

/// Outcome of {@link Gate#evaluate}.
///
/// ### Contracts
/// - **Invariant**: `passed == failedComponents.isEmpty()`
/// - **Invariant**: `shortCircuited` implies `evaluatedCount < totalComponents`
///
/// @param gateName name of the evaluated gate, not null
/// @param passed whether every evaluated component passed
/// @param passedComponents components that passed, in evaluation order
/// @param failedComponents components that failed (at most one, the last evaluated)
/// @param componentResults results of every evaluated component, in order
/// @param messages failure descriptions, concatenated from failed components
/// @param actions remediation hints, concatenated from failed components
/// @param shortCircuited whether evaluation stopped before the last component
/// @param evaluatedCount number of components evaluated
/// @param totalComponents number of components the gate holds
public record GateResult(
        String gateName,
        boolean passed,
        List<GateComponent> passedComponents,
        List<GateComponent> failedComponents,
        List<ComponentResult> componentResults,
        List<String> messages,
        List<String> actions,
        boolean shortCircuited,
        int evaluatedCount,
        int totalComponents)
        implements ComponentResult {

    public GateResult {
        passedComponents = List.copyOf(passedComponents);
        failedComponents = List.copyOf(failedComponents);
        componentResults = List.copyOf(componentResults);
        messages = List.copyOf(messages);
        actions = List.copyOf(actions);
    }

    /// Fraction of components that passed.
    ///
    /// @return value in `[0.0, 1.0]`
    public double passRatio() {
        return totalComponents == 0 ? 1.0 : (double) passedComponents.size() / totalComponents;
    }
}
