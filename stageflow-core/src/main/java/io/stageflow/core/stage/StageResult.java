package io.stageflow.core.stage;

import io.stageflow.core.gate.GateResult;
import java.util.List;

/// Outcome of {@link Stage#evaluate}.
///
/// @param stageName the evaluated stage, not null
/// @param schemaValid whether the schema (if any) reported no errors
/// @param schemaErrors schema violations, empty if valid
/// @param gateResults results of every gate, in declaration order
/// @param overallPassed whether the stage is satisfied
/// @param messages gate failure descriptions, concatenated in gate order
/// @param actions gate remediation hints, concatenated in gate order
/// @param completionFraction progress through the stage, in `[0.0, 1.0]`
public record StageResult(
        String stageName,
        boolean schemaValid,
        List<String> schemaErrors,
        List<GateResult> gateResults,
        boolean overallPassed,
        List<String> messages,
        List<String> actions,
        double completionFraction) {

    public StageResult {
        schemaErrors = List.copyOf(schemaErrors);
        gateResults = List.copyOf(gateResults);
        messages = List.copyOf(messages);
        actions = List.copyOf(actions);
    }

    /// @return names of gates that passed, in declaration order, never null
    public List<String> passedGates() {
        return gateResults.stream().filter(GateResult::passed).map(GateResult::gateName).toList();
    }

    /// @return names of gates that failed, in declaration order, never null
    public List<String> failedGates() {
        return gateResults.stream()
                .filter(r -> !r.passed())
                .map(GateResult::gateName)
                .toList();
    }
}
