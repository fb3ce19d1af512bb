package io.stageflow.core.process;

import java.util.List;

/// Outcome of {@link Process#validateStageProgression}.
///
/// @param allowed whether the element may move to the target stage
/// @param reasons unmet conditions, empty when allowed
public record ProgressionCheck(boolean allowed, List<String> reasons) {

    public ProgressionCheck {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static ProgressionCheck allow() {
        return new ProgressionCheck(true, List.of());
    }

    public static ProgressionCheck deny(List<String> reasons) {
        return new ProgressionCheck(false, reasons);
    }
}
