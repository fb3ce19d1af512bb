package io.stageflow.core.process.validation;

import java.util.List;
import java.util.Objects;

/// Findings of one {@link ProcessValidator#validate} run, in check order.
///
/// @param processName the validated process, not null
/// @param messages every finding, never null
public record ProcessValidationResult(String processName, List<ValidationMessage> messages) {

    public ProcessValidationResult {
        Objects.requireNonNull(processName, "processName must not be null");
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public List<ValidationMessage> errors() {
        return withSeverity(ValidationSeverity.ERROR);
    }

    public List<ValidationMessage> warnings() {
        return withSeverity(ValidationSeverity.WARNING);
    }

    public List<ValidationMessage> infos() {
        return withSeverity(ValidationSeverity.INFO);
    }

    public boolean hasErrors() {
        return messages.stream().anyMatch(m -> m.severity() == ValidationSeverity.ERROR);
    }

    /// @return true if no finding of any severity was reported
    public boolean isClean() {
        return messages.isEmpty();
    }

    /// @return codes of every finding, in report order
    public List<String> codes() {
        return messages.stream().map(ValidationMessage::code).toList();
    }

    private List<ValidationMessage> withSeverity(ValidationSeverity severity) {
        return messages.stream().filter(m -> m.severity() == severity).toList();
    }
}
