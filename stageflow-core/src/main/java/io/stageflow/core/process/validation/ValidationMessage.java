package io.stageflow.core.process.validation;

import java.util.Objects;

/// One finding reported by {@link ProcessValidator}.
///
/// @param severity how serious the finding is, not null
/// @param code stable upper-case identifier such as `UNKNOWN_TARGET_STAGE`, not null
/// @param message human-readable description, not null
/// @param location dotted pointer into the definition, e.g. `stage.review.gate.approval`
/// @param suggestion remediation hint, empty if none
public record ValidationMessage(
        ValidationSeverity severity, String code, String message, String location, String suggestion) {

    public ValidationMessage {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        location = location != null ? location : "process";
        suggestion = suggestion != null ? suggestion : "";
    }

    public static ValidationMessage error(String code, String message, String location, String suggestion) {
        return new ValidationMessage(ValidationSeverity.ERROR, code, message, location, suggestion);
    }

    public static ValidationMessage warning(
            String code, String message, String location, String suggestion) {
        return new ValidationMessage(ValidationSeverity.WARNING, code, message, location, suggestion);
    }

    public static ValidationMessage info(String code, String message, String location, String suggestion) {
        return new ValidationMessage(ValidationSeverity.INFO, code, message, location, suggestion);
    }

    @Override
    public String toString() {
        return severity.value() + " " + code + " at " + location + ": " + message;
    }
}
