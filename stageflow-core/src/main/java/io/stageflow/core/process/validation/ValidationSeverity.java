package io.stageflow.core.process.validation;

import java.util.Locale;

/// Weight of a {@link ValidationMessage}, most severe first.
public enum ValidationSeverity {
    ERROR,
    WARNING,
    INFO;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
