package io.stageflow.core.validator;

import java.util.Objects;

/// Named custom validator with a human-readable description.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: All fields immutable after construction
///
/// @param name registry key referenced by `custom` locks, not null
/// @param description what the validator checks, not null (may be empty)
/// @param validator the predicate, not null
/// @see ValidatorRegistry for registration
public record ValidatorDefinition(String name, String description, CustomValidator validator) {

    public ValidatorDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description != null ? description : "";
        Objects.requireNonNull(validator, "validator must not be null");
    }

    /// Creates a definition without description.
    ///
    /// @param name registry key, not null
    /// @param validator the predicate, not null
    /// @return new definition, never null
    public static ValidatorDefinition of(String name, CustomValidator validator) {
        return new ValidatorDefinition(name, "", validator);
    }
}
