package io.stageflow.core.validator;

import java.util.List;
import java.util.Optional;

/// Registry of named custom validators consulted by `custom` locks.
///
/// A registry is an explicit object handed to the evaluation rather than a
/// hidden global, so tests and processes can keep isolated sets of
/// validators. Registration may happen before or after locks referencing a
/// name are built; only the state at evaluation time matters.
///
/// ### Thread Safety
/// @implNote Implementations should be safe for concurrent registration and
/// lookup. Last write wins; no transactional semantics are offered.
///
/// ### Usage
/// {@snippet :
/// ValidatorRegistry registry = new DefaultValidatorRegistry();
/// registry.register("even", (value, expected) -> ((Number) value).intValue() % 2 == 0);
///
/// Lock lock = Lock.custom("count", "even");
/// LockResult result = lock.validate(element, registry);
/// }
///
/// @see DefaultValidatorRegistry for the default implementation
/// @see BuiltInValidators for the stock validators
public interface ValidatorRegistry {

    /// Registers a validator definition, replacing any previous one with the same name.
    ///
    /// @apiNote **Side effects**: Modifies internal validator map
    ///
    /// @param definition the validator to register, not null
    /// @throws NullPointerException if definition is null
    void register(ValidatorDefinition definition);

    /// Registers a validator under `name`, replacing any previous one.
    ///
    /// @apiNote **Side effects**: Modifies internal validator map
    ///
    /// @param name registry key, not null or blank
    /// @param validator the predicate, not null
    default void register(String name, CustomValidator validator) {
        register(ValidatorDefinition.of(name, validator));
    }

    /// Looks up a validator definition by name.
    ///
    /// @param name the validator name, not null
    /// @return the definition if registered, empty otherwise
    /// @throws NullPointerException if name is null
    Optional<ValidatorDefinition> get(String name);

    /// Returns the names of all registered validators, sorted.
    ///
    /// @return unmodifiable sorted list, never null (may be empty)
    List<String> names();

    /// Removes a validator by name.
    ///
    /// @param name the validator name, not null
    /// @return true if a validator was removed
    boolean remove(String name);

    /// Removes every registered validator.
    ///
    /// @apiNote **Side effects**: Empties the registry
    void clear();

    /// Returns whether a validator with the given name is registered.
    ///
    /// @param name the validator name, not null
    /// @return true if registered
    default boolean contains(String name) {
        return get(name).isPresent();
    }

    /// Returns the number of registered validators.
    ///
    /// @return validator count
    default int size() {
        return names().size();
    }
}
