package io.stageflow.core.validator;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link ValidatorRegistry}.
///
/// @implNote Thread-safe. Backed by a ConcurrentHashMap; each operation is
/// atomic on its own, with no ordering guarantees across operations.
///
/// @see BuiltInValidators#registerAll(ValidatorRegistry)
public final class DefaultValidatorRegistry implements ValidatorRegistry {

    private static final Logger logger =
            Logger.getLogger(DefaultValidatorRegistry.class.getName());

    private final Map<String, ValidatorDefinition> validators = new ConcurrentHashMap<>();

    /// Creates an empty validator registry.
    public DefaultValidatorRegistry() {}

    /// Creates a validator registry with initial validators.
    ///
    /// @param initialValidators validators to register, not null
    public DefaultValidatorRegistry(List<ValidatorDefinition> initialValidators) {
        Objects.requireNonNull(initialValidators, "initialValidators must not be null");
        initialValidators.forEach(this::register);
    }

    /// Creates a registry pre-populated with {@link BuiltInValidators}.
    ///
    /// @return new registry, never null
    public static DefaultValidatorRegistry withBuiltIns() {
        DefaultValidatorRegistry registry = new DefaultValidatorRegistry();
        BuiltInValidators.registerAll(registry);
        return registry;
    }

    @Override
    public void register(ValidatorDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        ValidatorDefinition previous = validators.put(definition.name(), definition);
        if (previous != null) {
            logger.fine("Replaced validator: " + definition.name());
        } else {
            logger.fine("Registered validator: " + definition.name());
        }
    }

    @Override
    public Optional<ValidatorDefinition> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(validators.get(name));
    }

    @Override
    public List<String> names() {
        return validators.keySet().stream().sorted().toList();
    }

    @Override
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return validators.remove(name) != null;
    }

    @Override
    public void clear() {
        int count = validators.size();
        validators.clear();
        logger.info("Cleared " + count + " validators from registry");
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return validators.containsKey(name);
    }

    @Override
    public int size() {
        return validators.size();
    }
}
