package io.stageflow.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/// Configuration options for process evaluation.
///
/// Use the {@link Builder} for fluent configuration, or load from
/// `stageflow.*` properties with {@link #fromProperties(Properties)}.
///
/// ### Default Values
/// - `historyEnabled`: `true` (per-element state history is recorded)
/// - `maxGateDepth`: `5` (advisory threshold for gate nesting)
/// - `maxGateComplexity`: `25` (advisory threshold for locks per gate)
/// - `idProperties`: `["id"]` (property paths tried for the element id)
///
/// ### Property Keys
/// | Key | Type |
/// |-----|------|
/// | `stageflow.history.enabled` | boolean |
/// | `stageflow.gate.max-depth` | int |
/// | `stageflow.gate.max-complexity` | int |
/// | `stageflow.element.id-properties` | comma-separated paths |
///
/// @implNote **Not thread-safe**. Configure before handing to a
/// {@link io.stageflow.core.process.Process}; do not modify afterwards.
public class StageFlowConfig {

    public static final String HISTORY_ENABLED = "stageflow.history.enabled";
    public static final String MAX_GATE_DEPTH = "stageflow.gate.max-depth";
    public static final String MAX_GATE_COMPLEXITY = "stageflow.gate.max-complexity";
    public static final String ID_PROPERTIES = "stageflow.element.id-properties";

    public static final int DEFAULT_MAX_GATE_DEPTH = 5;
    public static final int DEFAULT_MAX_GATE_COMPLEXITY = 25;

    private boolean historyEnabled = true;
    private int maxGateDepth = DEFAULT_MAX_GATE_DEPTH;
    private int maxGateComplexity = DEFAULT_MAX_GATE_COMPLEXITY;
    private List<String> idProperties = List.of("id");

    /// Creates a configuration with default values.
    public StageFlowConfig() {}

    /// Loads configuration from properties, keeping defaults for absent keys.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a numeric key is not an integer
    public static StageFlowConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        StageFlowConfig config = new StageFlowConfig();
        String history = properties.getProperty(HISTORY_ENABLED);
        if (history != null) {
            config.setHistoryEnabled(Boolean.parseBoolean(history.trim()));
        }
        String depth = properties.getProperty(MAX_GATE_DEPTH);
        if (depth != null) {
            config.setMaxGateDepth(parseInt(MAX_GATE_DEPTH, depth));
        }
        String complexity = properties.getProperty(MAX_GATE_COMPLEXITY);
        if (complexity != null) {
            config.setMaxGateComplexity(parseInt(MAX_GATE_COMPLEXITY, complexity));
        }
        String ids = properties.getProperty(ID_PROPERTIES);
        if (ids != null) {
            config.setIdProperties(
                    Arrays.stream(ids.split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList());
        }
        return config;
    }

    /// Loads configuration from JVM system properties.
    ///
    /// @return new configuration, never null
    public static StageFlowConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + key + " must be an integer but was '" + value + "'", e);
        }
    }

    /// Returns whether per-element state history is recorded.
    ///
    /// @return `true` if each evaluation appends to the element's history
    public boolean isHistoryEnabled() {
        return historyEnabled;
    }

    public void setHistoryEnabled(boolean historyEnabled) {
        this.historyEnabled = historyEnabled;
    }

    /// Returns the gate nesting depth above which structure checks warn.
    ///
    /// @return advisory depth threshold
    public int getMaxGateDepth() {
        return maxGateDepth;
    }

    public void setMaxGateDepth(int maxGateDepth) {
        this.maxGateDepth = maxGateDepth;
    }

    /// Returns the per-gate lock count above which structure checks warn.
    ///
    /// @return advisory complexity threshold
    public int getMaxGateComplexity() {
        return maxGateComplexity;
    }

    public void setMaxGateComplexity(int maxGateComplexity) {
        this.maxGateComplexity = maxGateComplexity;
    }

    /// Returns the property paths tried, in order, to identify an element.
    ///
    /// @return unmodifiable list, never null
    public List<String> getIdProperties() {
        return idProperties;
    }

    /// Sets the property paths tried to identify an element.
    ///
    /// ### Contracts
    /// - **Precondition**: `idProperties` is not null; may be empty, in which case
    ///   elements are always identified by content hash
    ///
    /// @param idProperties ordered id paths, not null
    public void setIdProperties(List<String> idProperties) {
        this.idProperties = List.copyOf(Objects.requireNonNull(idProperties, "idProperties"));
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link StageFlowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final StageFlowConfig config = new StageFlowConfig();

        public Builder historyEnabled(boolean historyEnabled) {
            config.historyEnabled = historyEnabled;
            return this;
        }

        public Builder maxGateDepth(int maxGateDepth) {
            config.maxGateDepth = maxGateDepth;
            return this;
        }

        public Builder maxGateComplexity(int maxGateComplexity) {
            config.maxGateComplexity = maxGateComplexity;
            return this;
        }

        public Builder idProperties(String... idProperties) {
            config.setIdProperties(new ArrayList<>(Arrays.asList(idProperties)));
            return this;
        }

        /// Builds and returns the configured {@link StageFlowConfig} instance.
        ///
        /// @return the configured instance, never null
        public StageFlowConfig build() {
            return config;
        }
    }
}
