package io.stageflow.core.process;

import io.stageflow.core.stage.Stage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Language-neutral description of a process, as produced by a loader.
///
/// Holds built {@link Stage} graphs plus process-level flags. When
/// `stageOrder` is empty the declaration order of `stages` is used.
///
/// ### Contracts
/// - **Precondition**: `name` non-blank, at least one stage
/// - **Invariant**: stage names are unique; a non-empty `stageOrder` names
///   every stage exactly once
///
/// @see Process#fromDefinition(ProcessDefinition)
public final class ProcessDefinition {

    private final String name;
    private final String description;
    private final List<Stage> stages;
    private final List<String> stageOrder;
    private final boolean allowStageSkipping;
    private final boolean regressionDetection;
    private final Map<String, Object> metadata;

    private ProcessDefinition(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.stages = List.copyOf(builder.stages);
        this.stageOrder = List.copyOf(builder.stageOrder);
        this.allowStageSkipping = builder.allowStageSkipping;
        this.regressionDetection = builder.regressionDetection;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        validate();
    }

    private void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Process must have a name");
        }
        if (stages.isEmpty()) {
            throw new IllegalArgumentException(
                    "Process '" + name + "' must contain at least one stage");
        }
        Set<String> names = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Stage stage : stages) {
            if (!names.add(stage.getName())) {
                duplicates.add(stage.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException(
                    "Duplicate stage names in process '" + name + "': " + duplicates);
        }
        if (!stageOrder.isEmpty()) {
            Set<String> ordered = new HashSet<>(stageOrder);
            if (ordered.size() != stageOrder.size() || !ordered.equals(names)) {
                throw new IllegalArgumentException(
                        "Stage order "
                                + stageOrder
                                + " does not match defined stages "
                                + names);
            }
        }
    }

    /// Returns stages in evaluation order.
    ///
    /// @return explicit order if given, else declaration order; never null
    public List<Stage> getOrderedStages() {
        if (stageOrder.isEmpty()) {
            return stages;
        }
        Map<String, Stage> byName = new LinkedHashMap<>();
        stages.forEach(s -> byName.put(s.getName(), s));
        List<Stage> ordered = new ArrayList<>(stageOrder.size());
        stageOrder.forEach(n -> ordered.add(byName.get(n)));
        return List.copyOf(ordered);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /// @return stages in declaration order
    public List<Stage> getStages() {
        return stages;
    }

    /// @return explicit order, empty if declaration order applies
    public List<String> getStageOrder() {
        return stageOrder;
    }

    public boolean isAllowStageSkipping() {
        return allowStageSkipping;
    }

    public boolean isRegressionDetection() {
        return regressionDetection;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description = "";
        private final List<Stage> stages = new ArrayList<>();
        private final List<String> stageOrder = new ArrayList<>();
        private boolean allowStageSkipping = false;
        private boolean regressionDetection = true;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder stage(Stage stage) {
            this.stages.add(Objects.requireNonNull(stage, "stage"));
            return this;
        }

        public Builder stages(List<Stage> stages) {
            stages.forEach(this::stage);
            return this;
        }

        public Builder stageOrder(List<String> stageOrder) {
            this.stageOrder.clear();
            if (stageOrder != null) {
                this.stageOrder.addAll(stageOrder);
            }
            return this;
        }

        public Builder allowStageSkipping(boolean allowStageSkipping) {
            this.allowStageSkipping = allowStageSkipping;
            return this;
        }

        public Builder regressionDetection(boolean regressionDetection) {
            this.regressionDetection = regressionDetection;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public ProcessDefinition build() {
            return new ProcessDefinition(this);
        }
    }
}
