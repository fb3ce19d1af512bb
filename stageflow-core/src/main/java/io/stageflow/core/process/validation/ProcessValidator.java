package io.stageflow.core.process.validation;

import io.stageflow.core.gate.Gate;
import io.stageflow.core.gate.GateComponent;
import io.stageflow.core.process.ProcessDefinition;
import io.stageflow.core.stage.Stage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Static checks over a {@link ProcessDefinition}.
///
/// The definition builder only rejects what evaluation cannot run at all
/// (missing name, duplicate stages, a broken stage order). Everything this
/// validator reports is still evaluable but most likely a modelling mistake.
///
/// ### Stage graph
/// Gate `target_stage` values, including those of nested gates, declare where
/// a stage leads. A stage that declares no known target leads to the next
/// stage in evaluation order. The first stage is the entry point.
///
/// ### Checks
/// | Code | Severity | Finding |
/// |---|---|---|
/// | `UNKNOWN_TARGET_STAGE` | error | a gate targets a stage the process lacks |
/// | `SELF_REFERENCING_GATE` | error | a gate targets its own stage |
/// | `TARGET_NOT_NEXT` | warning | a target evaluation never follows without stage skipping |
/// | `UNREACHABLE_STAGE` | warning | no path from the first stage reaches the stage |
/// | `DEAD_END_STAGE` | warning | a non-final stage leads nowhere |
/// | `UNGATED_STAGE` | warning | a non-final stage has neither gates nor required fields |
/// | `UNCHECKED_REQUIRED_PROPERTY` | info | a schema-required field no gate reads |
/// | `STAGE_NAME_SPACES` | warning | a stage name contains spaces |
/// | `SINGLE_STAGE_PROCESS` | info | the process has one stage |
///
/// @implNote Stateless and thread-safe.
public final class ProcessValidator {

    /// Runs every check.
    ///
    /// @param definition the definition to inspect, not null
    /// @return findings in check order, never null
    public ProcessValidationResult validate(ProcessDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        List<Stage> stages = definition.getOrderedStages();
        Map<String, Stage> byName = new LinkedHashMap<>();
        stages.forEach(s -> byName.put(s.getName(), s));

        List<ValidationMessage> messages = new ArrayList<>();
        checkTargets(definition, stages, byName, messages);
        Map<String, Set<String>> graph = stageGraph(stages, byName);
        checkReachability(stages, graph, messages);
        checkDeadEnds(stages, graph, messages);
        checkUngatedStages(stages, messages);
        checkPropertyCoverage(stages, messages);
        checkNaming(stages, messages);
        return new ProcessValidationResult(definition.getName(), messages);
    }

    private void checkTargets(
            ProcessDefinition definition,
            List<Stage> stages,
            Map<String, Stage> byName,
            List<ValidationMessage> messages) {
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            String next = i + 1 < stages.size() ? stages.get(i + 1).getName() : null;
            for (Gate gate : allGates(stage)) {
                String target = gate.getTargetStage();
                if (target == null || target.isBlank()) {
                    continue;
                }
                String location = gateLocation(stage, gate);
                if (!byName.containsKey(target)) {
                    messages.add(
                            ValidationMessage.error(
                                    "UNKNOWN_TARGET_STAGE",
                                    "Gate '"
                                            + gate.getName()
                                            + "' in stage '"
                                            + stage.getName()
                                            + "' targets non-existent stage '"
                                            + target
                                            + "'",
                                    location,
                                    "Point target_stage at an existing stage or remove it"));
                } else if (target.equals(stage.getName())) {
                    messages.add(
                            ValidationMessage.error(
                                    "SELF_REFERENCING_GATE",
                                    "Gate '"
                                            + gate.getName()
                                            + "' in stage '"
                                            + stage.getName()
                                            + "' targets its own stage",
                                    location,
                                    "Target a different stage or drop target_stage"));
                } else if (!definition.isAllowStageSkipping() && !target.equals(next)) {
                    messages.add(
                            ValidationMessage.warning(
                                    "TARGET_NOT_NEXT",
                                    "Gate '"
                                            + gate.getName()
                                            + "' in stage '"
                                            + stage.getName()
                                            + "' targets '"
                                            + target
                                            + "' but evaluation advances to "
                                            + (next != null ? "'" + next + "'" : "no further stage"),
                                    location,
                                    "Enable stage skipping or reorder the stages"));
                }
            }
        }
    }

    private void checkReachability(
            List<Stage> stages, Map<String, Set<String>> graph, List<ValidationMessage> messages) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(stages.get(0).getName());
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (reached.add(current)) {
                pending.addAll(graph.get(current));
            }
        }
        for (Stage stage : stages) {
            if (!reached.contains(stage.getName())) {
                messages.add(
                        ValidationMessage.warning(
                                "UNREACHABLE_STAGE",
                                "Stage '"
                                        + stage.getName()
                                        + "' cannot be reached from '"
                                        + stages.get(0).getName()
                                        + "'",
                                stageLocation(stage),
                                "Target the stage from an earlier gate or remove it"));
            }
        }
    }

    private void checkDeadEnds(
            List<Stage> stages, Map<String, Set<String>> graph, List<ValidationMessage> messages) {
        for (int i = 0; i < stages.size() - 1; i++) {
            Stage stage = stages.get(i);
            if (graph.get(stage.getName()).isEmpty()) {
                messages.add(
                        ValidationMessage.warning(
                                "DEAD_END_STAGE",
                                "Stage '" + stage.getName() + "' is not final but leads to no other stage",
                                stageLocation(stage),
                                "Give one of its gates a valid target_stage"));
            }
        }
    }

    private void checkUngatedStages(List<Stage> stages, List<ValidationMessage> messages) {
        for (int i = 0; i < stages.size() - 1; i++) {
            Stage stage = stages.get(i);
            if (stage.getGates().isEmpty() && stage.getRequiredProperties().isEmpty()) {
                messages.add(
                        ValidationMessage.warning(
                                "UNGATED_STAGE",
                                "Stage '" + stage.getName() + "' has no gates but is not final",
                                stageLocation(stage),
                                "Add gates to control progression or reconsider stage order"));
            }
        }
    }

    private void checkPropertyCoverage(List<Stage> stages, List<ValidationMessage> messages) {
        Set<String> gated = new LinkedHashSet<>();
        for (Stage stage : stages) {
            stage.getGates().forEach(g -> gated.addAll(g.getPropertyPaths()));
        }
        for (Stage stage : stages) {
            if (stage.getSchema().isEmpty()) {
                continue;
            }
            for (String field : stage.getSchema().get().getRequiredFields()) {
                if (!gated.contains(field)) {
                    messages.add(
                            ValidationMessage.info(
                                    "UNCHECKED_REQUIRED_PROPERTY",
                                    "Required property '"
                                            + field
                                            + "' of stage '"
                                            + stage.getName()
                                            + "' is not checked by any gate",
                                    "property." + field,
                                    "Add a lock on the property if its value matters"));
                }
            }
        }
    }

    private void checkNaming(List<Stage> stages, List<ValidationMessage> messages) {
        for (Stage stage : stages) {
            if (stage.getName().contains(" ")) {
                messages.add(
                        ValidationMessage.warning(
                                "STAGE_NAME_SPACES",
                                "Stage name '" + stage.getName() + "' contains spaces",
                                stageLocation(stage),
                                "Use underscores instead of spaces"));
            }
        }
        if (stages.size() == 1) {
            messages.add(
                    ValidationMessage.info(
                            "SINGLE_STAGE_PROCESS",
                            "Process contains only one stage",
                            "process.stages",
                            "Consider if this process needs multi-stage evaluation"));
        }
    }

    private static Map<String, Set<String>> stageGraph(List<Stage> stages, Map<String, Stage> byName) {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            Set<String> declared = new LinkedHashSet<>();
            boolean declaresTargets = false;
            for (Gate gate : allGates(stage)) {
                String target = gate.getTargetStage();
                if (target == null || target.isBlank()) {
                    continue;
                }
                declaresTargets = true;
                if (byName.containsKey(target) && !target.equals(stage.getName())) {
                    declared.add(target);
                }
            }
            if (!declaresTargets && i + 1 < stages.size()) {
                declared.add(stages.get(i + 1).getName());
            }
            graph.put(stage.getName(), declared);
        }
        return graph;
    }

    private static List<Gate> allGates(Stage stage) {
        List<Gate> gates = new ArrayList<>();
        Deque<Gate> pending = new ArrayDeque<>(stage.getGates());
        while (!pending.isEmpty()) {
            Gate gate = pending.poll();
            gates.add(gate);
            for (GateComponent component : gate.getComponents()) {
                if (component instanceof Gate nested) {
                    pending.add(nested);
                }
            }
        }
        return gates;
    }

    private static String stageLocation(Stage stage) {
        return "stage." + stage.getName();
    }

    private static String gateLocation(Stage stage, Gate gate) {
        return stageLocation(stage) + ".gate." + gate.getName();
    }
}
