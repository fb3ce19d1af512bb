package io.stageflow.core.process;

import io.stageflow.core.StageFlowConfig;
import io.stageflow.core.action.Action;
import io.stageflow.core.action.ActionType;
import io.stageflow.core.action.Priority;
import io.stageflow.core.element.Element;
import io.stageflow.core.process.validation.ProcessValidationResult;
import io.stageflow.core.process.validation.ProcessValidator;
import io.stageflow.core.process.validation.ValidationMessage;
import io.stageflow.core.process.validation.ValidationSeverity;
import io.stageflow.core.stage.Stage;
import io.stageflow.core.stage.StageResult;
import io.stageflow.core.state.ElementHistory;
import io.stageflow.core.state.EvaluationSnapshot;
import io.stageflow.core.state.EvaluationState;
import io.stageflow.core.state.StateHistoryStore;
import io.stageflow.core.validator.DefaultValidatorRegistry;
import io.stageflow.core.validator.ValidatorRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/// Ordered stages plus the state machine that places an element among them.
///
/// One evaluation walks from the scoped stage towards the end of the process:
/// a passed stage hands the element to the next stage when progression is
/// allowed, so QUALIFYING and ADVANCING appear in the history while the
/// returned result settles in FULFILLING, AWAITING or COMPLETED. The walk is
/// a loop bounded by the number of stages.
///
/// ### Contracts
/// - **Postcondition**: {@link #evaluate} never throws for a non-null element;
///   faults become a SCOPING result carrying the fault text
/// - **Invariant**: stage graph and flags are immutable; only the history
///   side-table changes
///
/// ### Usage
/// {@snippet :
/// Process process = Process.fromDefinition(definition);
/// StatusResult result = process.evaluate(DictElement.of(Map.of("email", "a@b.io")));
/// }
///
/// @implNote Thread-safe. Evaluation reads only immutable structure; history
/// writes are serialized by {@link StateHistoryStore}.
public final class Process {

    private static final Logger logger = Logger.getLogger(Process.class.getName());

    private final ProcessDefinition definition;
    private final List<Stage> stages;
    private final Map<String, Integer> stageIndex;
    private final ValidatorRegistry validators;
    private final StageFlowConfig config;
    private final Clock clock;
    private final ElementIdResolver idResolver;
    private final StateHistoryStore historyStore = new StateHistoryStore();

    private Process(Builder builder) {
        this.definition = Objects.requireNonNull(builder.definition, "Process definition required");
        this.validators =
                builder.validators != null ? builder.validators : new DefaultValidatorRegistry();
        this.config = builder.config != null ? builder.config : new StageFlowConfig();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.idResolver = new ElementIdResolver(config.getIdProperties());
        this.stages = definition.getOrderedStages();

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            index.put(stages.get(i).getName(), i);
        }
        this.stageIndex = Map.copyOf(index);

        for (Stage stage : stages) {
            for (String warning :
                    stage.validateStructure(
                            config.getMaxGateDepth(), config.getMaxGateComplexity())) {
                logger.warning("Process '" + definition.getName() + "': " + warning);
            }
        }
        for (ValidationMessage message : validate().messages()) {
            if (message.severity() == ValidationSeverity.INFO) {
                logger.fine("Process '" + definition.getName() + "': " + message);
            } else {
                logger.warning("Process '" + definition.getName() + "': " + message);
            }
        }
        logger.info(
                "Created process '"
                        + definition.getName()
                        + "' with "
                        + stages.size()
                        + " stages");
    }

    /// Builds a process with a fresh validator registry and default config.
    ///
    /// @param definition the loaded definition, not null
    /// @return new process, never null
    public static Process fromDefinition(ProcessDefinition definition) {
        return builder().definition(definition).build();
    }

    /// Builds a process sharing a validator registry.
    ///
    /// @param definition the loaded definition, not null
    /// @param validators registry consulted by custom locks, not null
    /// @return new process, never null
    public static Process fromDefinition(
            ProcessDefinition definition, ValidatorRegistry validators) {
        return builder().definition(definition).validators(validators).build();
    }

    /// Runs the static definition checks of {@link ProcessValidator}.
    ///
    /// @return every finding, never null
    public ProcessValidationResult validate() {
        return new ProcessValidator().validate(definition);
    }

    // -- Evaluation --

    /// Evaluates an element, scoping it to a stage first.
    ///
    /// @param element the record, not null
    /// @return the outcome, never null
    public StatusResult evaluate(Element element) {
        return evaluate(element, null);
    }

    /// Evaluates an element starting from a known stage.
    ///
    /// @apiNote **Side effects**: Appends to the element's history when
    /// history is enabled
    ///
    /// @param element the record, not null
    /// @param currentStageName stage to start from, or null or blank to scope
    /// @return the outcome, never null
    public StatusResult evaluate(Element element, String currentStageName) {
        return evaluate(element, currentStageName, definition.isRegressionDetection());
    }

    /// Evaluates an element and compares its stage with the last recorded one.
    ///
    /// Runs regardless of the definition's regression flag. A lower stage
    /// index than the last recorded stage yields a REGRESSING result. Gates
    /// that passed at the previous evaluation but fail now, and properties the
    /// element no longer carries, are reported as warnings and listed under
    /// the `regressed_gates` and `lost_properties` metadata keys.
    ///
    /// @apiNote **Side effects**: Appends to the element's history when
    /// history is enabled
    ///
    /// @param element the record, not null
    /// @return the outcome, never null
    public StatusResult checkRegression(Element element) {
        return evaluate(element, null, true);
    }

    /// Evaluates elements one after another on the caller's thread.
    ///
    /// @param elements records to evaluate, not null
    /// @return results in input order, never null
    public List<StatusResult> evaluateBatch(List<? extends Element> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        List<StatusResult> results = new ArrayList<>(elements.size());
        for (Element element : elements) {
            results.add(evaluate(element));
        }
        return results;
    }

    /// Evaluates elements concurrently on an executor.
    ///
    /// Results keep input order. Elements sharing an id append to the same
    /// history in completion order.
    ///
    /// @param elements records to evaluate, not null
    /// @param executor executor running the evaluations, not null
    /// @return results in input order, never null
    public List<StatusResult> evaluateBatch(List<? extends Element> elements, Executor executor) {
        Objects.requireNonNull(elements, "elements must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        List<CompletableFuture<StatusResult>> futures = new ArrayList<>(elements.size());
        for (Element element : elements) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(element), executor));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private StatusResult evaluate(Element element, String currentStageName, boolean detectRegression) {
        Objects.requireNonNull(element, "element must not be null");
        Instant now = clock.instant();
        String elementId;
        try {
            elementId = idResolver.resolve(element);
        } catch (RuntimeException e) {
            logger.warning("Failed to read element id properties: " + e.getMessage());
            elementId = fallbackId(element);
        }

        List<StateHistoryStore.Entry> trail = new ArrayList<>();
        StatusResult result;
        EvaluationSnapshot snapshot = null;
        try {
            result = walk(element, elementId, currentStageName, now, trail);
            if (config.isHistoryEnabled()) {
                snapshot = snapshot(element);
                if (detectRegression) {
                    result = applyRegression(element, result, snapshot);
                }
            }
        } catch (RuntimeException e) {
            logger.warning(
                    "Evaluation of element '"
                            + elementId
                            + "' in process '"
                            + definition.getName()
                            + "' failed: "
                            + e);
            trail.clear();
            snapshot = null;
            result = faultResult(elementId, now, e);
        }

        if (config.isHistoryEnabled()) {
            trail.add(
                    new StateHistoryStore.Entry(
                            result.getState(),
                            stageOf(result),
                            reasonFor(result),
                            result.getMetadata()));
            historyStore.recordAll(elementId, now, trail, snapshot);
        }
        logger.fine(
                "Element '"
                        + elementId
                        + "' evaluated to "
                        + result.getState()
                        + " at stage "
                        + stageOf(result));
        return result;
    }

    private StatusResult walk(
            Element element,
            String elementId,
            String currentStageName,
            Instant now,
            List<StateHistoryStore.Entry> trail) {
        Stage current;
        if (currentStageName != null && !currentStageName.isBlank()) {
            Optional<Stage> known = getStage(currentStageName);
            if (known.isEmpty()) {
                return StatusResult.builder()
                        .state(EvaluationState.SCOPING)
                        .elementId(elementId)
                        .error("Stage '" + currentStageName + "' not found in process")
                        .action(
                                Action.of(
                                        ActionType.MANUAL_REVIEW,
                                        "Invalid current stage: " + currentStageName,
                                        Priority.HIGH))
                        .timestamp(now)
                        .build();
            }
            current = known.get();
        } else {
            Optional<Stage> scoped = scope(element);
            if (scoped.isEmpty()) {
                return StatusResult.builder()
                        .state(EvaluationState.SCOPING)
                        .elementId(elementId)
                        .error("Element lacks required properties for any stage")
                        .action(
                                Action.of(
                                        ActionType.COMPLETE_FIELD,
                                        "Ensure element has required properties for at least one stage",
                                        Priority.HIGH))
                        .timestamp(now)
                        .build();
            }
            current = scoped.get();
        }

        for (int steps = 0; steps < stages.size(); steps++) {
            StageResult stageResult = current.evaluate(element, validators);
            if (!stageResult.overallPassed()) {
                return fulfilling(element, elementId, current, stageResult, now);
            }

            Optional<String> next = getNextStageName(current.getName());
            if (next.isEmpty()) {
                return completed(element, elementId, current, now);
            }

            String nextName = next.get();
            ProgressionCheck check = validateStageProgression(element, current.getName(), nextName);
            if (!check.allowed()) {
                return awaiting(element, elementId, current, nextName, check, now);
            }

            trail.add(
                    new StateHistoryStore.Entry(
                            EvaluationState.QUALIFYING,
                            current.getName(),
                            "Stage '" + current.getName() + "' passed",
                            Map.of("completion", stageResult.completionFraction())));
            trail.add(
                    new StateHistoryStore.Entry(
                            EvaluationState.ADVANCING,
                            nextName,
                            "Advanced from '" + current.getName() + "' to '" + nextName + "'",
                            Map.of("from_stage", current.getName())));
            logger.fine("Element '" + elementId + "' advancing to stage '" + nextName + "'");
            current = stages.get(stageIndex.get(nextName));
        }
        throw new IllegalStateException(
                "Stage walk in process '"
                        + definition.getName()
                        + "' exceeded "
                        + stages.size()
                        + " steps");
    }

    private Optional<Stage> scope(Element element) {
        Stage best = null;
        double bestCompletion = -1.0;
        int compatible = 0;
        for (Stage stage : stages) {
            if (!stage.isCompatibleWithElement(element)) {
                continue;
            }
            compatible++;
            double completion = stage.getCompletionFraction(element, validators);
            if (completion > bestCompletion) {
                best = stage;
                bestCompletion = completion;
            }
        }
        if (compatible > 1) {
            logger.fine(
                    compatible
                            + " compatible stages; scoped to '"
                            + best.getName()
                            + "' with completion "
                            + bestCompletion);
        }
        return Optional.ofNullable(best);
    }

    private StatusResult fulfilling(
            Element element, String elementId, Stage stage, StageResult stageResult, Instant now) {
        double completion = stageResult.completionFraction();
        Map<String, Object> context = Map.of("completion", completion);
        List<Action> actions = stage.resolveActions(EvaluationState.FULFILLING, element, context);
        if (actions.isEmpty()) {
            actions = new ArrayList<>();
            for (String hint : stageResult.actions()) {
                actions.add(Action.of(ActionType.COMPLETE_FIELD, hint, Priority.NORMAL));
            }
            for (String schemaError : stageResult.schemaErrors()) {
                actions.add(Action.of(ActionType.VALIDATE_DATA, schemaError, Priority.NORMAL));
            }
        }
        return StatusResult.builder()
                .state(EvaluationState.FULFILLING)
                .elementId(elementId)
                .currentStage(stage.getName())
                .actions(actions)
                .metadata("completion", completion)
                .metadata("failed_gates", stageResult.failedGates())
                .timestamp(now)
                .build();
    }

    private StatusResult awaiting(
            Element element,
            String elementId,
            Stage stage,
            String nextStage,
            ProgressionCheck check,
            Instant now) {
        Map<String, Object> context = Map.of("next_stage", nextStage);
        List<Action> actions = stage.resolveActions(EvaluationState.AWAITING, element, context);
        if (actions.isEmpty()) {
            actions = new ArrayList<>();
            for (String reason : check.reasons()) {
                actions.add(Action.of(ActionType.WAIT_FOR_CONDITION, reason, Priority.NORMAL));
            }
        }
        return StatusResult.builder()
                .state(EvaluationState.AWAITING)
                .elementId(elementId)
                .currentStage(stage.getName())
                .actions(actions)
                .metadata("next_stage", nextStage)
                .timestamp(now)
                .build();
    }

    private StatusResult completed(Element element, String elementId, Stage stage, Instant now) {
        Map<String, Object> context = Map.of("final_stage", stage.getName());
        List<Action> actions = stage.resolveActions(EvaluationState.COMPLETED, element, context);
        if (actions.isEmpty()) {
            actions =
                    List.of(
                            Action.of(
                                    ActionType.TRANSITION_STAGE,
                                    "Process completed successfully",
                                    Priority.NORMAL));
        }
        return StatusResult.builder()
                .state(EvaluationState.COMPLETED)
                .elementId(elementId)
                .actions(actions)
                .metadata("final_stage", stage.getName())
                .timestamp(now)
                .build();
    }

    private String fallbackId(Element element) {
        try {
            return idResolver.contentHash(element);
        } catch (RuntimeException e) {
            logger.warning("Failed to hash element contents: " + e.getMessage());
            return ElementIdResolver.UNRESOLVED_ID;
        }
    }

    private EvaluationSnapshot snapshot(Element element) {
        Set<String> passedGates = new LinkedHashSet<>();
        for (Stage stage : stages) {
            for (String gate : stage.evaluate(element, validators).passedGates()) {
                passedGates.add(EvaluationSnapshot.gateKey(stage.getName(), gate));
            }
        }
        return new EvaluationSnapshot(passedGates, EvaluationSnapshot.leafPaths(element.toMap()));
    }

    private StatusResult applyRegression(
            Element element, StatusResult result, EvaluationSnapshot current) {
        String elementId = result.getElementId();
        StatusResult regressed = applyStageRegression(element, result);

        Optional<EvaluationSnapshot> previous = historyStore.snapshot(elementId);
        if (current == null || previous.isEmpty()) {
            return regressed;
        }
        List<String> failingGates = previous.get().gatesFailingIn(current);
        List<String> lostProperties = previous.get().propertiesMissingIn(current);
        if (failingGates.isEmpty() && lostProperties.isEmpty()) {
            return regressed;
        }

        StatusResult.Builder builder = regressed.toBuilder();
        for (String gate : failingGates) {
            builder.warning("Gate '" + gate + "' was passing but now fails");
        }
        for (String property : lostProperties) {
            builder.warning("Property '" + property + "' was removed");
        }
        if (!failingGates.isEmpty()) {
            builder.metadata("regressed_gates", failingGates);
        }
        if (!lostProperties.isEmpty()) {
            builder.metadata("lost_properties", lostProperties);
        }
        logger.warning(
                "Element '"
                        + elementId
                        + "' lost "
                        + failingGates.size()
                        + " passing gates and "
                        + lostProperties.size()
                        + " properties");
        return builder.build();
    }

    private StatusResult applyStageRegression(Element element, StatusResult result) {
        String stageName = result.getCurrentStage();
        if (stageName == null) {
            return result;
        }
        Optional<String> previous = historyStore.lastStage(result.getElementId());
        if (previous.isEmpty()) {
            return result;
        }
        int currentIndex = getStageIndex(stageName);
        int previousIndex = getStageIndex(previous.get());
        if (currentIndex < 0 || previousIndex < 0 || currentIndex >= previousIndex) {
            return result;
        }

        String previousStage = previous.get();
        Stage stage = stages.get(currentIndex);
        List<Action> actions =
                new ArrayList<>(
                        stage.resolveActions(
                                EvaluationState.REGRESSING,
                                element,
                                Map.of("previous_stage", previousStage)));
        if (actions.isEmpty()) {
            actions.add(
                    Action.of(
                            ActionType.MANUAL_REVIEW,
                            "Review regression from stage '"
                                    + previousStage
                                    + "' to '"
                                    + stageName
                                    + "'",
                            Priority.HIGH));
        }
        actions.addAll(result.getActions());

        Map<String, Object> metadata = new LinkedHashMap<>(result.getMetadata());
        metadata.put("previous_stage", previousStage);
        metadata.put("evaluated_state", result.getState().value());

        logger.warning(
                "Element '"
                        + result.getElementId()
                        + "' regressed from stage '"
                        + previousStage
                        + "' to '"
                        + stageName
                        + "'");
        return result.toBuilder()
                .state(EvaluationState.REGRESSING)
                .proposedStage(stageName)
                .actions(actions)
                .warning("Element regressed from stage '" + previousStage + "' to '" + stageName + "'")
                .metadata(metadata)
                .build();
    }

    private StatusResult faultResult(String elementId, Instant now, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return StatusResult.builder()
                .state(EvaluationState.SCOPING)
                .elementId(elementId)
                .error("Evaluation error: " + message)
                .action(
                        new Action(
                                ActionType.MANUAL_REVIEW,
                                "Process evaluation failed",
                                Priority.CRITICAL,
                                List.of(),
                                Map.of("error", message)))
                .timestamp(now)
                .build();
    }

    private static String stageOf(StatusResult result) {
        if (result.getCurrentStage() != null) {
            return result.getCurrentStage();
        }
        Object finalStage = result.getMetadata().get("final_stage");
        return finalStage != null ? finalStage.toString() : null;
    }

    private static String reasonFor(StatusResult result) {
        if (result.hasErrors()) {
            return result.getErrors().get(0);
        }
        if (!result.getWarnings().isEmpty()) {
            return result.getWarnings().get(0);
        }
        return "Evaluated to " + result.getState().value();
    }

    // -- Stage navigation --

    /// Checks whether the stage order permits moving between two stages.
    ///
    /// Without skipping only the immediate successor is reachable.
    ///
    /// @param fromStage source stage name, not null
    /// @param toStage target stage name, not null
    /// @return true if both stages exist and the move is permitted
    public boolean canTransition(String fromStage, String toStage) {
        int from = getStageIndex(fromStage);
        int to = getStageIndex(toStage);
        if (from < 0 || to < 0) {
            return false;
        }
        return definition.isAllowStageSkipping() || to == from + 1;
    }

    /// Checks whether an element may move from one stage to another.
    ///
    /// @param element the record, not null
    /// @param fromStage source stage name, not null
    /// @param toStage target stage name, not null
    /// @return the verdict with every unmet condition, never null
    public ProgressionCheck validateStageProgression(
            Element element, String fromStage, String toStage) {
        List<String> reasons = new ArrayList<>();
        Optional<Stage> target = getStage(toStage);
        if (target.isEmpty()) {
            reasons.add("Stage '" + toStage + "' not found in process");
            return ProgressionCheck.deny(reasons);
        }
        if (!canTransition(fromStage, toStage)) {
            reasons.add("Direct transition from '" + fromStage + "' to '" + toStage + "' not allowed");
        }
        if (!target.get().isCompatibleWithElement(element)) {
            reasons.add("Element does not meet requirements for stage '" + toStage + "'");
        }
        return reasons.isEmpty() ? ProgressionCheck.allow() : ProgressionCheck.deny(reasons);
    }

    public Optional<Stage> getStage(String stageName) {
        Integer index = stageIndex.get(stageName);
        return index == null ? Optional.empty() : Optional.of(stages.get(index));
    }

    /// Returns a stage or fails with a checked exception.
    ///
    /// @param stageName stage name, not null
    /// @return the stage, never null
    /// @throws StageNotFoundException if the process has no such stage
    public Stage requireStage(String stageName) throws StageNotFoundException {
        return getStage(stageName).orElseThrow(() -> new StageNotFoundException(stageName));
    }

    /// @return zero-based position in evaluation order, or -1 if unknown
    public int getStageIndex(String stageName) {
        Integer index = stageName == null ? null : stageIndex.get(stageName);
        return index == null ? -1 : index;
    }

    /// @return the following stage's name, empty for the last or an unknown stage
    public Optional<String> getNextStageName(String stageName) {
        int index = getStageIndex(stageName);
        if (index < 0 || index + 1 >= stages.size()) {
            return Optional.empty();
        }
        return Optional.of(stages.get(index + 1).getName());
    }

    // -- History --

    /// Derives the history key for an element.
    ///
    /// @param element the record, not null
    /// @return id property value or stable content hash, never null
    public String getElementId(Element element) {
        return idResolver.resolve(element);
    }

    /// @return snapshot of the element's history, empty if none is recorded
    public Optional<ElementHistory> getHistory(String elementId) {
        return historyStore.get(elementId);
    }

    public Optional<ElementHistory> getHistory(Element element) {
        return historyStore.get(getElementId(element));
    }

    /// @return ids with recorded history, in first-seen order
    public List<String> getTrackedElementIds() {
        return historyStore.elementIds();
    }

    /// @return true if a history was removed
    public boolean clearHistory(String elementId) {
        return historyStore.clear(elementId);
    }

    /// @return number of histories removed
    public int clearAllHistory() {
        int removed = historyStore.clearAll();
        logger.info("Cleared " + removed + " element histories in process '" + getName() + "'");
        return removed;
    }

    // -- Accessors --

    public String getName() {
        return definition.getName();
    }

    public String getDescription() {
        return definition.getDescription();
    }

    /// @return stages in evaluation order
    public List<Stage> getStages() {
        return stages;
    }

    public List<String> getStageNames() {
        return stages.stream().map(Stage::getName).toList();
    }

    public ProcessDefinition getDefinition() {
        return definition;
    }

    public boolean isAllowStageSkipping() {
        return definition.isAllowStageSkipping();
    }

    public boolean isRegressionDetection() {
        return definition.isRegressionDetection();
    }

    public ValidatorRegistry getValidators() {
        return validators;
    }

    public StageFlowConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "Process{name='" + getName() + "', stages=" + getStageNames() + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProcessDefinition definition;
        private ValidatorRegistry validators;
        private StageFlowConfig config;
        private Clock clock;

        private Builder() {}

        public Builder definition(ProcessDefinition definition) {
            this.definition = definition;
            return this;
        }

        public Builder validators(ValidatorRegistry validators) {
            this.validators = validators;
            return this;
        }

        public Builder config(StageFlowConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the clock used for result and history timestamps.
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Process build() {
            return new Process(this);
        }
    }
}
