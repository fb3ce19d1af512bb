package io.stageflow.core.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.stageflow.core.StageFlowConfig;
import io.stageflow.core.action.Action;
import io.stageflow.core.action.ActionType;
import io.stageflow.core.action.Priority;
import io.stageflow.core.element.DictElement;
import io.stageflow.core.element.Element;
import io.stageflow.core.element.PropertyLookup;
import io.stageflow.core.element.PropertyPath;
import io.stageflow.core.gate.Gate;
import io.stageflow.core.gate.Lock;
import io.stageflow.core.process.validation.ProcessValidationResult;
import io.stageflow.core.schema.FieldType;
import io.stageflow.core.schema.Schema;
import io.stageflow.core.stage.ActionTemplate;
import io.stageflow.core.stage.Stage;
import io.stageflow.core.state.ElementHistory;
import io.stageflow.core.state.EvaluationState;
import io.stageflow.core.state.StateTransition;
import io.stageflow.core.validator.CustomValidator;
import io.stageflow.core.validator.DefaultValidatorRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ProcessTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private Process process;

    @BeforeEach
    void setUp() {
        process = twoStageProcess(false, false);
    }

    @Nested
    class EvaluateTest {

        @Test
        void shouldAwaitWhenNextStageRequirementsAreMissing() {
            // Given
            Element element = element("id", "e-1", "email", "ada@example.com");

            // When
            StatusResult result = process.evaluate(element);

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.AWAITING);
            assertThat(result.getCurrentStage()).isEqualTo("S1");
            assertThat(result.getProposedStage()).isEqualTo("S1");
            assertThat(result.getMetadata()).containsEntry("next_stage", "S2");
            assertThat(result.getActions())
                    .extracting(Action::type)
                    .containsOnly(ActionType.WAIT_FOR_CONDITION);
            assertThat(result.getActions())
                    .extracting(Action::description)
                    .contains("Element does not meet requirements for stage 'S2'");
            assertThat(result.getElementId()).isEqualTo("e-1");
            assertThat(result.getTimestamp()).isEqualTo(NOW);
        }

        @Test
        void shouldCompleteWhenAllStagesPass() {
            // Given
            Element element =
                    element("id", "e-1", "email", "ada@example.com", "approved", true);

            // When
            StatusResult result = process.evaluate(element);

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.COMPLETED);
            assertThat(result.getCurrentStage()).isNull();
            assertThat(result.getProposedStage()).isNull();
            assertThat(result.isTerminal()).isTrue();
            assertThat(result.getMetadata()).containsEntry("final_stage", "S2");
            assertThat(result.getActions())
                    .extracting(Action::description)
                    .containsExactly("Process completed successfully");
        }

        @Test
        void shouldReportFulfillingWithGateHints() {
            // Given
            Element element = element("id", "e-1", "email", "ada@example.com", "approved", false);

            // When
            StatusResult result = process.evaluate(element, "S2");

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.FULFILLING);
            assertThat(result.getCurrentStage()).isEqualTo("S2");
            assertThat(result.getMetadata())
                    .containsEntry("completion", 0.5)
                    .containsEntry("failed_gates", List.of("approval"));
            assertThat(result.getActions())
                    .extracting(Action::type, Action::description)
                    .containsExactly(tuple(ActionType.COMPLETE_FIELD, "Set approved to 'true'"));
        }

        @Test
        void shouldReportSchemaErrorsAsValidateDataActions() {
            // Given
            Element element = element("id", "e-1", "approved", "yes");

            // When
            StatusResult result = process.evaluate(element, "S2");

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.FULFILLING);
            assertThat(result.getActions())
                    .extracting(Action::type)
                    .contains(ActionType.VALIDATE_DATA);
        }

        @Test
        void shouldReturnScopingForUnknownCurrentStage() {
            // When
            StatusResult result = process.evaluate(element("id", "e-1"), "missing");

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.SCOPING);
            assertThat(result.getErrors()).containsExactly("Stage 'missing' not found in process");
            assertThat(result.getActions().get(0).type()).isEqualTo(ActionType.MANUAL_REVIEW);
            assertThat(result.getActions().get(0).priority()).isEqualTo(Priority.HIGH);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  "})
        void shouldScopeWhenCurrentStageNameIsBlank(String stageName) {
            // When
            StatusResult result =
                    process.evaluate(element("id", "e-1", "email", "ada@example.com"), stageName);

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.AWAITING);
            assertThat(result.getCurrentStage()).isEqualTo("S1");
            assertThat(result.getErrors()).isEmpty();
        }

        @Test
        void shouldReturnScopingWhenNoStageIsCompatible() {
            // Given
            Process strict =
                    Process.builder()
                            .definition(
                                    ProcessDefinition.builder()
                                            .name("strict")
                                            .stage(
                                                    Stage.builder("only")
                                                            .schema(
                                                                    Schema.builder("only")
                                                                            .required("email")
                                                                            .build())
                                                            .build())
                                            .build())
                            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                            .build();

            // When
            StatusResult result = strict.evaluate(element("id", "e-1"));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.SCOPING);
            assertThat(result.getErrors())
                    .containsExactly("Element lacks required properties for any stage");
            assertThat(result.getActions().get(0).type()).isEqualTo(ActionType.COMPLETE_FIELD);
        }

        @Test
        void shouldScopeToStageWithHighestCompletion() {
            // Given
            Process open =
                    Process.builder()
                            .definition(
                                    ProcessDefinition.builder()
                                            .name("open")
                                            .stage(
                                                    Stage.builder("first")
                                                            .gate(Gate.allOf("g1", Lock.exists("x")))
                                                            .build())
                                            .stage(
                                                    Stage.builder("second")
                                                            .gate(Gate.allOf("g2", Lock.exists("y")))
                                                            .build())
                                            .build())
                            .build();

            // When
            StatusResult result = open.evaluate(element("y", 1));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.COMPLETED);
            assertThat(result.getMetadata()).containsEntry("final_stage", "second");
        }

        @Test
        void shouldConvertEvaluationFaultIntoScopingResult() {
            // Given
            Element faulty = new FaultyElement(Map.of("id", "e-9", "email", "a@b.c"), "explode");
            Process fragile =
                    Process.builder()
                            .definition(
                                    ProcessDefinition.builder()
                                            .name("fragile")
                                            .stage(
                                                    Stage.builder("only")
                                                            .gate(
                                                                    Gate.allOf(
                                                                            "g",
                                                                            Lock.exists("explode")))
                                                            .build())
                                            .build())
                            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                            .build();

            // When
            StatusResult result = fragile.evaluate(faulty);

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.SCOPING);
            assertThat(result.getElementId()).isEqualTo("e-9");
            assertThat(result.getErrors()).containsExactly("Evaluation error: lookup failed");
            Action action = result.getActions().get(0);
            assertThat(action.type()).isEqualTo(ActionType.MANUAL_REVIEW);
            assertThat(action.priority()).isEqualTo(Priority.CRITICAL);
            assertThat(action.metadata()).containsEntry("error", "lookup failed");
        }

        @Test
        void shouldFallBackToContentHashWhenIdCannotBeRead() {
            // Given
            Map<String, Object> data = Map.of("id", "e-9", "email", "a@b.c");
            String expectedId =
                    new ElementIdResolver(List.of("id")).contentHash(DictElement.of(data));

            // When
            StatusResult first = process.evaluate(new FaultyElement(data, "id"));
            StatusResult second = process.evaluate(new FaultyElement(data, "id"));

            // Then
            assertThat(first.getElementId()).isEqualTo(expectedId).startsWith("element-");
            assertThat(second.getElementId()).isEqualTo(expectedId);
            assertThat(process.getHistory(expectedId).orElseThrow().size()).isEqualTo(2);
        }

        @Test
        void shouldBeDeterministicForUnchangedElement() {
            // Given
            Element element = element("email", "ada@example.com");

            // When
            StatusResult first = process.evaluate(element);
            StatusResult second = process.evaluate(element);

            // Then
            assertThat(second).isEqualTo(first);
        }

        @Test
        void shouldUseStageActionTemplates() {
            // Given
            Stage s1 =
                    Stage.builder("S1")
                            .gate(Gate.allOf("contact", Lock.exists("email")))
                            .actionTemplate(
                                    EvaluationState.FULFILLING,
                                    ActionTemplate.builder()
                                            .type(ActionType.EXTERNAL_ACTION)
                                            .description("Email {name}: {completion} complete")
                                            .priority(Priority.HIGH)
                                            .build())
                            .build();
            Process templated =
                    Process.fromDefinition(
                            ProcessDefinition.builder().name("t").stage(s1).build());

            // When
            StatusResult result = templated.evaluate(element("name", "Ada"), "S1");

            // Then
            assertThat(result.getActions())
                    .extracting(Action::description)
                    .containsExactly("Email Ada: 0.5 complete");
        }

        @Test
        void shouldConsultCustomValidators() {
            // Given
            DefaultValidatorRegistry validators = new DefaultValidatorRegistry();
            CustomValidator even = (value, expected) -> ((Number) value).intValue() % 2 == 0;
            validators.register("even", even);
            Process custom =
                    Process.fromDefinition(
                            ProcessDefinition.builder()
                                    .name("c")
                                    .stage(
                                            Stage.builder("only")
                                                    .gate(Gate.allOf("g", Lock.custom("n", "even")))
                                                    .build())
                                    .build(),
                            validators);

            // Then
            assertThat(custom.evaluate(element("n", 4)).getState())
                    .isEqualTo(EvaluationState.COMPLETED);
            assertThat(custom.evaluate(element("n", 3)).getState())
                    .isEqualTo(EvaluationState.FULFILLING);
        }
    }

    @Nested
    class SkippingTest {

        @Test
        void shouldAdvanceThroughAllStagesWithoutRevisiting() {
            // Given
            Process chain = chainProcess(false);

            // When
            StatusResult result = chain.evaluate(element("id", "e-1", "a", 1, "b", 2, "c", 3));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.COMPLETED);
            List<StateTransition> transitions =
                    chain.getHistory("e-1").orElseThrow().getTransitions();
            assertThat(transitions)
                    .extracting(StateTransition::toState)
                    .containsExactly(
                            EvaluationState.QUALIFYING,
                            EvaluationState.ADVANCING,
                            EvaluationState.QUALIFYING,
                            EvaluationState.ADVANCING,
                            EvaluationState.COMPLETED);
            assertThat(transitions)
                    .extracting(StateTransition::stageName)
                    .containsExactly("a", "b", "b", "c", "c");
        }

        @Test
        void shouldOnlyAllowAdjacentTransitionsWithoutSkipping() {
            // Given
            Process chain = chainProcess(false);

            // Then
            assertThat(chain.canTransition("a", "b")).isTrue();
            assertThat(chain.canTransition("a", "c")).isFalse();
            assertThat(chain.canTransition("b", "a")).isFalse();
            assertThat(chain.canTransition("a", "missing")).isFalse();
        }

        @Test
        void shouldAllowAnyKnownTransitionWithSkipping() {
            // Given
            Process chain = chainProcess(true);

            // Then
            assertThat(chain.canTransition("a", "c")).isTrue();
            assertThat(chain.canTransition("c", "a")).isTrue();
        }

        @Test
        void shouldExplainDeniedProgression() {
            // Given
            Process chain = chainProcess(false);

            // When
            ProgressionCheck skip = chain.validateStageProgression(element(), "a", "c");
            ProgressionCheck unknown = chain.validateStageProgression(element(), "a", "z");

            // Then
            assertThat(skip.allowed()).isFalse();
            assertThat(skip.reasons())
                    .containsExactly("Direct transition from 'a' to 'c' not allowed");
            assertThat(unknown.reasons()).containsExactly("Stage 'z' not found in process");
            assertThat(chain.validateStageProgression(element(), "a", "b").allowed()).isTrue();
        }
    }

    @Nested
    class HistoryTest {

        @Test
        void shouldRecordFinalStateWithReason() {
            // When
            process.evaluate(element("id", "e-1", "email", "ada@example.com"));

            // Then
            ElementHistory history = process.getHistory("e-1").orElseThrow();
            assertThat(history.getCreatedAt()).isEqualTo(NOW);
            assertThat(history.getCurrentState()).contains(EvaluationState.AWAITING);
            assertThat(history.getCurrentStage()).contains("S1");
            assertThat(history.getLastTransition().orElseThrow().reason())
                    .isEqualTo("Evaluated to awaiting");
        }

        @Test
        void shouldChainStatesAcrossEvaluations() {
            // Given
            process.evaluate(element("id", "e-1"), "S1");

            // When
            process.evaluate(element("id", "e-1", "email", "x@y.z", "approved", true));

            // Then
            List<StateTransition> transitions =
                    process.getHistory("e-1").orElseThrow().getTransitions();
            assertThat(transitions)
                    .extracting(StateTransition::fromState)
                    .containsExactly(
                            null,
                            EvaluationState.FULFILLING,
                            EvaluationState.QUALIFYING,
                            EvaluationState.ADVANCING);
        }

        @Test
        void shouldRecordErrorAsReason() {
            // When
            process.evaluate(element("id", "e-1"), "nowhere");

            // Then
            assertThat(process.getHistory("e-1").orElseThrow().getLastTransition().orElseThrow().reason())
                    .isEqualTo("Stage 'nowhere' not found in process");
        }

        @Test
        void shouldSkipHistoryWhenDisabled() {
            // Given
            Process quiet =
                    Process.builder()
                            .definition(process.getDefinition())
                            .config(StageFlowConfig.builder().historyEnabled(false).build())
                            .build();

            // When
            quiet.evaluate(element("id", "e-1"));

            // Then
            assertThat(quiet.getTrackedElementIds()).isEmpty();
        }

        @Test
        void shouldResolveHistoryByElement() {
            // Given
            Element element = element("email", "ada@example.com");

            // When
            process.evaluate(element);

            // Then
            assertThat(process.getHistory(element)).isPresent();
            assertThat(process.getElementId(element)).startsWith("element-");
        }

        @Test
        void shouldClearHistory() {
            // Given
            process.evaluate(element("id", "e-1"));
            process.evaluate(element("id", "e-2"));

            // Then
            assertThat(process.getTrackedElementIds()).containsExactly("e-1", "e-2");
            assertThat(process.clearHistory("e-1")).isTrue();
            assertThat(process.clearAllHistory()).isEqualTo(1);
            assertThat(process.getTrackedElementIds()).isEmpty();
        }
    }

    @Nested
    class RegressionTest {

        @Test
        void shouldFlagRegressionWhenEnabled() {
            // Given
            Process guarded = twoStageProcess(false, true);
            guarded.evaluate(element("id", "e-1", "email", "x@y.z", "approved", true));

            // When
            StatusResult result = guarded.evaluate(element("id", "e-1", "email", "x@y.z"));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.REGRESSING);
            assertThat(result.getCurrentStage()).isEqualTo("S1");
            assertThat(result.getProposedStage()).isEqualTo("S1");
            assertThat(result.getWarnings())
                    .containsExactly(
                            "Element regressed from stage 'S2' to 'S1'",
                            "Gate 'S2.approval' was passing but now fails",
                            "Property 'approved' was removed");
            assertThat(result.getMetadata())
                    .containsEntry("previous_stage", "S2")
                    .containsEntry("evaluated_state", "awaiting")
                    .containsEntry("regressed_gates", List.of("S2.approval"))
                    .containsEntry("lost_properties", List.of("approved"));
            assertThat(result.getActions().get(0).type()).isEqualTo(ActionType.MANUAL_REVIEW);
            assertThat(guarded.getHistory("e-1").orElseThrow().getRegressionCount()).isEqualTo(1);
        }

        @Test
        void shouldWarnWhenPreviouslyPassingGateFails() {
            // Given
            Process guarded = twoStageProcess(false, true);
            guarded.evaluate(element("id", "e-1", "email", "x@y.z", "approved", true));

            // When
            StatusResult result =
                    guarded.evaluate(element("id", "e-1", "email", "x@y.z", "approved", false));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.FULFILLING);
            assertThat(result.getCurrentStage()).isEqualTo("S2");
            assertThat(result.getWarnings())
                    .containsExactly("Gate 'S2.approval' was passing but now fails");
            assertThat(result.getMetadata())
                    .containsEntry("regressed_gates", List.of("S2.approval"))
                    .doesNotContainKey("lost_properties");
        }

        @Test
        void shouldWarnWhenPropertyIsLost() {
            // Given
            Process guarded = twoStageProcess(false, true);
            guarded.evaluate(
                    element("id", "e-1", "email", "x@y.z", "profile", Map.of("phone", "555-0100")));

            // When
            StatusResult result = guarded.evaluate(element("id", "e-1", "email", "x@y.z"));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.AWAITING);
            assertThat(result.getWarnings()).containsExactly("Property 'profile.phone' was removed");
            assertThat(result.getMetadata())
                    .containsEntry("lost_properties", List.of("profile.phone"))
                    .doesNotContainKey("regressed_gates");
        }

        @Test
        void shouldDetectRegressionByDefault() {
            // Given
            Process defaults =
                    Process.builder()
                            .definition(
                                    ProcessDefinition.builder()
                                            .name("defaults")
                                            .stages(process.getDefinition().getStages())
                                            .build())
                            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                            .build();
            defaults.evaluate(element("id", "e-1", "email", "x@y.z", "approved", true));

            // When
            StatusResult result = defaults.evaluate(element("id", "e-1", "email", "x@y.z"));

            // Then
            assertThat(defaults.isRegressionDetection()).isTrue();
            assertThat(result.getState()).isEqualTo(EvaluationState.REGRESSING);
        }

        @Test
        void shouldIgnoreRegressionWhenDisabled() {
            // Given
            process.evaluate(element("id", "e-1", "email", "x@y.z", "approved", true));

            // When
            StatusResult result = process.evaluate(element("id", "e-1", "email", "x@y.z"));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.AWAITING);
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        void shouldDetectRegressionOnExplicitCheck() {
            // Given
            process.evaluate(element("id", "e-1", "email", "x@y.z", "approved", true));

            // When
            StatusResult result = process.checkRegression(element("id", "e-1", "email", "x@y.z"));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.REGRESSING);
        }

        @Test
        void shouldNotFlagForwardProgress() {
            // Given
            process.evaluate(element("id", "e-1", "email", "x@y.z"));

            // When
            StatusResult result =
                    process.checkRegression(element("id", "e-1", "email", "x@y.z", "approved", true));

            // Then
            assertThat(result.getState()).isEqualTo(EvaluationState.COMPLETED);
        }
    }

    @Nested
    class BatchTest {

        private ExecutorService executor;

        @BeforeEach
        void setUp() {
            executor = Executors.newFixedThreadPool(4);
        }

        @AfterEach
        void tearDown() {
            executor.shutdownNow();
        }

        @Test
        void shouldEvaluateInInputOrder() {
            // Given
            List<Element> elements =
                    List.of(
                            element("id", "a", "email", "x@y.z"),
                            element("id", "b"),
                            element("id", "c", "email", "x@y.z", "approved", true));

            // When
            List<StatusResult> sequential = process.evaluateBatch(elements);
            List<StatusResult> parallel = process.evaluateBatch(elements, executor);

            // Then
            assertThat(sequential)
                    .extracting(StatusResult::getState)
                    .containsExactly(
                            EvaluationState.AWAITING,
                            EvaluationState.FULFILLING,
                            EvaluationState.COMPLETED);
            assertThat(parallel).isEqualTo(sequential);
        }
    }

    @Nested
    class ValidationTest {

        @Test
        void shouldReportCleanDefinition() {
            assertThat(process.validate().isClean()).isTrue();
        }

        @Test
        void shouldReportUnknownGateTarget() {
            // Given
            Stage s1 =
                    Stage.builder("S1")
                            .gate(
                                    Gate.builder()
                                            .name("contact")
                                            .component(Lock.exists("email"))
                                            .targetStage("S9")
                                            .build())
                            .build();
            Process broken =
                    Process.fromDefinition(
                            ProcessDefinition.builder()
                                    .name("broken")
                                    .stage(s1)
                                    .stage(Stage.builder("S2").gate(Gate.allOf("g", Lock.exists("x"))).build())
                                    .build());

            // When
            ProcessValidationResult result = broken.validate();

            // Then
            assertThat(result.hasErrors()).isTrue();
            assertThat(result.codes()).contains("UNKNOWN_TARGET_STAGE", "UNREACHABLE_STAGE", "DEAD_END_STAGE");
        }
    }

    @Nested
    class NavigationTest {

        @Test
        void shouldNavigateStages() throws StageNotFoundException {
            assertThat(process.getStageNames()).containsExactly("S1", "S2");
            assertThat(process.getStageIndex("S2")).isEqualTo(1);
            assertThat(process.getStageIndex("nope")).isEqualTo(-1);
            assertThat(process.getNextStageName("S1")).contains("S2");
            assertThat(process.getNextStageName("S2")).isEmpty();
            assertThat(process.requireStage("S1").getName()).isEqualTo("S1");
        }

        @Test
        void shouldThrowForUnknownRequiredStage() {
            assertThatThrownBy(() -> process.requireStage("nope"))
                    .isInstanceOf(StageNotFoundException.class)
                    .hasMessage("Stage 'nope' not found in process")
                    .extracting(e -> ((StageNotFoundException) e).getStageName())
                    .isEqualTo("nope");
        }
    }

    private static Process twoStageProcess(boolean skipping, boolean regression) {
        Stage s1 = Stage.builder("S1").gate(Gate.allOf("contact", Lock.exists("email"))).build();
        Stage s2 =
                Stage.builder("S2")
                        .schema(
                                Schema.builder("S2")
                                        .required("approved")
                                        .type("approved", FieldType.BOOLEAN)
                                        .build())
                        .gate(Gate.allOf("approval", Lock.equalTo("approved", true)))
                        .build();
        return Process.builder()
                .definition(
                        ProcessDefinition.builder()
                                .name("onboarding")
                                .stage(s1)
                                .stage(s2)
                                .allowStageSkipping(skipping)
                                .regressionDetection(regression)
                                .build())
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private static Process chainProcess(boolean skipping) {
        return Process.builder()
                .definition(
                        ProcessDefinition.builder()
                                .name("chain")
                                .stage(Stage.builder("a").gate(Gate.allOf("ga", Lock.exists("a"))).build())
                                .stage(Stage.builder("b").gate(Gate.allOf("gb", Lock.exists("b"))).build())
                                .stage(Stage.builder("c").gate(Gate.allOf("gc", Lock.exists("c"))).build())
                                .allowStageSkipping(skipping)
                                .build())
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private static Element element(Object... keyValues) {
        Map<String, Object> data = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return DictElement.of(data);
    }

    /// Element that fails when one specific property is read.
    private static final class FaultyElement implements Element {
        private final DictElement delegate;
        private final String failingKey;

        FaultyElement(Map<String, Object> data, String failingKey) {
            this.delegate = DictElement.of(data);
            this.failingKey = failingKey;
        }

        @Override
        public PropertyLookup lookup(PropertyPath path) {
            if (path.getSegments().get(0).key().equals(failingKey)) {
                throw new IllegalStateException("lookup failed");
            }
            return delegate.lookup(path);
        }

        @Override
        public Map<String, Object> toMap() {
            return delegate.toMap();
        }
    }
}
