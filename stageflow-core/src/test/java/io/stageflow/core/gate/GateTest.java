package io.stageflow.core.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stageflow.core.element.DictElement;
import io.stageflow.core.element.Element;
import io.stageflow.core.validator.DefaultValidatorRegistry;
import io.stageflow.core.validator.ValidatorRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GateTest {

    private ValidatorRegistry validators;

    @BeforeEach
    void setUp() {
        validators = new DefaultValidatorRegistry();
    }

    @Nested
    class EvaluationTest {

        @Test
        void shouldPassWhenAllLocksPass() {
            // Given
            Gate gate = Gate.allOf("g", Lock.exists("a"), Lock.exists("b"));

            // When
            GateResult result = gate.evaluate(element("a", 1, "b", 2), validators);

            // Then
            assertThat(result.passed()).isTrue();
            assertThat(result.gateName()).isEqualTo("g");
            assertThat(result.passedComponents()).hasSize(2);
            assertThat(result.failedComponents()).isEmpty();
            assertThat(result.messages()).isEmpty();
            assertThat(result.shortCircuited()).isFalse();
            assertThat(result.passRatio()).isEqualTo(1.0);
        }

        @Test
        void shouldNotReportShortCircuitWhenLastComponentFails() {
            // Given
            Gate gate = Gate.allOf("g", Lock.exists("a"), Lock.exists("b"));

            // When
            GateResult result = gate.evaluate(element("a", 1), validators);

            // Then
            assertThat(result.passed()).isFalse();
            assertThat(result.passedComponents()).containsExactly(Lock.exists("a"));
            assertThat(result.failedComponents()).containsExactly(Lock.exists("b"));
            assertThat(result.shortCircuited()).isFalse();
            assertThat(result.evaluatedCount()).isEqualTo(2);
            assertThat(result.totalComponents()).isEqualTo(2);
            assertThat(result.messages())
                    .containsExactly("Property 'b' is required but missing or empty");
            assertThat(result.actions()).containsExactly("Set missing field: b");
        }

        @Test
        void shouldStopAtFirstFailure() {
            // Given
            Gate gate =
                    Gate.allOf("g", Lock.exists("a"), Lock.exists("b"), Lock.exists("c"));

            // When
            GateResult result = gate.evaluate(element("a", 1, "c", 3), validators);

            // Then
            assertThat(result.passed()).isFalse();
            assertThat(result.shortCircuited()).isTrue();
            assertThat(result.evaluatedCount()).isEqualTo(2);
            assertThat(result.componentResults()).hasSize(2);
            assertThat(result.passRatio()).isEqualTo(1.0 / 3);
        }

        @Test
        void shouldEvaluateNestedGates() {
            // Given
            Gate inner = Gate.allOf("contact", Lock.exists("email"), Lock.exists("phone"));
            Gate outer = Gate.allOf("profile", Lock.exists("name"), inner);

            // When
            GateResult result = outer.evaluate(element("name", "Ada", "email", "a@b.c"), validators);

            // Then
            assertThat(result.passed()).isFalse();
            assertThat(result.failedComponents()).containsExactly(inner);
            assertThat(result.componentResults().get(1)).isInstanceOf(GateResult.class);
            GateResult nested = (GateResult) result.componentResults().get(1);
            assertThat(nested.gateName()).isEqualTo("contact");
            assertThat(result.messages())
                    .containsExactly("Property 'phone' is required but missing or empty");
        }

        @Test
        void shouldKeepPassedConsistentWithFailedComponents() {
            // Given
            Gate gate = Gate.allOf("g", Lock.greaterThan("score", 10), Lock.exists("b"));

            // When
            GateResult failing = gate.evaluate(element("score", 5), validators);
            GateResult passing = gate.evaluate(element("score", 50, "b", true), validators);

            // Then
            assertThat(failing.passed()).isEqualTo(failing.failedComponents().isEmpty());
            assertThat(passing.passed()).isEqualTo(passing.failedComponents().isEmpty());
        }
    }

    @Nested
    class ConstructionTest {

        @Test
        void shouldRejectEmptyName() {
            assertThatThrownBy(() -> Gate.allOf(" ", Lock.exists("a")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Gate name cannot be empty");
        }

        @Test
        void shouldRejectGateWithoutComponents() {
            assertThatThrownBy(() -> Gate.builder().name("empty").build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Gate 'empty' must have at least one component");
        }

        @Test
        void shouldRejectGateContainingItself() {
            // Given
            Gate inner = Gate.allOf("loop", Lock.exists("a"));

            // Then
            assertThatThrownBy(() -> Gate.allOf("loop", inner))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Gate 'loop' cannot contain itself");
        }

        @Test
        void shouldAllowSiblingGatesWithSameName() {
            // Given
            Gate first = Gate.allOf("part", Lock.exists("a"));
            Gate second = Gate.allOf("part", Lock.exists("b"));

            // When
            Gate gate = Gate.allOf("outer", first, second);

            // Then
            assertThat(gate.getComponents()).containsExactly(first, second);
        }

        @Test
        void shouldStoreNonAndOperatorAsMetadata() {
            // When
            Gate gate =
                    Gate.builder()
                            .name("legacy")
                            .operator("OR")
                            .component(Lock.exists("a"))
                            .component(Lock.exists("b"))
                            .build();

            // Then
            assertThat(gate.getMetadata()).containsEntry(Gate.LEGACY_OPERATOR_KEY, "or");
            GateResult result = gate.evaluate(element("a", 1), validators);
            assertThat(result.passed()).isFalse();
        }

        @Test
        void shouldNotRecordAndOperator() {
            // When
            Gate gate =
                    Gate.builder()
                            .name("plain")
                            .operator("and")
                            .targetStage("review")
                            .component(Lock.exists("a"))
                            .build();

            // Then
            assertThat(gate.getMetadata()).isEmpty();
            assertThat(gate.getTargetStage()).isEqualTo("review");
            assertThat(gate.getDescription()).isEmpty();
        }
    }

    @Nested
    class StructureTest {

        @Test
        void shouldComputeComplexityDepthAndPaths() {
            // Given
            Gate inner = Gate.allOf("inner", Lock.exists("b"), Lock.exists("c"));
            Gate outer = Gate.allOf("outer", Lock.exists("a"), inner, Lock.notEmpty("b"));

            // Then
            assertThat(outer.getComplexity()).isEqualTo(4);
            assertThat(outer.getDepth()).isEqualTo(2);
            assertThat(outer.maxDepth()).isEqualTo(2);
            assertThat(inner.getDepth()).isEqualTo(1);
            assertThat(outer.getPropertyPaths()).containsExactly("a", "b", "c");
        }

        @Test
        void shouldWarnAboutDepthComplexityAndDuplicates() {
            // Given
            Gate level3 = Gate.allOf("l3", Lock.exists("a"));
            Gate level2 = Gate.allOf("l2", level3);
            Gate gate = Gate.allOf("l1", level2, Lock.exists("x"), Lock.exists("x"));

            // When
            List<String> warnings = gate.validateStructure(2, 2);

            // Then
            assertThat(warnings)
                    .containsExactly(
                            "Gate 'l1' nesting depth 3 exceeds recommended maximum 2",
                            "Gate 'l1' has 3 locks, above recommended maximum 2",
                            "Gate 'l1' repeats lock exists(x, true)");
        }

        @Test
        void shouldReturnNoWarningsForSimpleGate() {
            assertThat(Gate.allOf("g", Lock.exists("a")).validateStructure()).isEmpty();
        }

        @Test
        void shouldSummarizeGate() {
            // Given
            Gate gate =
                    Gate.allOf(
                            "g",
                            Lock.exists("a"),
                            Lock.exists("b"),
                            Gate.allOf("n", Lock.exists("c")));

            // Then
            assertThat(gate.getSummary())
                    .isEqualTo("Gate 'g': 2 locks, 1 nested gate (AND), requires: a, b, c");
        }
    }

    private static Element element(Object... keyValues) {
        Map<String, Object> data = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return DictElement.of(data);
    }
}
