package io.stageflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stageflow.core.gate.Gate;
import io.stageflow.core.gate.GateComponent;
import io.stageflow.core.gate.Lock;
import io.stageflow.core.gate.LockType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class GateComponentDeserializerTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = ProcessSerializer.createMapper();
    }

    @Nested
    class LockFormatTest {

        @Test
        void shouldReadCanonicalForm() throws JsonProcessingException {
            // When
            Lock lock =
                    mapper.readValue(
                            """
                            {"type": "range", "property_path": "age", "expected_value": [18, 65]}
                            """,
                            Lock.class);

            // Then
            assertThat(lock).isEqualTo(Lock.range("age", 18, 65));
        }

        @Test
        void shouldAcceptValueAlias() throws JsonProcessingException {
            // When
            Lock lock =
                    mapper.readValue(
                            """
                            {"type": "equals", "property_path": "status", "value": "ready"}
                            """,
                            Lock.class);

            // Then
            assertThat(lock).isEqualTo(Lock.equalTo("status", "ready"));
        }

        @ParameterizedTest
        @CsvSource({"exists, EXISTS, true", "is_true, EQUALS, true", "is_false, EQUALS, false"})
        void shouldReadShorthandForms(String key, LockType type, boolean expected)
                throws JsonProcessingException {
            // When
            Lock lock = mapper.readValue("{\"" + key + "\": \"flag\"}", Lock.class);

            // Then
            assertThat(lock.getType()).isEqualTo(type);
            assertThat(lock.getPropertyPath()).isEqualTo("flag");
            assertThat(lock.getExpectedValue()).isEqualTo(expected);
        }

        @Test
        void shouldReadStructuredForm() throws JsonProcessingException {
            // When
            Lock lock =
                    mapper.readValue(
                            """
                            {"greater_than": {"property_path": "score", "expected_value": 10}}
                            """,
                            Lock.class);

            // Then
            assertThat(lock).isEqualTo(Lock.greaterThan("score", 10));
        }

        @Test
        void shouldReadCustomLockWithValidatorName() throws JsonProcessingException {
            // When
            Lock lock =
                    mapper.readValue(
                            """
                            {"type": "custom", "property_path": "email", "validator_name": "email_format"}
                            """,
                            Lock.class);

            // Then
            assertThat(lock.getType()).isEqualTo(LockType.CUSTOM);
            assertThat(lock.getValidatorName()).isEqualTo("email_format");
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "{\"unknown\": {\"property_path\": \"x\"}}",
                    "{\"exists\": 5}",
                    "{\"property_path\": \"x\"}",
                    "\"exists\""
                })
        void shouldRejectUnrecognizedLockShapes(String json) {
            assertThatThrownBy(() -> mapper.readValue(json, Lock.class))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessageContaining("Invalid lock definition format");
        }
    }

    @Nested
    class GateFormatTest {

        @Test
        void shouldReadNestedGate() throws JsonProcessingException {
            // When
            Gate gate =
                    mapper.readValue(
                            """
                            {
                              "name": "profile",
                              "components": [
                                {"exists": "name"},
                                {"name": "contact", "locks": [{"exists": "email"}]}
                              ]
                            }
                            """,
                            Gate.class);

            // Then
            assertThat(gate.getName()).isEqualTo("profile");
            assertThat(gate.getComponents()).hasSize(2);
            assertThat(gate.getComponents().get(1)).isInstanceOf(Gate.class);
            assertThat(gate.getPropertyPaths()).containsExactly("name", "email");
        }

        @Test
        void shouldKeepLegacyOperatorAsMetadata() throws JsonProcessingException {
            // When
            Gate gate =
                    mapper.readValue(
                            """
                            {"name": "any", "logic": "OR", "locks": [{"exists": "a"}]}
                            """,
                            Gate.class);

            // Then
            assertThat(gate.getMetadata()).containsEntry(Gate.LEGACY_OPERATOR_KEY, "or");
        }

        @Test
        void shouldDispatchComponentsByShape() throws JsonProcessingException {
            // When
            List<GateComponent> components =
                    List.of(
                            mapper.readValue("{\"exists\": \"a\"}", GateComponent.class),
                            mapper.readValue(
                                    "{\"name\": \"g\", \"locks\": [{\"exists\": \"a\"}]}",
                                    GateComponent.class));

            // Then
            assertThat(components.get(0)).isInstanceOf(Lock.class);
            assertThat(components.get(1)).isInstanceOf(Gate.class);
        }

        @Test
        void shouldRejectLockWhereGateExpected() {
            assertThatThrownBy(() -> mapper.readValue("{\"exists\": \"a\"}", Gate.class))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessageContaining("Expected Gate definition");
        }
    }
}
