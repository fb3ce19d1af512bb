package io.stageflow.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stageflow.core.element.DictElement;
import io.stageflow.core.element.Element;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SchemaTest {

    @Nested
    class ConstructionTest {

        @Test
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> Schema.builder(" ").build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Schema must have a name");
        }

        @Test
        void shouldRejectFieldBothRequiredAndOptional() {
            assertThatThrownBy(() -> Schema.builder("s").required("email").optional("email").build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Fields cannot be both required and optional");
        }

        @Test
        void shouldRejectDefaultForRequiredField() {
            assertThatThrownBy(
                            () ->
                                    Schema.builder("s")
                                            .required("email")
                                            .defaultValue("email", "x@y.z")
                                            .build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Default values provided for non-optional fields");
        }

        @Test
        void shouldRejectMalformedFieldPath() {
            assertThatThrownBy(() -> Schema.builder("s").required("items[").build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldExposeFieldsInDeclarationOrder() {
            // When
            Schema schema =
                    Schema.builder("profile")
                            .required("name", "email")
                            .optional("phone")
                            .type("name", FieldType.STRING)
                            .build();

            // Then
            assertThat(schema.getAllFields()).containsExactly("name", "email", "phone");
            assertThat(schema.isFieldRequired("email")).isTrue();
            assertThat(schema.isFieldRequired("phone")).isFalse();
            assertThat(schema.getFieldType("name")).contains(FieldType.STRING);
            assertThat(schema.getFieldType("phone")).isEmpty();
        }
    }

    @Nested
    class ValidationTest {

        @Test
        void shouldReportMissingRequiredFields() {
            // Given
            Schema schema = Schema.builder("s").required("name", "email").build();

            // When
            List<String> errors = schema.validate(DictElement.of(Map.of("name", "Ada")));

            // Then
            assertThat(errors).containsExactly("Required field missing: email");
        }

        @Test
        void shouldReportTypeMismatch() {
            // Given
            Schema schema = Schema.builder("s").type("age", FieldType.INTEGER).build();

            // When
            List<String> errors = schema.validate(DictElement.of(Map.of("age", "thirty")));

            // Then
            assertThat(errors).containsExactly("Field 'age' has invalid type: expected integer");
        }

        @Test
        void shouldIgnoreTypeOfAbsentField() {
            // Given
            Schema schema = Schema.builder("s").type("age", FieldType.INTEGER).build();

            // Then
            assertThat(schema.isValid(DictElement.of(Map.of()))).isTrue();
        }

        @Test
        void shouldApplyNumericRules() {
            // Given
            FieldRule rule = FieldRule.builder().min(18).max(65).build();
            Schema schema = Schema.builder("s").rule("age", rule).build();

            // Then
            assertThat(schema.validate(element("age", 10)))
                    .containsExactly("Field 'age' below minimum value 18");
            assertThat(schema.validate(element("age", 70)))
                    .containsExactly("Field 'age' above maximum value 65");
            assertThat(schema.validate(element("age", "old")))
                    .containsExactly(
                            "Field 'age' cannot be compared to minimum value",
                            "Field 'age' cannot be compared to maximum value");
            assertThat(schema.validate(element("age", 40))).isEmpty();
        }

        @ParameterizedTest
        @CsvSource({
            "ab, Field 'code' below minimum length 3",
            "abcdef, Field 'code' above maximum length 5",
            "12345, Field 'code' does not match required pattern"
        })
        void shouldApplyStringRules(String value, String expectedError) {
            // Given
            FieldRule rule =
                    FieldRule.builder().minLength(3).maxLength(5).pattern("[a-z]+").build();
            Schema schema = Schema.builder("s").rule("code", rule).build();

            // Then
            assertThat(schema.validate(element("code", value))).contains(expectedError);
        }

        @Test
        void shouldReportInvalidPatternAsError() {
            // Given
            Schema schema =
                    Schema.builder("s").rule("code", FieldRule.builder().pattern("[").build()).build();

            // Then
            assertThat(schema.validate(element("code", "abc")))
                    .containsExactly("Invalid pattern for field 'code'");
        }

        @Test
        void shouldApplyAllowedValues() {
            // Given
            FieldRule rule = FieldRule.builder().allowedValues(List.of("gold", "silver")).build();
            Schema schema = Schema.builder("s").rule("tier", rule).build();

            // Then
            assertThat(schema.isValid(element("tier", "gold"))).isTrue();
            assertThat(schema.validate(element("tier", "bronze")))
                    .containsExactly("Field 'tier' must be one of: [gold, silver]");
        }

        @Test
        void shouldRejectNegativeLengthRule() {
            assertThatThrownBy(() -> FieldRule.builder().minLength(-1).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("min_length cannot be negative");
        }
    }

    @Nested
    class DefaultsTest {

        @Test
        void shouldFillMissingOptionalFields() {
            // Given
            Schema schema =
                    Schema.builder("s")
                            .optional("country", "settings.locale")
                            .defaultValue("country", "NL")
                            .defaultValue("settings.locale", "nl_NL")
                            .build();

            // When
            Element result = schema.applyDefaults(element("name", "Ada"));

            // Then
            assertThat(result.lookup("country").value()).isEqualTo("NL");
            assertThat(result.lookup("settings.locale").value()).isEqualTo("nl_NL");
            assertThat(result.lookup("name").value()).isEqualTo("Ada");
        }

        @Test
        void shouldKeepPresentValues() {
            // Given
            Schema schema =
                    Schema.builder("s").optional("country").defaultValue("country", "NL").build();
            Element element = element("country", "BE");

            // When
            Element result = schema.applyDefaults(element);

            // Then
            assertThat(result).isSameAs(element);
        }
    }

    @ParameterizedTest
    @CsvSource({"string, STRING", "INTEGER, INTEGER", " object , OBJECT"})
    void shouldParseFieldTypeValues(String value, FieldType expected) {
        assertThat(FieldType.fromValue(value)).isEqualTo(expected);
    }

    @Test
    void shouldRejectUnknownFieldType() {
        assertThatThrownBy(() -> FieldType.fromValue("date"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown field type: date");
    }

    private static Element element(String key, Object value) {
        return DictElement.of(Map.of(key, value));
    }
}
