package io.stageflow.core.element;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DictElementTest {

    private Map<String, Object> source;
    private DictElement element;

    @BeforeEach
    void setUp() {
        source = new HashMap<>();
        source.put("email", "ada@example.com");
        source.put("nickname", null);
        source.put("tags", new ArrayList<>(List.of("vip")));
        source.put("address", new HashMap<>(Map.of("city", "Paris")));
        element = DictElement.of(source);
    }

    @Nested
    class LookupTest {

        @Test
        void shouldReturnPropertyValue() {
            assertThat(element.getProperty("email")).isEqualTo("ada@example.com");
            assertThat(element.getProperty("address.city")).isEqualTo("Paris");
            assertThat(element.getProperty("tags[0]")).isEqualTo("vip");
        }

        @Test
        void shouldDistinguishExplicitNullFromMissing() {
            // When
            PropertyLookup present = element.lookup("nickname");
            PropertyLookup missing = element.lookup("surname");

            // Then
            assertThat(present.found()).isTrue();
            assertThat(present.value()).isNull();
            assertThat(missing.found()).isFalse();
            assertThat(element.hasProperty("nickname")).isTrue();
            assertThat(element.hasProperty("surname")).isFalse();
        }

        @Test
        void shouldTreatMalformedPathAsNotFound() {
            assertThat(element.lookup("address..city").found()).isFalse();
            assertThat(element.getProperty("tags[")).isNull();
            assertThat(element.hasProperty("")).isFalse();
        }
    }

    @Nested
    class ImmutabilityTest {

        @Test
        void shouldNotSeeLaterChangesToSource() {
            // When
            source.put("email", "changed@example.com");
            @SuppressWarnings("unchecked")
            Map<String, Object> address = (Map<String, Object>) source.get("address");
            address.put("city", "Lyon");

            // Then
            assertThat(element.getProperty("email")).isEqualTo("ada@example.com");
            assertThat(element.getProperty("address.city")).isEqualTo("Paris");
        }

        @Test
        void shouldExposeUnmodifiableData() {
            // Given
            Map<String, Object> data = element.toMap();

            // Then
            assertThatThrownBy(() -> data.put("x", 1))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> ((List<?>) data.get("tags")).clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    void shouldBeEqualForEqualData() {
        // Given
        DictElement other = DictElement.of(new HashMap<>(source));

        // Then
        assertThat(other).isEqualTo(element);
        assertThat(other.hashCode()).isEqualTo(element.hashCode());
    }

    @Test
    void shouldRejectNullData() {
        assertThatThrownBy(() -> DictElement.of(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("Element data required");
    }
}
