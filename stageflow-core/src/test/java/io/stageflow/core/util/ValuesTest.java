package io.stageflow.core.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValuesTest {

    @Nested
    class ToDoubleTest {

        @Test
        void shouldCoerceNumbersAndNumericStrings() {
            assertThat(Values.toDouble(3).getAsDouble()).isEqualTo(3.0);
            assertThat(Values.toDouble(2.5f).getAsDouble()).isEqualTo(2.5);
            assertThat(Values.toDouble(" 42.5 ").getAsDouble()).isEqualTo(42.5);
            assertThat(Values.toDouble(true).getAsDouble()).isEqualTo(1.0);
        }

        @Test
        void shouldReturnEmptyForNonNumericValues() {
            assertThat(Values.toDouble("abc")).isEmpty();
            assertThat(Values.toDouble(List.of(1))).isEmpty();
            assertThat(Values.toDouble(null)).isEmpty();
        }
    }

    @Nested
    class ValueEqualsTest {

        @Test
        void shouldCompareNumbersAcrossTypes() {
            assertThat(Values.valueEquals(1, 1L)).isTrue();
            assertThat(Values.valueEquals(1, 1.0)).isTrue();
            assertThat(Values.valueEquals(Long.MAX_VALUE, Long.MAX_VALUE - 1)).isFalse();
        }

        @Test
        void shouldUsePlainEqualityOtherwise() {
            assertThat(Values.valueEquals("a", "a")).isTrue();
            assertThat(Values.valueEquals("1", 1)).isFalse();
            assertThat(Values.valueEquals(null, null)).isTrue();
            assertThat(Values.valueEquals(null, "a")).isFalse();
        }

        @Test
        void shouldNeverEqualNaN() {
            Double nan = Double.NaN;

            assertThat(Values.valueEquals(nan, nan)).isFalse();
            assertThat(Values.valueEquals(Double.NaN, Double.NaN)).isFalse();
            assertThat(Values.valueEquals(Float.NaN, 1)).isFalse();
            assertThat(Values.containsValue(List.of(Double.NaN), Double.NaN)).isFalse();
        }

        @Test
        void shouldTreatSignedZerosAsEqual() {
            assertThat(Values.valueEquals(0.0, -0.0)).isTrue();
            assertThat(Values.valueEquals(0, -0.0)).isTrue();
        }

        @Test
        void shouldCompareCollectionsByNumericValue() {
            assertThat(Values.valueEquals(List.of(1), List.of(1.0))).isTrue();
            assertThat(Values.valueEquals(List.of(1, List.of(2L)), List.of(1.0, List.of(2)))).isTrue();
            assertThat(Values.valueEquals(Map.of("a", 1), Map.of("a", 1.0))).isTrue();
            assertThat(Values.valueEquals(List.of(1), List.of(1, 2))).isFalse();
            assertThat(Values.valueEquals(Map.of("a", 1), Map.of("b", 1))).isFalse();
            assertThat(Values.valueEquals(List.of("1"), List.of(1))).isFalse();
        }

        @Test
        void shouldFindNumericMemberInCollection() {
            assertThat(Values.containsValue(List.of(1.0, 2.0), 2)).isTrue();
            assertThat(Values.containsValue(null, 2)).isFalse();
        }
    }

    @Test
    void shouldMeasureLengthOfSizedValues() {
        assertThat(Values.lengthOf("abc").getAsInt()).isEqualTo(3);
        assertThat(Values.lengthOf(List.of(1, 2)).getAsInt()).isEqualTo(2);
        assertThat(Values.lengthOf(Map.of("a", 1)).getAsInt()).isEqualTo(1);
        assertThat(Values.lengthOf(42)).isEmpty();
    }
}
