package io.stageflow.core.process;

import static org.assertj.core.api.Assertions.assertThat;

import io.stageflow.core.element.DictElement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ElementIdResolverTest {

    private final ElementIdResolver resolver = new ElementIdResolver(List.of("id", "meta.key"));

    @Test
    void shouldUseFirstPresentIdProperty() {
        assertThat(resolver.resolve(DictElement.of(Map.of("id", 42, "name", "Ada"))))
                .isEqualTo("42");
        assertThat(resolver.resolve(DictElement.of(Map.of("meta", Map.of("key", "k-1")))))
                .isEqualTo("k-1");
    }

    @Test
    void shouldSkipBlankIds() {
        assertThat(resolver.resolve(DictElement.of(Map.of("id", " ", "meta", Map.of("key", "k")))))
                .isEqualTo("k");
    }

    @Test
    void shouldHashContentWhenNoIdPresent() {
        // When
        String id = resolver.resolve(DictElement.of(Map.of("name", "Ada")));

        // Then
        assertThat(id).startsWith(ElementIdResolver.HASH_PREFIX);
        assertThat(id).hasSize(ElementIdResolver.HASH_PREFIX.length() + 16);
    }

    @Test
    void shouldHashIndependentlyOfKeyOrder() {
        // Given
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", List.of("x", 2));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", List.of("x", 2));
        second.put("a", 1);

        // Then
        assertThat(resolver.resolve(DictElement.of(first)))
                .isEqualTo(resolver.resolve(DictElement.of(second)));
    }

    @Test
    void shouldDistinguishStringsFromNumbers() {
        assertThat(resolver.resolve(DictElement.of(Map.of("v", "1"))))
                .isNotEqualTo(resolver.resolve(DictElement.of(Map.of("v", 1))));
    }

    @Test
    void shouldWriteCanonicalForm() {
        // Given
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("z", List.of(1, "two"));
        data.put("a", true);

        // Then
        assertThat(ElementIdResolver.canonical(data)).isEqualTo("{\"a\":true,\"z\":[1,\"two\"]}");
    }
}
