package io.stageflow.core.element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Map-backed {@link Element}.
///
/// The source map is deep-copied on construction, so later changes by the
/// caller are not visible to an evaluation in progress. Nested maps, lists and
/// sets are copied into unmodifiable containers; `null` values are preserved.
///
/// @implNote Immutable and thread-safe after construction.
public final class DictElement implements Element {

    private final Map<String, Object> data;

    private DictElement(Map<String, Object> data) {
        this.data = data;
    }

    /// Wraps a map as an element.
    ///
    /// @param data record data, not null
    /// @return new element, never null
    @SuppressWarnings("unchecked")
    public static DictElement of(Map<String, ?> data) {
        Objects.requireNonNull(data, "Element data required");
        return new DictElement((Map<String, Object>) deepCopy(data));
    }

    @Override
    public PropertyLookup lookup(PropertyPath path) {
        Objects.requireNonNull(path, "path must not be null");
        return path.resolve(data);
    }

    @Override
    public Map<String, Object> toMap() {
        return data;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(v -> copy.add(deepCopy(v)));
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(deepCopy(v)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object v : array) {
                copy.add(deepCopy(v));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictElement that)) return false;
        return data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return "DictElement" + data;
    }
}
