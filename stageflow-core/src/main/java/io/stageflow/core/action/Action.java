package io.stageflow.core.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A remedial step the caller should take to move an element forward.
///
/// Produced either from a stage's action templates or synthesized from
/// failing gates, unmet progression conditions and evaluation faults.
///
/// @param type action category, not null
/// @param description human-readable instruction, not null
/// @param priority urgency, not null
/// @param conditions conditions the action depends on, never null
/// @param metadata free-form annotations, never null
public record Action(
        ActionType type,
        String description,
        Priority priority,
        List<String> conditions,
        Map<String, Object> metadata) {

    public Action {
        Objects.requireNonNull(type, "Action type required");
        Objects.requireNonNull(description, "Description required");
        Objects.requireNonNull(priority, "Priority required");
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        metadata =
                metadata == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /// Creates an action without conditions or metadata.
    ///
    /// @param type action category, not null
    /// @param description instruction text, not null
    /// @param priority urgency, not null
    /// @return new action, never null
    public static Action of(ActionType type, String description, Priority priority) {
        return new Action(type, description, priority, List.of(), Map.of());
    }

    /// Converts this action into a plain nested map.
    ///
    /// @return insertion-ordered map with wire names for enums, never null
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.value());
        map.put("description", description);
        map.put("priority", priority.value());
        map.put("conditions", conditions);
        map.put("metadata", metadata);
        return map;
    }
}
