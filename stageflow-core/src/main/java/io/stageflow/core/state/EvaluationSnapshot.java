package io.stageflow.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// What an element satisfied at its latest evaluation: the gates it passed
/// across every stage and the property paths it carried.
///
/// Gate entries are qualified as `stage.gate`. Property paths are the dotted
/// leaf paths of the element's nested maps; lists count as leaves.
///
/// @param passedGates qualified names of passing gates, in stage order
/// @param propertyPaths leaf property paths, in element order
public record EvaluationSnapshot(Set<String> passedGates, Set<String> propertyPaths) {

    public EvaluationSnapshot {
        passedGates = Collections.unmodifiableSet(new LinkedHashSet<>(passedGates));
        propertyPaths = Collections.unmodifiableSet(new LinkedHashSet<>(propertyPaths));
    }

    /// Qualifies a gate name with its stage.
    public static String gateKey(String stageName, String gateName) {
        return stageName + "." + gateName;
    }

    /// Collects the leaf paths of a nested map.
    ///
    /// @param data element contents, not null
    /// @return dotted paths in iteration order, never null
    public static Set<String> leafPaths(Map<String, Object> data) {
        Set<String> paths = new LinkedHashSet<>();
        collect("", data, paths);
        return paths;
    }

    /// Returns gates that passed in this snapshot but not in a later one.
    ///
    /// @param later the newer snapshot, not null
    /// @return qualified gate names, in this snapshot's order
    public List<String> gatesFailingIn(EvaluationSnapshot later) {
        List<String> lost = new ArrayList<>();
        for (String gate : passedGates) {
            if (!later.passedGates.contains(gate)) {
                lost.add(gate);
            }
        }
        return lost;
    }

    /// Returns paths present in this snapshot that a later one no longer carries.
    ///
    /// A path that became the parent of nested values still counts as present.
    ///
    /// @param later the newer snapshot, not null
    /// @return lost paths, in this snapshot's order
    public List<String> propertiesMissingIn(EvaluationSnapshot later) {
        List<String> lost = new ArrayList<>();
        for (String path : propertyPaths) {
            if (later.propertyPaths.contains(path)) {
                continue;
            }
            String prefix = path + ".";
            if (later.propertyPaths.stream().noneMatch(p -> p.startsWith(prefix))) {
                lost.add(path);
            }
        }
        return lost;
    }

    @SuppressWarnings("unchecked")
    private static void collect(String prefix, Map<String, Object> data, Set<String> paths) {
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
                collect(path, (Map<String, Object>) nested, paths);
            } else {
                paths.add(path);
            }
        }
    }
}
