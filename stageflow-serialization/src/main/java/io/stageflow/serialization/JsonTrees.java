package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Tree-reading helpers shared by the deserializers.
final class JsonTrees {

    static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private JsonTrees() {}

    static String textOrNull(JsonNode root, String field) {
        return root.hasNonNull(field) ? root.get(field).asText() : null;
    }

    static boolean booleanOr(JsonNode root, String field, boolean fallback) {
        return root.hasNonNull(field) ? root.get(field).asBoolean() : fallback;
    }

    /// Converts a subtree into plain Java values (maps, lists, numbers, strings, booleans).
    static Object plainValue(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return mapper.convertValue(node, Object.class);
    }

    static Map<String, Object> objectMap(ObjectMapper mapper, JsonNode root, String field) {
        if (!root.hasNonNull(field)) {
            return new LinkedHashMap<>();
        }
        return mapper.convertValue(root.get(field), OBJECT_MAP);
    }

    static List<String> stringList(ObjectMapper mapper, JsonNode root, String field) {
        if (!root.hasNonNull(field)) {
            return new ArrayList<>();
        }
        return mapper.convertValue(root.get(field), STRING_LIST);
    }

    static Map<String, String> stringMap(ObjectMapper mapper, JsonNode root, String field) {
        if (!root.hasNonNull(field)) {
            return new LinkedHashMap<>();
        }
        return mapper.convertValue(root.get(field), STRING_MAP);
    }

    /// Reads a collection given either as an array or as a name-keyed object.
    ///
    /// For the keyed form each entry's key is copied into its `name` field
    /// unless the entry already declares one.
    static List<JsonNode> namedEntries(JsonParser p, JsonNode root, String field)
            throws JsonMappingException {
        List<JsonNode> entries = new ArrayList<>();
        if (!root.hasNonNull(field)) {
            return entries;
        }
        JsonNode node = root.get(field);
        if (node.isArray()) {
            node.forEach(entries::add);
        } else if (node.isObject()) {
            node.fields()
                    .forEachRemaining(
                            e -> {
                                JsonNode value = e.getValue();
                                if (value.isObject() && !value.has("name")) {
                                    ObjectNode named = value.deepCopy();
                                    named.put("name", e.getKey());
                                    value = named;
                                }
                                entries.add(value);
                            });
        } else {
            throw new JsonMappingException(p, "'" + field + "' must be an array or an object");
        }
        return entries;
    }
}
