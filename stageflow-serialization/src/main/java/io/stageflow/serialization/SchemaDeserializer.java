package io.stageflow.serialization;

import static io.stageflow.serialization.JsonTrees.objectMap;
import static io.stageflow.serialization.JsonTrees.stringList;
import static io.stageflow.serialization.JsonTrees.stringMap;
import static io.stageflow.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stageflow.core.schema.FieldRule;
import io.stageflow.core.schema.FieldType;
import io.stageflow.core.schema.Schema;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Deserializes a `Schema`.
///
/// `rules` is accepted as an alias of `validation_rules`, and `allowed_values`
/// as an alias of a rule's `enum`.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see SchemaSerializer for the inverse operation
class SchemaDeserializer extends StdDeserializer<Schema> {

    @Serial private static final long serialVersionUID = 7722315408981264160L;

    private static final TypeReference<List<Object>> VALUE_LIST = new TypeReference<>() {};

    SchemaDeserializer() {
        super(Schema.class);
    }

    @Override
    public Schema deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        Schema.Builder b =
                Schema.builder(textOrNull(root, "name"))
                        .required(stringList(mapper, root, "required_fields").toArray(new String[0]))
                        .optional(stringList(mapper, root, "optional_fields").toArray(new String[0]))
                        .metadata(objectMap(mapper, root, "metadata"));

        for (Map.Entry<String, String> e : stringMap(mapper, root, "field_types").entrySet()) {
            b.type(e.getKey(), FieldType.fromValue(e.getValue()));
        }
        for (Map.Entry<String, Object> e : objectMap(mapper, root, "default_values").entrySet()) {
            b.defaultValue(e.getKey(), e.getValue());
        }

        JsonNode rules = root.has("validation_rules") ? root.get("validation_rules") : root.get("rules");
        if (rules != null && !rules.isNull()) {
            if (!rules.isObject()) {
                throw new JsonMappingException(p, "Schema validation rules must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = rules.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                b.rule(e.getKey(), readRule(mapper, e.getValue()));
            }
        }
        return b.build();
    }

    private FieldRule readRule(ObjectMapper mapper, JsonNode node) {
        FieldRule.Builder rule = FieldRule.builder();
        if (node.hasNonNull("min")) {
            rule.min(node.get("min").numberValue());
        }
        if (node.hasNonNull("max")) {
            rule.max(node.get("max").numberValue());
        }
        if (node.hasNonNull("min_length")) {
            rule.minLength(node.get("min_length").asInt());
        }
        if (node.hasNonNull("max_length")) {
            rule.maxLength(node.get("max_length").asInt());
        }
        if (node.hasNonNull("pattern")) {
            rule.pattern(node.get("pattern").asText());
        }
        JsonNode allowed = node.has("enum") ? node.get("enum") : node.get("allowed_values");
        if (allowed != null && !allowed.isNull()) {
            rule.allowedValues(mapper.convertValue(allowed, VALUE_LIST));
        }
        return rule.build();
    }
}
