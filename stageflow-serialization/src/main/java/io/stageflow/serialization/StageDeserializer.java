package io.stageflow.serialization;

import static io.stageflow.serialization.JsonTrees.booleanOr;
import static io.stageflow.serialization.JsonTrees.namedEntries;
import static io.stageflow.serialization.JsonTrees.objectMap;
import static io.stageflow.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stageflow.core.schema.Schema;
import io.stageflow.core.stage.ActionTemplate;
import io.stageflow.core.stage.Stage;
import io.stageflow.core.state.EvaluationState;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.Map;

/// Deserializes a `Stage`.
///
/// Gates may be an array or a name-keyed object. A schema without a name is
/// named `<stage>_schema`.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see StageSerializer for the inverse operation
class StageDeserializer extends StdDeserializer<Stage> {

    @Serial private static final long serialVersionUID = 3390712566101478852L;

    StageDeserializer() {
        super(Stage.class);
    }

    @Override
    public Stage deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String name = textOrNull(root, "name");
        Stage.Builder b =
                Stage.builder(name)
                        .description(textOrNull(root, "description"))
                        .allowPartial(booleanOr(root, "allow_partial", false))
                        .metadata(objectMap(mapper, root, "metadata"));

        if (root.hasNonNull("schema")) {
            JsonNode schema = root.get("schema");
            if (schema.isObject() && !schema.has("name")) {
                ObjectNode named = schema.deepCopy();
                named.put("name", name + "_schema");
                schema = named;
            }
            b.schema(mapper.treeToValue(schema, Schema.class));
        }

        for (JsonNode gate : namedEntries(p, root, "gates")) {
            b.gate(GateComponentDeserializer.readGate(mapper, p, gate));
        }

        if (root.hasNonNull("action_templates")) {
            JsonNode templates = root.get("action_templates");
            if (!templates.isObject()) {
                throw new JsonMappingException(
                        p, "Stage '" + name + "' action_templates must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> states = templates.fields();
            while (states.hasNext()) {
                Map.Entry<String, JsonNode> e = states.next();
                EvaluationState state = EvaluationState.fromValue(e.getKey());
                for (JsonNode template : e.getValue()) {
                    b.actionTemplate(state, mapper.treeToValue(template, ActionTemplate.class));
                }
            }
        }
        return b.build();
    }
}
