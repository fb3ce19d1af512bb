package io.stageflow.serialization;

import static io.stageflow.serialization.JsonTrees.objectMap;
import static io.stageflow.serialization.JsonTrees.stringList;
import static io.stageflow.serialization.JsonTrees.stringMap;
import static io.stageflow.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stageflow.core.action.ActionType;
import io.stageflow.core.action.Priority;
import io.stageflow.core.stage.ActionTemplate;
import java.io.IOException;
import java.io.Serial;

/// Deserializes an `ActionTemplate`; a missing priority reads as `normal`.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see ActionTemplateSerializer for the inverse operation
class ActionTemplateDeserializer extends StdDeserializer<ActionTemplate> {

    @Serial private static final long serialVersionUID = -8159403387150912733L;

    ActionTemplateDeserializer() {
        super(ActionTemplate.class);
    }

    @Override
    public ActionTemplate deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        ActionTemplate.Builder b =
                ActionTemplate.builder()
                        .type(ActionType.fromValue(root.get("type").asText()))
                        .description(textOrNull(root, "description"))
                        .conditions(stringList(mapper, root, "conditions"))
                        .templateVars(stringMap(mapper, root, "template_vars"))
                        .metadata(objectMap(mapper, root, "metadata"));
        String priority = textOrNull(root, "priority");
        if (priority != null) {
            b.priority(Priority.fromValue(priority));
        }
        return b.build();
    }
}
