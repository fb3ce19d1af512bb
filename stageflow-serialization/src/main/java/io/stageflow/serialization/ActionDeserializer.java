package io.stageflow.serialization;

import static io.stageflow.serialization.JsonTrees.objectMap;
import static io.stageflow.serialization.JsonTrees.stringList;
import static io.stageflow.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stageflow.core.action.Action;
import io.stageflow.core.action.ActionType;
import io.stageflow.core.action.Priority;
import java.io.IOException;
import java.io.Serial;

/// Deserializes an `Action`; a missing priority reads as `normal`.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see ActionSerializer for the inverse operation
class ActionDeserializer extends StdDeserializer<Action> {

    @Serial private static final long serialVersionUID = -2674183925516047018L;

    ActionDeserializer() {
        super(Action.class);
    }

    @Override
    public Action deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String priority = textOrNull(root, "priority");
        return new Action(
                ActionType.fromValue(root.get("type").asText()),
                textOrNull(root, "description"),
                priority != null ? Priority.fromValue(priority) : Priority.NORMAL,
                stringList(mapper, root, "conditions"),
                objectMap(mapper, root, "metadata"));
    }
}
