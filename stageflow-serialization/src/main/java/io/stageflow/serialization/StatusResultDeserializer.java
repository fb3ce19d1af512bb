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
import io.stageflow.core.process.StatusResult;
import io.stageflow.core.state.EvaluationState;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;

/// Deserializes a `StatusResult`, for callers that store or forward results.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see StatusResultSerializer for the inverse operation
class StatusResultDeserializer extends StdDeserializer<StatusResult> {

    @Serial private static final long serialVersionUID = 2457319072638814470L;

    StatusResultDeserializer() {
        super(StatusResult.class);
    }

    @Override
    public StatusResult deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        StatusResult.Builder b =
                StatusResult.builder()
                        .state(EvaluationState.fromValue(root.get("state").asText()))
                        .elementId(textOrNull(root, "element_id"))
                        .currentStage(textOrNull(root, "current_stage"))
                        .proposedStage(textOrNull(root, "proposed_stage"))
                        .errors(stringList(mapper, root, "errors"))
                        .warnings(stringList(mapper, root, "warnings"))
                        .metadata(objectMap(mapper, root, "metadata"));
        if (root.hasNonNull("actions")) {
            for (JsonNode action : root.get("actions")) {
                b.action(mapper.treeToValue(action, Action.class));
            }
        }
        if (root.hasNonNull("timestamp")) {
            b.timestamp(mapper.treeToValue(root.get("timestamp"), Instant.class));
        }
        return b.build();
    }
}
