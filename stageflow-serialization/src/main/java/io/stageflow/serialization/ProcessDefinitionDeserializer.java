package io.stageflow.serialization;

import static io.stageflow.serialization.JsonTrees.booleanOr;
import static io.stageflow.serialization.JsonTrees.namedEntries;
import static io.stageflow.serialization.JsonTrees.objectMap;
import static io.stageflow.serialization.JsonTrees.stringList;
import static io.stageflow.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stageflow.core.process.ProcessDefinition;
import io.stageflow.core.stage.Stage;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `ProcessDefinition`.
///
/// Accepts the definition at the top level or wrapped in a `"process"`
/// object. Stages may be an ordered array or a name-keyed object whose key
/// order is the declaration order.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see ProcessDefinitionSerializer for the inverse operation
class ProcessDefinitionDeserializer extends StdDeserializer<ProcessDefinition> {

    @Serial private static final long serialVersionUID = -5530980162873318447L;

    ProcessDefinitionDeserializer() {
        super(ProcessDefinition.class);
    }

    @Override
    public ProcessDefinition deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root.has("process") && root.get("process").isObject()) {
            root = root.get("process");
        }

        ProcessDefinition.Builder b =
                ProcessDefinition.builder()
                        .name(textOrNull(root, "name"))
                        .description(textOrNull(root, "description"))
                        .stageOrder(stringList(mapper, root, "stage_order"))
                        .allowStageSkipping(booleanOr(root, "allow_stage_skipping", false))
                        .regressionDetection(booleanOr(root, "regression_detection", true))
                        .metadata(objectMap(mapper, root, "metadata"));

        for (JsonNode stage : namedEntries(p, root, "stages")) {
            b.stage(mapper.treeToValue(stage, Stage.class));
        }
        return b.build();
    }
}
