package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stageflow.core.gate.Gate;
import io.stageflow.core.stage.ActionTemplate;
import io.stageflow.core.stage.Stage;
import io.stageflow.core.state.EvaluationState;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Serializes a `Stage` as
/// `{"name","description","allow_partial","schema","gates":[...],"action_templates":{...},"metadata"}`.
///
/// Action templates are keyed by the state's wire name, e.g. `"fulfilling"`.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see StageDeserializer for the inverse operation
class StageSerializer extends StdSerializer<Stage> {

    @Serial private static final long serialVersionUID = -1419930718874326302L;

    StageSerializer() {
        super(Stage.class);
    }

    @Override
    public void serialize(Stage stage, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", stage.getName());
        if (!stage.getDescription().isEmpty()) {
            gen.writeStringField("description", stage.getDescription());
        }
        gen.writeBooleanField("allow_partial", stage.isAllowPartial());
        if (stage.getSchema().isPresent()) {
            gen.writeObjectField("schema", stage.getSchema().get());
        }

        gen.writeArrayFieldStart("gates");
        for (Gate gate : stage.getGates()) {
            gen.writeObject(gate);
        }
        gen.writeEndArray();

        if (!stage.getActionTemplates().isEmpty()) {
            gen.writeObjectFieldStart("action_templates");
            for (Map.Entry<EvaluationState, List<ActionTemplate>> e :
                    stage.getActionTemplates().entrySet()) {
                gen.writeArrayFieldStart(e.getKey().value());
                for (ActionTemplate template : e.getValue()) {
                    gen.writeObject(template);
                }
                gen.writeEndArray();
            }
            gen.writeEndObject();
        }

        if (!stage.getMetadata().isEmpty()) {
            gen.writeObjectField("metadata", stage.getMetadata());
        }
        gen.writeEndObject();
    }
}
