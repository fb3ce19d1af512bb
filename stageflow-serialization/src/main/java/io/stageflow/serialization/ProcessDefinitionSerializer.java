package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stageflow.core.process.ProcessDefinition;
import io.stageflow.core.stage.Stage;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `ProcessDefinition` with stages as an ordered array.
///
/// `stage_order` is written only when it was given explicitly.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see ProcessDefinitionDeserializer for the inverse operation
class ProcessDefinitionSerializer extends StdSerializer<ProcessDefinition> {

    @Serial private static final long serialVersionUID = 8811405209353714571L;

    ProcessDefinitionSerializer() {
        super(ProcessDefinition.class);
    }

    @Override
    public void serialize(
            ProcessDefinition definition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", definition.getName());
        if (!definition.getDescription().isEmpty()) {
            gen.writeStringField("description", definition.getDescription());
        }
        gen.writeArrayFieldStart("stages");
        for (Stage stage : definition.getStages()) {
            gen.writeObject(stage);
        }
        gen.writeEndArray();
        if (!definition.getStageOrder().isEmpty()) {
            gen.writeObjectField("stage_order", definition.getStageOrder());
        }
        gen.writeBooleanField("allow_stage_skipping", definition.isAllowStageSkipping());
        gen.writeBooleanField("regression_detection", definition.isRegressionDetection());
        if (!definition.getMetadata().isEmpty()) {
            gen.writeObjectField("metadata", definition.getMetadata());
        }
        gen.writeEndObject();
    }
}
