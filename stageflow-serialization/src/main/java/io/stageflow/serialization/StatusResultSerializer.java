package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stageflow.core.action.Action;
import io.stageflow.core.process.StatusResult;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `StatusResult` with the same keys as {@link StatusResult#toMap()}.
///
/// The timestamp goes through the mapper, so with `JavaTimeModule` and
/// `WRITE_DATES_AS_TIMESTAMPS` disabled it is an ISO-8601 string.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see StatusResultDeserializer for the inverse operation
class StatusResultSerializer extends StdSerializer<StatusResult> {

    @Serial private static final long serialVersionUID = -7046253312250883190L;

    StatusResultSerializer() {
        super(StatusResult.class);
    }

    @Override
    public void serialize(StatusResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("state", result.getState().value());
        gen.writeStringField("element_id", result.getElementId());
        gen.writeStringField("current_stage", result.getCurrentStage());
        gen.writeStringField("proposed_stage", result.getProposedStage());
        gen.writeArrayFieldStart("actions");
        for (Action action : result.getActions()) {
            gen.writeObject(action);
        }
        gen.writeEndArray();
        gen.writeObjectField("errors", result.getErrors());
        gen.writeObjectField("warnings", result.getWarnings());
        gen.writeObjectField("metadata", result.getMetadata());
        gen.writeObjectField("timestamp", result.getTimestamp());
        gen.writeEndObject();
    }
}
