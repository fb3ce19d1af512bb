package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stageflow.core.action.Action;
import java.io.IOException;
import java.io.Serial;

/// Serializes an `Action` as
/// `{"type":"complete_field","description":"...","priority":"high","conditions":[],"metadata":{}}`.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see ActionDeserializer for the inverse operation
class ActionSerializer extends StdSerializer<Action> {

    @Serial private static final long serialVersionUID = 1906402235172258411L;

    ActionSerializer() {
        super(Action.class);
    }

    @Override
    public void serialize(Action action, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", action.type().value());
        gen.writeStringField("description", action.description());
        gen.writeStringField("priority", action.priority().value());
        gen.writeObjectField("conditions", action.conditions());
        gen.writeObjectField("metadata", action.metadata());
        gen.writeEndObject();
    }
}
