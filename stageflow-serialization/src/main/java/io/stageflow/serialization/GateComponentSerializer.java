package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stageflow.core.gate.Gate;
import io.stageflow.core.gate.GateComponent;
import io.stageflow.core.gate.Lock;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;
import java.util.Map;

/// Serializes the `GateComponent` hierarchy in canonical form.
///
/// Emitted JSON shape per subtype:
/// - **`Lock`**: `{"type":"range","property_path":"age","expected_value":[18,65]}`, plus
///   `validator_name` for custom locks and `metadata` when non-empty. A `Class` expected
///   value is written as its lower-case simple name, e.g. `"string"`
/// - **`Gate`**: `{"name":"...","components":[...]}`, plus `description`, `target_stage`
///   and `metadata` when set
///
/// Shorthand lock forms are accepted on input only; output is always canonical.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see GateComponentDeserializer for the inverse operation
class GateComponentSerializer extends StdSerializer<GateComponent> {

    @Serial private static final long serialVersionUID = 2318047751208436617L;

    GateComponentSerializer() {
        super(GateComponent.class);
    }

    @Override
    public void serialize(GateComponent component, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (component instanceof Lock lock) {
            writeLock(lock, gen);
        } else if (component instanceof Gate gate) {
            writeGate(gate, gen, provider);
        } else {
            throw new IOException("Unknown gate component: " + component.getClass().getName());
        }
    }

    private void writeLock(Lock lock, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", lock.getType().value());
        gen.writeStringField("property_path", lock.getPropertyPath());
        Object expected = lock.getExpectedValue();
        if (expected instanceof Class<?> type) {
            gen.writeStringField(
                    "expected_value", type.getSimpleName().toLowerCase(Locale.ROOT));
        } else if (expected != null) {
            gen.writeObjectField("expected_value", expected);
        }
        if (lock.getValidatorName() != null) {
            gen.writeStringField("validator_name", lock.getValidatorName());
        }
        writeMetadata(lock.getMetadata(), gen);
        gen.writeEndObject();
    }

    private void writeGate(Gate gate, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", gate.getName());
        if (gate.getDescription() != null && !gate.getDescription().isEmpty()) {
            gen.writeStringField("description", gate.getDescription());
        }
        if (gate.getTargetStage() != null) {
            gen.writeStringField("target_stage", gate.getTargetStage());
        }
        gen.writeArrayFieldStart("components");
        for (GateComponent component : gate.getComponents()) {
            serialize(component, gen, provider);
        }
        gen.writeEndArray();
        writeMetadata(gate.getMetadata(), gen);
        gen.writeEndObject();
    }

    private void writeMetadata(Map<String, Object> metadata, JsonGenerator gen)
            throws IOException {
        if (!metadata.isEmpty()) {
            gen.writeObjectField("metadata", metadata);
        }
    }
}
