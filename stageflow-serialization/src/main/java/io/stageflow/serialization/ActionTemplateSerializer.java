package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stageflow.core.stage.ActionTemplate;
import java.io.IOException;
import java.io.Serial;

/// Serializes an `ActionTemplate` with its unresolved `{var}` placeholders.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see ActionTemplateDeserializer for the inverse operation
class ActionTemplateSerializer extends StdSerializer<ActionTemplate> {

    @Serial private static final long serialVersionUID = 5570131449312776248L;

    ActionTemplateSerializer() {
        super(ActionTemplate.class);
    }

    @Override
    public void serialize(ActionTemplate template, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", template.getType().value());
        gen.writeStringField("description", template.getDescription());
        gen.writeStringField("priority", template.getPriority().value());
        if (!template.getConditions().isEmpty()) {
            gen.writeObjectField("conditions", template.getConditions());
        }
        if (!template.getTemplateVars().isEmpty()) {
            gen.writeObjectField("template_vars", template.getTemplateVars());
        }
        if (!template.getMetadata().isEmpty()) {
            gen.writeObjectField("metadata", template.getMetadata());
        }
        gen.writeEndObject();
    }
}
