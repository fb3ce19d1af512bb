package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stageflow.core.schema.FieldRule;
import io.stageflow.core.schema.FieldType;
import io.stageflow.core.schema.Schema;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `Schema` as
/// `{"name","required_fields","optional_fields","field_types","default_values","validation_rules","metadata"}`.
///
/// Rule objects only carry the constraints that are set.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule}.
/// @see SchemaDeserializer for the inverse operation
class SchemaSerializer extends StdSerializer<Schema> {

    @Serial private static final long serialVersionUID = -3308826913207561370L;

    SchemaSerializer() {
        super(Schema.class);
    }

    @Override
    public void serialize(Schema schema, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", schema.getName());
        gen.writeObjectField("required_fields", schema.getRequiredFields());
        gen.writeObjectField("optional_fields", schema.getOptionalFields());

        gen.writeObjectFieldStart("field_types");
        for (Map.Entry<String, FieldType> e : schema.getFieldTypes().entrySet()) {
            gen.writeStringField(e.getKey(), e.getValue().value());
        }
        gen.writeEndObject();

        gen.writeObjectField("default_values", schema.getDefaultValues());

        gen.writeObjectFieldStart("validation_rules");
        for (Map.Entry<String, FieldRule> e : schema.getRules().entrySet()) {
            gen.writeFieldName(e.getKey());
            writeRule(e.getValue(), gen);
        }
        gen.writeEndObject();

        if (!schema.getMetadata().isEmpty()) {
            gen.writeObjectField("metadata", schema.getMetadata());
        }
        gen.writeEndObject();
    }

    private void writeRule(FieldRule rule, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        if (rule.min() != null) {
            gen.writeObjectField("min", rule.min());
        }
        if (rule.max() != null) {
            gen.writeObjectField("max", rule.max());
        }
        if (rule.minLength() != null) {
            gen.writeNumberField("min_length", rule.minLength());
        }
        if (rule.maxLength() != null) {
            gen.writeNumberField("max_length", rule.maxLength());
        }
        if (rule.pattern() != null) {
            gen.writeStringField("pattern", rule.pattern());
        }
        if (rule.allowedValues() != null) {
            gen.writeObjectField("enum", rule.allowedValues());
        }
        gen.writeEndObject();
    }
}
