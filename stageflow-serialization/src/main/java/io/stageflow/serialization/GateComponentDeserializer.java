package io.stageflow.serialization;

import static io.stageflow.serialization.JsonTrees.objectMap;
import static io.stageflow.serialization.JsonTrees.plainValue;
import static io.stageflow.serialization.JsonTrees.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stageflow.core.gate.Gate;
import io.stageflow.core.gate.GateComponent;
import io.stageflow.core.gate.Lock;
import io.stageflow.core.gate.LockType;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Deserializes gate components, telling gates and locks apart by shape.
///
/// An object carrying `components` or `locks` is a gate; anything else is a
/// lock. Locks are accepted in three forms:
/// - canonical: `{"type":"regex","property_path":"email","expected_value":"^.+@"}`
///   (`value` is accepted as an alias of `expected_value`)
/// - shorthand: `{"exists":"email"}`, `{"is_true":"verified"}`, `{"is_false":"banned"}`
/// - structured: `{"regex":{"property_path":"email","value":"^.+@"}}`
///
/// A gate's legacy `logic`/`operator` tag is passed to the builder, which keeps
/// it as metadata only.
///
/// @implNote Package-private. Registered by {@link StageFlowJacksonModule} for
/// `GateComponent`, `Lock` and `Gate`.
/// @see GateComponentSerializer for the inverse operation
class GateComponentDeserializer<T extends GateComponent> extends StdDeserializer<T> {

    @Serial private static final long serialVersionUID = -6046128371950874422L;

    static final List<String> SHORTHAND_KEYS = List.of("exists", "is_true", "is_false");

    private final Class<T> target;

    GateComponentDeserializer(Class<T> target) {
        super(target);
        this.target = target;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        GateComponent component = readComponent(mapper, p, root);
        if (!target.isInstance(component)) {
            throw new JsonMappingException(
                    p, "Expected " + target.getSimpleName() + " definition but got: " + root);
        }
        return target.cast(component);
    }

    static GateComponent readComponent(ObjectMapper mapper, JsonParser p, JsonNode root)
            throws IOException {
        if (root.isObject() && (root.has("components") || root.has("locks"))) {
            return readGate(mapper, p, root);
        }
        return readLock(mapper, p, root);
    }

    static Gate readGate(ObjectMapper mapper, JsonParser p, JsonNode root) throws IOException {
        Gate.Builder b =
                Gate.builder()
                        .name(textOrNull(root, "name"))
                        .description(textOrNull(root, "description"))
                        .targetStage(textOrNull(root, "target_stage"))
                        .metadata(objectMap(mapper, root, "metadata"));

        String operator = textOrNull(root, "logic");
        if (operator == null) {
            operator = textOrNull(root, "operator");
        }
        if (operator != null) {
            b.operator(operator);
        }

        JsonNode components = root.has("components") ? root.get("components") : root.get("locks");
        if (components == null || !components.isArray()) {
            throw new JsonMappingException(
                    p, "Gate '" + textOrNull(root, "name") + "' components must be an array");
        }
        for (JsonNode component : components) {
            b.component(readComponent(mapper, p, component));
        }
        return b.build();
    }

    static Lock readLock(ObjectMapper mapper, JsonParser p, JsonNode root) throws IOException {
        if (!root.isObject()) {
            throw invalidLock(p, root);
        }

        if (root.hasNonNull("type") && root.hasNonNull("property_path")) {
            return Lock.builder()
                    .type(LockType.fromValue(root.get("type").asText()))
                    .propertyPath(root.get("property_path").asText())
                    .expectedValue(expectedValue(mapper, root))
                    .validatorName(textOrNull(root, "validator_name"))
                    .metadata(objectMap(mapper, root, "metadata"))
                    .build();
        }

        for (String key : SHORTHAND_KEYS) {
            JsonNode path = root.get(key);
            if (path != null && path.isTextual()) {
                Lock.Builder b = Lock.builder().propertyPath(path.asText());
                switch (key) {
                    case "exists" -> b.type(LockType.EXISTS).expectedValue(true);
                    case "is_true" -> b.type(LockType.EQUALS).expectedValue(true);
                    default -> b.type(LockType.EQUALS).expectedValue(false);
                }
                return b.metadata(objectMap(mapper, root, "metadata")).build();
            }
        }

        if (root.size() == 1) {
            Map.Entry<String, JsonNode> entry = root.fields().next();
            Optional<LockType> type = findLockType(entry.getKey());
            JsonNode body = entry.getValue();
            if (type.isPresent() && body.isObject() && body.hasNonNull("property_path")) {
                return Lock.builder()
                        .type(type.get())
                        .propertyPath(body.get("property_path").asText())
                        .expectedValue(expectedValue(mapper, body))
                        .validatorName(textOrNull(body, "validator_name"))
                        .metadata(objectMap(mapper, body, "metadata"))
                        .build();
            }
        }

        throw invalidLock(p, root);
    }

    private static Object expectedValue(ObjectMapper mapper, JsonNode node) {
        if (node.has("expected_value")) {
            return plainValue(mapper, node.get("expected_value"));
        }
        return plainValue(mapper, node.get("value"));
    }

    private static Optional<LockType> findLockType(String name) {
        for (LockType type : LockType.values()) {
            if (type.value().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static JsonMappingException invalidLock(JsonParser p, JsonNode root) {
        return new JsonMappingException(p, "Invalid lock definition format: " + root);
    }
}
