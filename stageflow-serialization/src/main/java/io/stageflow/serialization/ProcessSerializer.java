package io.stageflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.stageflow.core.element.DictElement;
import io.stageflow.core.element.Element;
import io.stageflow.core.process.ProcessDefinition;
import io.stageflow.core.process.StatusResult;
import java.util.Map;

/// Utility class for reading and writing StageFlow process definitions,
/// elements and evaluation results as JSON.
///
/// ### Usage
/// {@snippet :
/// ProcessDefinition definition = ProcessSerializer.fromJson(json);
/// Process process = Process.fromDefinition(definition);
///
/// Element element = ProcessSerializer.elementFromJson("{\"email\":\"a@b.io\"}");
/// String report = ProcessSerializer.statusToJson(process.evaluate(element));
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see StageFlowJacksonModule for the registered type handlers
public final class ProcessSerializer {

    private ProcessSerializer() {}

    /// Serializes a definition to pretty-printed JSON in canonical form.
    ///
    /// @param definition the definition to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ProcessDefinition definition) {
        try {
            return createMapper().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize process definition: " + e.getMessage(), e);
        }
    }

    /// Deserializes a definition from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized definition, never null
    /// @throws IllegalArgumentException if the JSON is malformed or describes
    ///     an invalid process graph
    public static ProcessDefinition fromJson(String json) {
        try {
            return createMapper().readValue(json, ProcessDefinition.class);
        } catch (JsonProcessingException | IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize process definition: " + e.getMessage(), e);
        }
    }

    /// Serializes an evaluation result to pretty-printed JSON.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String statusToJson(StatusResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize status result: " + e.getMessage(), e);
        }
    }

    /// Deserializes an evaluation result from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized result, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static StatusResult statusFromJson(String json) {
        try {
            return createMapper().readValue(json, StatusResult.class);
        } catch (JsonProcessingException | IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize status result: " + e.getMessage(), e);
        }
    }

    /// Reads a JSON object into an element.
    ///
    /// @param json JSON object string, not null
    /// @return map-backed element, never null
    /// @throws IllegalArgumentException if the JSON is not an object
    public static Element elementFromJson(String json) {
        try {
            Map<String, Object> data = createMapper().readValue(json, JsonTrees.OBJECT_MAP);
            if (data == null) {
                throw new IllegalArgumentException("Element JSON must be an object");
            }
            return DictElement.of(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize element: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for StageFlow serialization.
    ///
    /// Registers:
    /// - `StageFlowJacksonModule` for the process graph and result types
    /// - `JavaTimeModule` for `Instant` timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new StageFlowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
