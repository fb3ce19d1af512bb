package io.stageflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.stageflow.core.action.Action;
import io.stageflow.core.gate.Gate;
import io.stageflow.core.gate.GateComponent;
import io.stageflow.core.gate.Lock;
import io.stageflow.core.process.ProcessDefinition;
import io.stageflow.core.process.StatusResult;
import io.stageflow.core.schema.Schema;
import io.stageflow.core.stage.ActionTemplate;
import io.stageflow.core.stage.Stage;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all StageFlow serialization configuration in one place.
///
/// Every domain type is immutable and builder-based, so each one gets an explicit
/// serializer/deserializer pair that reads the JSON tree and drives the builder:
/// - `GateComponent`, `Lock`, `Gate`: `GateComponentSerializer` / `GateComponentDeserializer`;
///   gates are told apart from locks by their `components`/`locks` field, and locks accept
///   canonical, shorthand and structured forms
/// - `Schema`, `ActionTemplate`, `Stage`, `ProcessDefinition`: one pair each
/// - `Action`, `StatusResult`: evaluation output, with wire-style enum names
///
/// @implNote No reflection-based binding and no classpath scanning; all
/// registrations are explicit.
/// @see ProcessSerializer for the convenience factory API
public class StageFlowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3842207719660145813L;

    public StageFlowJacksonModule() {
        super("StageFlowJacksonModule");

        GateComponentSerializer componentSerializer = new GateComponentSerializer();
        addSerializer(GateComponent.class, componentSerializer);
        addSerializer(Lock.class, componentSerializer);
        addSerializer(Gate.class, componentSerializer);
        addDeserializer(GateComponent.class, new GateComponentDeserializer<>(GateComponent.class));
        addDeserializer(Lock.class, new GateComponentDeserializer<>(Lock.class));
        addDeserializer(Gate.class, new GateComponentDeserializer<>(Gate.class));

        addSerializer(Schema.class, new SchemaSerializer());
        addDeserializer(Schema.class, new SchemaDeserializer());

        addSerializer(ActionTemplate.class, new ActionTemplateSerializer());
        addDeserializer(ActionTemplate.class, new ActionTemplateDeserializer());

        addSerializer(Stage.class, new StageSerializer());
        addDeserializer(Stage.class, new StageDeserializer());

        addSerializer(ProcessDefinition.class, new ProcessDefinitionSerializer());
        addDeserializer(ProcessDefinition.class, new ProcessDefinitionDeserializer());

        addSerializer(Action.class, new ActionSerializer());
        addDeserializer(Action.class, new ActionDeserializer());

        addSerializer(StatusResult.class, new StatusResultSerializer());
        addDeserializer(StatusResult.class, new StatusResultDeserializer());
    }
}
