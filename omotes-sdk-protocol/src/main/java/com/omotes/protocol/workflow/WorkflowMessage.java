package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Wire form of one workflow type in the catalog. Parameter order is significant. */
public final class WorkflowMessage {

    private final String typeName;
    private final String typeDescription;
    private final List<WorkflowParameterMessage> parameters;

    @JsonCreator
    public WorkflowMessage(
            @JsonProperty("type_name") String typeName,
            @JsonProperty("type_description") String typeDescription,
            @JsonProperty("parameters") List<WorkflowParameterMessage> parameters) {
        this.typeName = typeName;
        this.typeDescription = typeDescription;
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    @JsonProperty("type_name")
    public String getTypeName() {
        return typeName;
    }

    @JsonProperty("type_description")
    public String getTypeDescription() {
        return typeDescription;
    }

    @JsonProperty("parameters")
    public List<WorkflowParameterMessage> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowMessage that = (WorkflowMessage) o;
        return Objects.equals(typeName, that.typeName)
                && Objects.equals(typeDescription, that.typeDescription)
                && Objects.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, typeDescription, parameters);
    }
}
