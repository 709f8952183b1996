package com.omotes.workflow.parameter;

import com.fasterxml.jackson.databind.JsonNode;
import com.omotes.protocol.ProtocolException;
import com.omotes.protocol.workflow.ParameterTypeCase;
import com.omotes.protocol.workflow.WorkflowParameterMessage;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Static table of the supported parameter variants: the {@code parameter_type} name used in the
 * workflow configuration file, the variant field of {@link WorkflowParameterMessage} on the wire,
 * and the runtime value type.
 */
public enum ParameterKind {

    STRING("string", ParameterTypeCase.STRING_PARAMETER, String.class),
    BOOLEAN("boolean", ParameterTypeCase.BOOLEAN_PARAMETER, Boolean.class),
    INTEGER("integer", ParameterTypeCase.INTEGER_PARAMETER, Long.class),
    FLOAT("float", ParameterTypeCase.FLOAT_PARAMETER, Double.class),
    DATETIME("datetime", ParameterTypeCase.DATETIME_PARAMETER, LocalDateTime.class);

    private final String configName;
    private final ParameterTypeCase wireTypeCase;
    private final Class<?> valueType;

    ParameterKind(String configName, ParameterTypeCase wireTypeCase, Class<?> valueType) {
        this.configName = configName;
        this.wireTypeCase = wireTypeCase;
        this.valueType = valueType;
    }

    /** Value of {@code parameter_type} in the workflow configuration file. */
    public String getConfigName() {
        return configName;
    }

    public ParameterTypeCase getWireTypeCase() {
        return wireTypeCase;
    }

    /** Runtime type of values returned by {@link #fromWireValue(Object)}. */
    public Class<?> getValueType() {
        return valueType;
    }

    public static Optional<ParameterKind> fromConfigName(String configName) {
        for (ParameterKind kind : values()) {
            if (kind.configName.equals(configName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws ProtocolException when no variant is set
     */
    public static ParameterKind fromWireTypeCase(ParameterTypeCase typeCase) {
        for (ParameterKind kind : values()) {
            if (kind.wireTypeCase == typeCase) {
                return kind;
            }
        }
        throw new ProtocolException("Workflow parameter message has no parameter type set");
    }

    /** Builds a parameter of this kind from its workflow configuration entry. */
    public WorkflowParameter fromJsonConfig(JsonNode config) {
        return switch (this) {
            case STRING -> StringParameter.fromJsonConfig(config);
            case BOOLEAN -> BooleanParameter.fromJsonConfig(config);
            case INTEGER -> IntegerParameter.fromJsonConfig(config);
            case FLOAT -> FloatParameter.fromJsonConfig(config);
            case DATETIME -> DateTimeParameter.fromJsonConfig(config);
        };
    }

    /**
     * Builds a parameter from its wire form, dispatching on the variant that is set.
     *
     * @throws ProtocolException when no variant is set or the variant content is invalid
     */
    public static WorkflowParameter fromWireMessage(WorkflowParameterMessage message) {
        return switch (fromWireTypeCase(message.getParameterTypeCase())) {
            case STRING -> StringParameter.fromWireMessage(message);
            case BOOLEAN -> BooleanParameter.fromWireMessage(message);
            case INTEGER -> IntegerParameter.fromWireMessage(message);
            case FLOAT -> FloatParameter.fromWireMessage(message);
            case DATETIME -> DateTimeParameter.fromWireMessage(message);
        };
    }

    /**
     * Converts a runtime value of this kind to a wire scalar.
     *
     * @throws WrongFieldTypeException when the value is not of this kind
     */
    public Object toWireValue(Object value) {
        return switch (this) {
            case STRING -> StringParameter.stringToWire(value);
            case BOOLEAN -> BooleanParameter.booleanToWire(value);
            case INTEGER -> IntegerParameter.integerToWire(value);
            case FLOAT -> FloatParameter.floatToWire(value);
            case DATETIME -> DateTimeParameter.dateTimeToWire(value);
        };
    }

    /**
     * Converts a wire scalar to the runtime type of this kind.
     *
     * @throws WrongFieldTypeException when the wire value has an incompatible kind
     */
    public Object fromWireValue(Object value) {
        return switch (this) {
            case STRING -> StringParameter.stringFromWire(value);
            case BOOLEAN -> BooleanParameter.booleanFromWire(value);
            case INTEGER -> IntegerParameter.integerFromWire(value);
            case FLOAT -> FloatParameter.floatFromWire(value);
            case DATETIME -> DateTimeParameter.dateTimeFromWire(value);
        };
    }
}
