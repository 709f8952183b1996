package com.omotes.workflow.parameter;

import com.fasterxml.jackson.databind.JsonNode;
import com.omotes.protocol.workflow.BooleanParameterMessage;
import com.omotes.protocol.workflow.WorkflowParameterMessage;

/** Yes/no parameter. */
public final class BooleanParameter extends WorkflowParameter {

    private static final String TYPE = "BooleanParameter";

    private final Boolean defaultValue;

    public BooleanParameter(String keyName, String title, String description, Boolean defaultValue) {
        super(keyName, title, description);
        this.defaultValue = defaultValue;
    }

    /** Default value; null when the parameter has none. */
    public Boolean getDefaultValue() {
        return defaultValue;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.BOOLEAN;
    }

    public static BooleanParameter fromJsonConfig(JsonNode config) {
        String keyName = requiredText(config, "key_name", TYPE);
        JsonNode defaultNode = config.get("default");
        if (defaultNode != null && !defaultNode.isBoolean()) {
            throw new WrongFieldTypeException("'default' for BooleanParameter must be in 'bool' format: '" + defaultNode.asText() + "'");
        }
        return new BooleanParameter(
                keyName,
                optionalText(config, "title", TYPE),
                optionalText(config, "description", TYPE),
                defaultNode != null ? defaultNode.booleanValue() : null);
    }

    public static BooleanParameter fromWireMessage(WorkflowParameterMessage message) {
        return new BooleanParameter(message.getKeyName(), message.getTitle(), message.getDescription(),
                message.getBooleanParameter().getDefaultValue());
    }

    @Override
    public WorkflowParameterMessage toWireMessage() {
        return WorkflowParameterMessage.of(getKeyName(), getTitle(), getDescription(),
                new BooleanParameterMessage(defaultValue));
    }

    static Boolean booleanToWire(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" to a wire value as the type is "
                + describe(value) + " while a bool was expected.");
    }

    static Boolean booleanFromWire(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire value as the type is "
                + describe(value) + " while a bool was expected.");
    }
}
