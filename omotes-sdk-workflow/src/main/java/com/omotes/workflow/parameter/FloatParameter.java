package com.omotes.workflow.parameter;

import com.fasterxml.jackson.databind.JsonNode;
import com.omotes.protocol.workflow.FloatParameterMessage;
import com.omotes.protocol.workflow.WorkflowParameterMessage;

/** Real-number parameter with optional bounds. */
public final class FloatParameter extends WorkflowParameter {

    private static final String TYPE = "FloatParameter";

    private final Double defaultValue;
    private final Double minimum;
    private final Double maximum;

    public FloatParameter(String keyName, String title, String description,
                          Double defaultValue, Double minimum, Double maximum) {
        super(keyName, title, description);
        this.defaultValue = defaultValue;
        this.minimum = minimum;
        this.maximum = maximum;
    }

    public Double getDefaultValue() {
        return defaultValue;
    }

    public Double getMinimum() {
        return minimum;
    }

    public Double getMaximum() {
        return maximum;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.FLOAT;
    }

    /** Integral numbers are accepted for {@code default}, {@code minimum} and {@code maximum}. */
    public static FloatParameter fromJsonConfig(JsonNode config) {
        String keyName = requiredText(config, "key_name", TYPE);
        return new FloatParameter(
                keyName,
                optionalText(config, "title", TYPE),
                optionalText(config, "description", TYPE),
                floatField(config, "default"),
                floatField(config, "minimum"),
                floatField(config, "maximum"));
    }

    private static Double floatField(JsonNode config, String field) {
        JsonNode node = config.get(field);
        if (node == null) {
            return null;
        }
        if (!node.isNumber()) {
            throw new WrongFieldTypeException("'" + field + "' for FloatParameter must be in 'float' format: '" + node.asText() + "'");
        }
        return node.doubleValue();
    }

    public static FloatParameter fromWireMessage(WorkflowParameterMessage message) {
        FloatParameterMessage variant = message.getFloatParameter();
        return new FloatParameter(message.getKeyName(), message.getTitle(), message.getDescription(),
                variant.getDefaultValue(),
                variant.hasMinimum() ? variant.getMinimum() : null,
                variant.hasMaximum() ? variant.getMaximum() : null);
    }

    @Override
    public WorkflowParameterMessage toWireMessage() {
        return WorkflowParameterMessage.of(getKeyName(), getTitle(), getDescription(),
                new FloatParameterMessage(defaultValue, minimum, maximum));
    }

    static Double floatToWire(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" to a wire value as the type is "
                + describe(value) + " while a float was expected.");
    }

    static Double floatFromWire(Object value) {
        if (value instanceof Double) {
            return (Double) value;
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire value as the type is "
                + describe(value) + " while a float was expected.");
    }
}
