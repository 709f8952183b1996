package com.omotes.workflow.parameter;

import com.fasterxml.jackson.databind.JsonNode;
import com.omotes.protocol.workflow.IntegerParameterMessage;
import com.omotes.protocol.workflow.WorkflowParameterMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Whole-number parameter with optional bounds. On the wire integers travel as doubles; a wire
 * value with a fraction is rounded half-to-even with a warning instead of being rejected.
 */
public final class IntegerParameter extends WorkflowParameter {

    private static final Logger log = LoggerFactory.getLogger(IntegerParameter.class);

    private static final String TYPE = "IntegerParameter";

    private final Long defaultValue;
    private final Long minimum;
    private final Long maximum;

    public IntegerParameter(String keyName, String title, String description,
                            Long defaultValue, Long minimum, Long maximum) {
        super(keyName, title, description);
        this.defaultValue = defaultValue;
        this.minimum = minimum;
        this.maximum = maximum;
    }

    /** Default value; null when the parameter has none. */
    public Long getDefaultValue() {
        return defaultValue;
    }

    /** Lower bound; null when unbounded. */
    public Long getMinimum() {
        return minimum;
    }

    /** Upper bound; null when unbounded. */
    public Long getMaximum() {
        return maximum;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.INTEGER;
    }

    public static IntegerParameter fromJsonConfig(JsonNode config) {
        String keyName = requiredText(config, "key_name", TYPE);
        return new IntegerParameter(
                keyName,
                optionalText(config, "title", TYPE),
                optionalText(config, "description", TYPE),
                integerField(config, "default"),
                integerField(config, "minimum"),
                integerField(config, "maximum"));
    }

    private static Long integerField(JsonNode config, String field) {
        JsonNode node = config.get(field);
        if (node == null) {
            return null;
        }
        if (!node.isIntegralNumber()) {
            throw new WrongFieldTypeException("'" + field + "' for IntegerParameter must be in 'int' format: '" + node.asText() + "'");
        }
        return node.longValue();
    }

    public static IntegerParameter fromWireMessage(WorkflowParameterMessage message) {
        IntegerParameterMessage variant = message.getIntegerParameter();
        return new IntegerParameter(message.getKeyName(), message.getTitle(), message.getDescription(),
                variant.getDefaultValue(),
                variant.hasMinimum() ? variant.getMinimum() : null,
                variant.hasMaximum() ? variant.getMaximum() : null);
    }

    @Override
    public WorkflowParameterMessage toWireMessage() {
        return WorkflowParameterMessage.of(getKeyName(), getTitle(), getDescription(),
                new IntegerParameterMessage(defaultValue, minimum, maximum));
    }

    static Double integerToWire(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).doubleValue();
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" to a wire value as the type is "
                + describe(value) + " while an int was expected.");
    }

    static Long integerFromWire(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire int value as it is not finite.");
            }
            double nearest = Math.rint(number);
            if (nearest < Long.MIN_VALUE || nearest >= Long.MAX_VALUE) {
                throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire int value as it is "
                        + "outside the range of a 64-bit integer.");
            }
            long rounded = (long) nearest;
            if (rounded != number) {
                log.warn("A field was passed in workflow configuration but as a float value with decimal instead of "
                        + "a rounded float. Rounding the field value from {} to {}.", number, rounded);
            }
            return rounded;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire int value as the type is "
                + describe(value) + " while an int or float was expected.");
    }
}
