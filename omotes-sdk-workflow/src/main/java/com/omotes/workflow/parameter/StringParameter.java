package com.omotes.workflow.parameter;

import com.fasterxml.jackson.databind.JsonNode;
import com.omotes.protocol.workflow.StringEnumMessage;
import com.omotes.protocol.workflow.StringParameterMessage;
import com.omotes.protocol.workflow.WorkflowParameterMessage;

import java.util.ArrayList;
import java.util.List;

/** Free-text or multiple-choice parameter. Enum options keep their configured order. */
public final class StringParameter extends WorkflowParameter {

    private static final String TYPE = "StringParameter";

    private final String defaultValue;
    private final List<StringEnumOption> enumOptions;

    public StringParameter(String keyName, String title, String description,
                           String defaultValue, List<StringEnumOption> enumOptions) {
        super(keyName, title, description);
        this.defaultValue = defaultValue;
        this.enumOptions = enumOptions != null ? List.copyOf(enumOptions) : List.of();
    }

    public StringParameter(String keyName) {
        this(keyName, null, null, null, null);
    }

    /** Default value; null when the parameter has none. */
    public String getDefaultValue() {
        return defaultValue;
    }

    /** Allowed choices; empty for a free-text parameter. */
    public List<StringEnumOption> getEnumOptions() {
        return enumOptions;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.STRING;
    }

    /**
     * @throws WrongFieldTypeException when {@code default} is not a string, {@code enum_options} is
     *                                 not a list, or an option lacks {@code key_name}/{@code display_name}
     */
    public static StringParameter fromJsonConfig(JsonNode config) {
        String keyName = requiredText(config, "key_name", TYPE);
        JsonNode defaultNode = config.get("default");
        if (defaultNode != null && !defaultNode.isTextual()) {
            throw new WrongFieldTypeException("'default' for StringParameter must be in 'str' format");
        }
        List<StringEnumOption> options = null;
        JsonNode optionsNode = config.get("enum_options");
        if (optionsNode != null) {
            if (!optionsNode.isArray()) {
                throw new WrongFieldTypeException("'enum_options' for StringParameter must be a 'list'");
            }
            options = new ArrayList<>();
            for (JsonNode option : optionsNode) {
                options.add(new StringEnumOption(enumField(option, "key_name"), enumField(option, "display_name")));
            }
        }
        return new StringParameter(
                keyName,
                optionalText(config, "title", TYPE),
                optionalText(config, "description", TYPE),
                defaultNode != null ? defaultNode.textValue() : null,
                options);
    }

    private static String enumField(JsonNode option, String field) {
        JsonNode node = option.get(field);
        if (node == null) {
            throw new WrongFieldTypeException("A string enum option must contain a '" + field + "'");
        }
        if (!node.isTextual()) {
            throw new WrongFieldTypeException("'" + field + "' for a string enum option must be in 'str' format: '" + node.asText() + "'");
        }
        return node.textValue();
    }

    public static StringParameter fromWireMessage(WorkflowParameterMessage message) {
        StringParameterMessage variant = message.getStringParameter();
        List<StringEnumOption> options = new ArrayList<>();
        for (StringEnumMessage option : variant.getEnumOptions()) {
            options.add(new StringEnumOption(option.getKeyName(), option.getDisplayName()));
        }
        return new StringParameter(message.getKeyName(), message.getTitle(), message.getDescription(),
                variant.getDefaultValue(), options);
    }

    @Override
    public WorkflowParameterMessage toWireMessage() {
        List<StringEnumMessage> options = new ArrayList<>();
        for (StringEnumOption option : enumOptions) {
            options.add(new StringEnumMessage(option.getKeyName(), option.getDisplayName()));
        }
        return WorkflowParameterMessage.of(getKeyName(), getTitle(), getDescription(),
                new StringParameterMessage(defaultValue, options));
    }

    static String stringToWire(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" to a wire value as the type is "
                + describe(value) + " while a string was expected.");
    }

    static String stringFromWire(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        throw new WrongFieldTypeException("Cannot convert value \"" + value + "\" from a wire value as the type is "
                + describe(value) + " while a string was expected.");
    }
}
