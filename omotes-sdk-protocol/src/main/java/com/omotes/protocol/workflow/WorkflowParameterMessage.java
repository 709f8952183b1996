package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Wire form of one workflow parameter: common fields plus a tagged union over the five
 * parameter variants. At most one variant field is set; see {@link #getParameterTypeCase()}.
 */
public final class WorkflowParameterMessage {

    private final String keyName;
    private final String title;
    private final String description;
    private final StringParameterMessage stringParameter;
    private final BooleanParameterMessage booleanParameter;
    private final IntegerParameterMessage integerParameter;
    private final FloatParameterMessage floatParameter;
    private final DateTimeParameterMessage datetimeParameter;

    @JsonCreator
    public WorkflowParameterMessage(
            @JsonProperty("key_name") String keyName,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("string_parameter") StringParameterMessage stringParameter,
            @JsonProperty("boolean_parameter") BooleanParameterMessage booleanParameter,
            @JsonProperty("integer_parameter") IntegerParameterMessage integerParameter,
            @JsonProperty("float_parameter") FloatParameterMessage floatParameter,
            @JsonProperty("datetime_parameter") DateTimeParameterMessage datetimeParameter) {
        int populated = (stringParameter != null ? 1 : 0)
                + (booleanParameter != null ? 1 : 0)
                + (integerParameter != null ? 1 : 0)
                + (floatParameter != null ? 1 : 0)
                + (datetimeParameter != null ? 1 : 0);
        if (populated > 1) {
            throw new IllegalArgumentException("Workflow parameter '" + keyName + "' has " + populated + " parameter types set; expected one");
        }
        this.keyName = keyName;
        this.title = title;
        this.description = description;
        this.stringParameter = stringParameter;
        this.booleanParameter = booleanParameter;
        this.integerParameter = integerParameter;
        this.floatParameter = floatParameter;
        this.datetimeParameter = datetimeParameter;
    }

    /**
     * Creates a parameter message with the variant field matching the class of {@code parameterType}.
     *
     * @param parameterType one of the five variant messages
     * @throws IllegalArgumentException for any other class
     */
    public static WorkflowParameterMessage of(String keyName, String title, String description, Object parameterType) {
        if (parameterType instanceof StringParameterMessage) {
            return new WorkflowParameterMessage(keyName, title, description, (StringParameterMessage) parameterType, null, null, null, null);
        }
        if (parameterType instanceof BooleanParameterMessage) {
            return new WorkflowParameterMessage(keyName, title, description, null, (BooleanParameterMessage) parameterType, null, null, null);
        }
        if (parameterType instanceof IntegerParameterMessage) {
            return new WorkflowParameterMessage(keyName, title, description, null, null, (IntegerParameterMessage) parameterType, null, null);
        }
        if (parameterType instanceof FloatParameterMessage) {
            return new WorkflowParameterMessage(keyName, title, description, null, null, null, (FloatParameterMessage) parameterType, null);
        }
        if (parameterType instanceof DateTimeParameterMessage) {
            return new WorkflowParameterMessage(keyName, title, description, null, null, null, null, (DateTimeParameterMessage) parameterType);
        }
        throw new IllegalArgumentException("Unknown parameter type message: "
                + (parameterType != null ? parameterType.getClass().getName() : "null"));
    }

    @JsonProperty("key_name")
    public String getKeyName() {
        return keyName;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("string_parameter")
    public StringParameterMessage getStringParameter() {
        return stringParameter;
    }

    @JsonProperty("boolean_parameter")
    public BooleanParameterMessage getBooleanParameter() {
        return booleanParameter;
    }

    @JsonProperty("integer_parameter")
    public IntegerParameterMessage getIntegerParameter() {
        return integerParameter;
    }

    @JsonProperty("float_parameter")
    public FloatParameterMessage getFloatParameter() {
        return floatParameter;
    }

    @JsonProperty("datetime_parameter")
    public DateTimeParameterMessage getDatetimeParameter() {
        return datetimeParameter;
    }

    @JsonIgnore
    public ParameterTypeCase getParameterTypeCase() {
        if (stringParameter != null) return ParameterTypeCase.STRING_PARAMETER;
        if (booleanParameter != null) return ParameterTypeCase.BOOLEAN_PARAMETER;
        if (integerParameter != null) return ParameterTypeCase.INTEGER_PARAMETER;
        if (floatParameter != null) return ParameterTypeCase.FLOAT_PARAMETER;
        if (datetimeParameter != null) return ParameterTypeCase.DATETIME_PARAMETER;
        return ParameterTypeCase.NOT_SET;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowParameterMessage that = (WorkflowParameterMessage) o;
        return Objects.equals(keyName, that.keyName)
                && Objects.equals(title, that.title)
                && Objects.equals(description, that.description)
                && Objects.equals(stringParameter, that.stringParameter)
                && Objects.equals(booleanParameter, that.booleanParameter)
                && Objects.equals(integerParameter, that.integerParameter)
                && Objects.equals(floatParameter, that.floatParameter)
                && Objects.equals(datetimeParameter, that.datetimeParameter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyName, title, description, stringParameter, booleanParameter,
                integerParameter, floatParameter, datetimeParameter);
    }
}
