package com.omotes.protocol.workflow;

/** Which variant of the {@link WorkflowParameterMessage} union is populated. */
public enum ParameterTypeCase {
    STRING_PARAMETER("string_parameter"),
    BOOLEAN_PARAMETER("boolean_parameter"),
    INTEGER_PARAMETER("integer_parameter"),
    FLOAT_PARAMETER("float_parameter"),
    DATETIME_PARAMETER("datetime_parameter"),
    NOT_SET("");

    private final String fieldName;

    ParameterTypeCase(String fieldName) {
        this.fieldName = fieldName;
    }

    /** Name of the union field on the wire (e.g. {@code integer_parameter}); empty for {@link #NOT_SET}. */
    public String getFieldName() {
        return fieldName;
    }
}
