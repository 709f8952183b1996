package com.omotes.workflow.parameter;

import com.fasterxml.jackson.databind.JsonNode;
import com.omotes.protocol.workflow.WorkflowParameterMessage;

import java.util.Objects;

/**
 * A non-ESDL input of a workflow. The set of variants is closed: {@link StringParameter},
 * {@link BooleanParameter}, {@link IntegerParameter}, {@link FloatParameter} and
 * {@link DateTimeParameter}; {@link ParameterKind} maps each to its configuration name and wire tag.
 * <p>
 * Two parameters are equal when they are the same variant with the same key name. Title,
 * description, default and bounds are display or validation metadata and do not take part.
 */
public abstract class WorkflowParameter {

    private final String keyName;
    private final String title;
    private final String description;

    WorkflowParameter(String keyName, String title, String description) {
        this.keyName = Objects.requireNonNull(keyName, "keyName");
        this.title = title;
        this.description = description;
    }

    public String getKeyName() {
        return keyName;
    }

    /** Display title overriding the key name; may be null. */
    public String getTitle() {
        return title;
    }

    /** Description shown below the input field; may be null. */
    public String getDescription() {
        return description;
    }

    public abstract ParameterKind getKind();

    /** Wire form of this parameter, with exactly the variant field of {@link #getKind()} set. */
    public abstract WorkflowParameterMessage toWireMessage();

    /**
     * Converts a runtime value of this parameter to its wire scalar.
     *
     * @throws WrongFieldTypeException when the value is not of the runtime type of this variant
     */
    public Object toWireValue(Object value) {
        return getKind().toWireValue(value);
    }

    /**
     * Converts a wire scalar to the runtime type of this parameter.
     *
     * @throws WrongFieldTypeException when the wire value has an incompatible kind
     */
    public Object fromWireValue(Object value) {
        return getKind().fromWireValue(value);
    }

    static String requiredText(JsonNode config, String field, String parameterClass) {
        JsonNode node = config.get(field);
        if (node == null || node.isNull()) {
            throw new MissingFieldException(field, "'" + field + "' is required for " + parameterClass);
        }
        if (!node.isTextual()) {
            throw new WrongFieldTypeException("'" + field + "' for " + parameterClass + " must be in 'str' format: '" + node.asText() + "'");
        }
        return node.textValue();
    }

    static String optionalText(JsonNode config, String field, String parameterClass) {
        JsonNode node = config.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new WrongFieldTypeException("'" + field + "' for " + parameterClass + " must be in 'str' format: '" + node.asText() + "'");
        }
        return node.textValue();
    }

    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return keyName.equals(((WorkflowParameter) o).keyName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), keyName);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{keyName='" + keyName + "'}";
    }
}
