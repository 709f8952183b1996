package com.omotes.workflow.parameter;

/**
 * Thrown when a workflow parameter value or a required configuration field is absent.
 */
public class MissingFieldException extends RuntimeException {

    private final String fieldKey;

    public MissingFieldException(String fieldKey, String message) {
        super(message);
        this.fieldKey = fieldKey;
    }

    /** Key of the missing field. */
    public String getFieldKey() {
        return fieldKey;
    }
}
