package com.omotes.workflow.parameter;

/**
 * Thrown when a value or a configuration field has the wrong type for a workflow parameter.
 */
public class WrongFieldTypeException extends RuntimeException {

    public WrongFieldTypeException(String message) {
        super(message);
    }

    public WrongFieldTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
