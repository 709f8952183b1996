package com.omotes.protocol;

/**
 * Thrown when a wire message cannot be encoded or decoded, or when a decoded message violates the
 * protocol (e.g. a workflow parameter without a parameter type). Fatal to the handling of that one
 * message only.
 */
public final class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
