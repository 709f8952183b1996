package com.omotes.broker;

/**
 * Thrown when the message broker cannot be reached or rejects an operation.
 */
public class BrokerException extends RuntimeException {

    private final String queueName;

    public BrokerException(String message, String queueName, Throwable cause) {
        super(message, cause);
        this.queueName = queueName;
    }

    public BrokerException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /** Queue involved in the failed operation; null for connection-level failures. */
    public String getQueueName() {
        return queueName;
    }
}
