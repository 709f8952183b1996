package com.omotes.protocol.bus;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Publish/subscribe transport over named queues. Implementations own connection management,
 * redelivery and acknowledgement; the SDK only publishes bytes and registers callbacks.
 * <p>
 * Callbacks are dispatched by a single logical consumer loop: one at a time, in publish order
 * per queue. A callback may call {@link #publish}, {@link #subscribe} or {@link #unsubscribe}
 * on the same bus. An exception thrown by a callback is logged by the bus and does not stop
 * delivery of later messages.
 */
public interface MessageBus extends AutoCloseable {

    /** Connects the transport and starts the consumer loop. */
    void start();

    /**
     * Publishes a message to the queue. Returns without waiting for a consumer.
     *
     * @param queueName target queue
     * @param message   encoded message
     */
    void publish(String queueName, byte[] message);

    /**
     * Delivers every message arriving on the queue to the callback until {@link #unsubscribe} is called.
     * Replaces any existing subscription on the same queue.
     */
    void subscribe(String queueName, Consumer<byte[]> onMessage);

    /**
     * Removes the subscription (continuous or receive-once) on the queue. No-op when none exists.
     */
    void unsubscribe(String queueName);

    /**
     * Delivers exactly one message from the queue to {@code onMessage}, then stops consuming it.
     *
     * @param queueName queue to consume from
     * @param timeout   how long to wait; {@code null} waits indefinitely
     * @param onMessage called with the single message
     * @param onTimeout called when the timeout elapses before a message arrives; may be null
     */
    void receiveOnce(String queueName, Duration timeout, Consumer<byte[]> onMessage, Runnable onTimeout);

    /** Stops the consumer loop and releases the transport. */
    @Override
    void close();
}
