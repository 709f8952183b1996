/**
 * Transports implementing {@link com.omotes.protocol.bus.MessageBus}.
 *
 * <ul>
 *   <li>{@link com.omotes.broker.InMemoryMessageBus} – in-process queues for tests and single-JVM use</li>
 *   <li>{@link com.omotes.broker.RedisMessageBus} – Redis lists via Jedis</li>
 *   <li>{@link com.omotes.broker.BrokerConfig} – connection settings from the environment</li>
 * </ul>
 */
package com.omotes.broker;
