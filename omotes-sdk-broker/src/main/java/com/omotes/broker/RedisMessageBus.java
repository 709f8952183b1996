package com.omotes.broker;

import com.omotes.protocol.bus.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * {@link MessageBus} on Redis lists. A queue is a list: {@link #publish} appends with RPUSH, and one
 * consumer thread takes messages from all subscribed queues with a blocking BLPOP, so callbacks run
 * sequentially on that thread and each queue is consumed in order. Messages published while nobody
 * consumes a queue stay in its list.
 */
public final class RedisMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(RedisMessageBus.class);

    private static final long RECONNECT_BACKOFF_MS = 1_000L;

    private final BrokerConfig config;
    private final JedisPool pool;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private volatile boolean running;
    private Thread consumer;

    public RedisMessageBus(BrokerConfig config) {
        this(config, new JedisPoolConfig());
    }

    public RedisMessageBus(BrokerConfig config, JedisPoolConfig poolConfig) {
        this.config = Objects.requireNonNull(config, "config");
        this.pool = new JedisPool(poolConfig, config.getHost(), config.getPort());
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        try (Jedis jedis = pool.getResource()) {
            jedis.ping();
        } catch (JedisException e) {
            throw new BrokerException("Cannot connect to broker at " + config.getHost() + ":" + config.getPort(), e);
        }
        running = true;
        consumer = new Thread(this::consumeLoop, "omotes-redis-bus-consumer");
        consumer.setDaemon(true);
        consumer.start();
        log.info("Redis message bus connected to {}:{}", config.getHost(), config.getPort());
    }

    @Override
    public void publish(String queueName, byte[] message) {
        Objects.requireNonNull(message, "message");
        try (Jedis jedis = pool.getResource()) {
            jedis.rpush(key(queueName), message);
            log.debug("Published {} byte(s) to queue {}", message.length, queueName);
        } catch (JedisException e) {
            throw new BrokerException("Failed to publish to queue " + queueName, queueName, e);
        }
    }

    @Override
    public void subscribe(String queueName, Consumer<byte[]> onMessage) {
        Objects.requireNonNull(onMessage, "onMessage");
        subscriptions.put(queueName, new Subscription(onMessage, false, 0L, null));
        log.debug("Subscribed to queue {}", queueName);
    }

    @Override
    public void unsubscribe(String queueName) {
        if (subscriptions.remove(queueName) != null) {
            log.debug("Unsubscribed from queue {}", queueName);
        }
    }

    @Override
    public void receiveOnce(String queueName, Duration timeout, Consumer<byte[]> onMessage, Runnable onTimeout) {
        Objects.requireNonNull(onMessage, "onMessage");
        long deadline = timeout != null ? System.currentTimeMillis() + Math.max(0, timeout.toMillis()) : 0L;
        subscriptions.put(queueName, new Subscription(onMessage, true, deadline, onTimeout));
        log.debug("Waiting for one message on queue {} (timeout {})", queueName, timeout);
    }

    @Override
    public void close() {
        Thread toJoin;
        synchronized (this) {
            running = false;
            toJoin = consumer;
            consumer = null;
        }
        if (toJoin != null && toJoin != Thread.currentThread()) {
            try {
                toJoin.join((config.getPollTimeoutSeconds() + 1) * 1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        subscriptions.clear();
        pool.close();
        log.info("Redis message bus closed");
    }

    private void consumeLoop() {
        while (running) {
            expireReceiveOnce();
            List<String> queues = new ArrayList<>(subscriptions.keySet());
            if (queues.isEmpty()) {
                if (!sleep(Math.min(RECONNECT_BACKOFF_MS, config.getPollTimeoutSeconds() * 1000L))) {
                    break;
                }
                continue;
            }
            byte[][] keys = new byte[queues.size()][];
            for (int i = 0; i < keys.length; i++) {
                keys[i] = key(queues.get(i));
            }
            List<byte[]> popped;
            try (Jedis jedis = pool.getResource()) {
                popped = jedis.blpop(config.getPollTimeoutSeconds(), keys);
            } catch (JedisException e) {
                if (!running) {
                    break;
                }
                log.error("Polling the broker failed, retrying in {} ms: {}", RECONNECT_BACKOFF_MS, e.getMessage());
                if (!sleep(RECONNECT_BACKOFF_MS)) {
                    break;
                }
                continue;
            }
            if (popped != null && popped.size() == 2) {
                deliver(new String(popped.get(0), StandardCharsets.UTF_8), popped.get(1));
            }
        }
    }

    private void deliver(String queueName, byte[] message) {
        Subscription subscription = subscriptions.get(queueName);
        if (subscription == null) {
            requeue(queueName, message);
            return;
        }
        if (subscription.once && !subscriptions.remove(queueName, subscription)) {
            requeue(queueName, message);
            return;
        }
        try {
            subscription.onMessage.accept(message);
        } catch (RuntimeException e) {
            log.error("Callback for queue {} failed: {}", queueName, e.getMessage(), e);
        }
    }

    /** Puts a message taken for a consumer that went away back at the head of its queue. */
    private void requeue(String queueName, byte[] message) {
        try (Jedis jedis = pool.getResource()) {
            jedis.lpush(key(queueName), message);
        } catch (JedisException e) {
            log.error("Lost a message on queue {}: requeue failed: {}", queueName, e.getMessage());
        }
    }

    private void expireReceiveOnce() {
        long now = System.currentTimeMillis();
        for (Map.Entry<String, Subscription> entry : subscriptions.entrySet()) {
            Subscription subscription = entry.getValue();
            if (subscription.once && subscription.deadline > 0 && subscription.deadline <= now
                    && subscriptions.remove(entry.getKey(), subscription)) {
                log.debug("Timed out waiting for a message on queue {}", entry.getKey());
                if (subscription.onTimeout != null) {
                    try {
                        subscription.onTimeout.run();
                    } catch (RuntimeException e) {
                        log.error("Timeout callback for queue {} failed: {}", entry.getKey(), e.getMessage(), e);
                    }
                }
            }
        }
    }

    private static byte[] key(String queueName) {
        return Objects.requireNonNull(queueName, "queueName").getBytes(StandardCharsets.UTF_8);
    }

    /** Returns false when interrupted. */
    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class Subscription {
        private final Consumer<byte[]> onMessage;
        private final boolean once;
        private final long deadline;
        private final Runnable onTimeout;

        private Subscription(Consumer<byte[]> onMessage, boolean once, long deadline, Runnable onTimeout) {
            this.onMessage = onMessage;
            this.once = once;
            this.deadline = deadline;
            this.onTimeout = onTimeout;
        }
    }
}
