package com.omotes.broker;

import com.omotes.protocol.bus.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * In-process {@link MessageBus} for tests and single-JVM deployments.
 * <p>
 * Callbacks run on the publishing thread, one at a time. A message published from inside a callback
 * is delivered after that callback returns, in global publish order. Messages for a queue without a
 * consumer are kept until one subscribes. Receive-once timeouts fire on an internal scheduler thread.
 */
public final class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final Deque<Envelope> inbox = new ArrayDeque<>();
    private final Map<String, Deque<byte[]>> parked = new HashMap<>();
    private final Map<String, Subscription> subscriptions = new HashMap<>();
    private ScheduledExecutorService scheduler;
    private boolean dispatching;
    private boolean closed;

    @Override
    public synchronized void start() {
        ensureOpen(null);
        log.info("In-memory message bus started");
    }

    @Override
    public synchronized void publish(String queueName, byte[] message) {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(message, "message");
        ensureOpen(queueName);
        log.debug("Publishing {} byte(s) to queue {}", message.length, queueName);
        inbox.addLast(new Envelope(queueName, message.clone()));
        dispatch();
    }

    @Override
    public synchronized void subscribe(String queueName, Consumer<byte[]> onMessage) {
        Objects.requireNonNull(onMessage, "onMessage");
        ensureOpen(queueName);
        register(queueName, new Subscription(onMessage, false, null));
        log.debug("Subscribed to queue {}", queueName);
        dispatch();
    }

    @Override
    public synchronized void unsubscribe(String queueName) {
        Subscription removed = subscriptions.remove(queueName);
        if (removed != null) {
            removed.cancelTimeout();
            log.debug("Unsubscribed from queue {}", queueName);
        }
    }

    @Override
    public synchronized void receiveOnce(String queueName, Duration timeout, Consumer<byte[]> onMessage, Runnable onTimeout) {
        Objects.requireNonNull(onMessage, "onMessage");
        ensureOpen(queueName);
        Subscription subscription = new Subscription(onMessage, true, onTimeout);
        register(queueName, subscription);
        if (timeout != null) {
            subscription.timeout = scheduler().schedule(() -> expire(queueName, subscription),
                    Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        }
        log.debug("Waiting for one message on queue {} (timeout {})", queueName, timeout);
        dispatch();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Subscription subscription : subscriptions.values()) {
            subscription.cancelTimeout();
        }
        subscriptions.clear();
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        log.info("In-memory message bus closed");
    }

    /** Number of messages published to the queue that no consumer has taken yet. */
    public synchronized int pendingCount(String queueName) {
        int count = 0;
        for (Envelope envelope : inbox) {
            if (envelope.queueName.equals(queueName)) {
                count++;
            }
        }
        Deque<byte[]> waiting = parked.get(queueName);
        return count + (waiting != null ? waiting.size() : 0);
    }

    /** Queues that currently have a continuous or receive-once consumer. */
    public synchronized Set<String> subscribedQueues() {
        return Set.copyOf(subscriptions.keySet());
    }

    private void register(String queueName, Subscription subscription) {
        Subscription previous = subscriptions.put(queueName, subscription);
        if (previous != null) {
            previous.cancelTimeout();
        }
        Deque<byte[]> waiting = parked.remove(queueName);
        if (waiting != null) {
            Iterator<byte[]> newestFirst = waiting.descendingIterator();
            while (newestFirst.hasNext()) {
                inbox.addFirst(new Envelope(queueName, newestFirst.next()));
            }
        }
    }

    private void dispatch() {
        if (dispatching) {
            return;
        }
        dispatching = true;
        try {
            Envelope envelope;
            while (!closed && (envelope = inbox.pollFirst()) != null) {
                Subscription subscription = subscriptions.get(envelope.queueName);
                if (subscription == null) {
                    parked.computeIfAbsent(envelope.queueName, q -> new ArrayDeque<>()).addLast(envelope.message);
                    continue;
                }
                if (subscription.once) {
                    subscriptions.remove(envelope.queueName);
                    subscription.cancelTimeout();
                }
                try {
                    subscription.onMessage.accept(envelope.message);
                } catch (RuntimeException e) {
                    log.error("Callback for queue {} failed: {}", envelope.queueName, e.getMessage(), e);
                }
            }
        } finally {
            dispatching = false;
        }
    }

    private synchronized void expire(String queueName, Subscription subscription) {
        if (closed || subscriptions.get(queueName) != subscription) {
            return;
        }
        subscriptions.remove(queueName);
        log.debug("Timed out waiting for a message on queue {}", queueName);
        if (subscription.onTimeout != null) {
            dispatching = true;
            try {
                subscription.onTimeout.run();
            } catch (RuntimeException e) {
                log.error("Timeout callback for queue {} failed: {}", queueName, e.getMessage(), e);
            } finally {
                dispatching = false;
            }
        }
        dispatch();
    }

    private ScheduledExecutorService scheduler() {
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "omotes-inmemory-bus-timeouts");
                t.setDaemon(true);
                return t;
            });
        }
        return scheduler;
    }

    private void ensureOpen(String queueName) {
        if (closed) {
            throw new BrokerException("Message bus is closed", queueName, null);
        }
    }

    private static final class Envelope {
        private final String queueName;
        private final byte[] message;

        private Envelope(String queueName, byte[] message) {
            this.queueName = queueName;
            this.message = message;
        }
    }

    private static final class Subscription {
        private final Consumer<byte[]> onMessage;
        private final boolean once;
        private final Runnable onTimeout;
        private ScheduledFuture<?> timeout;

        private Subscription(Consumer<byte[]> onMessage, boolean once, Runnable onTimeout) {
            this.onMessage = onMessage;
            this.once = once;
            this.onTimeout = onTimeout;
        }

        private void cancelTimeout() {
            if (timeout != null) {
                timeout.cancel(false);
            }
        }
    }
}
