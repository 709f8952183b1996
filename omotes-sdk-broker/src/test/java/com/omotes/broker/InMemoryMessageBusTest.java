package com.omotes.broker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryMessageBusTest {

    private InMemoryMessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
        bus.start();
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Test
    void subscribe_deliversInPublishOrder() {
        List<String> received = new ArrayList<>();
        bus.subscribe("q", m -> received.add(text(m)));

        bus.publish("q", bytes("1"));
        bus.publish("q", bytes("2"));
        bus.publish("q", bytes("3"));

        assertEquals(List.of("1", "2", "3"), received);
    }

    @Test
    void publish_withoutConsumer_isKeptUntilSubscribe() {
        bus.publish("q", bytes("early"));
        bus.publish("q", bytes("later"));
        assertEquals(2, bus.pendingCount("q"));

        List<String> received = new ArrayList<>();
        bus.subscribe("q", m -> received.add(text(m)));

        assertEquals(List.of("early", "later"), received);
        assertEquals(0, bus.pendingCount("q"));
    }

    @Test
    void publishFromCallback_isDeliveredAfterTheCallbackReturns() {
        List<String> events = new ArrayList<>();
        bus.subscribe("a", m -> {
            events.add("a:start");
            bus.publish("b", bytes("from-a"));
            events.add("a:end");
        });
        bus.subscribe("b", m -> events.add("b:" + text(m)));

        bus.publish("a", bytes("go"));

        assertEquals(List.of("a:start", "a:end", "b:from-a"), events);
    }

    @Test
    void receiveOnce_takesExactlyOneMessage() {
        List<String> received = new ArrayList<>();
        bus.receiveOnce("result", null, m -> received.add(text(m)), null);

        bus.publish("result", bytes("first"));
        bus.publish("result", bytes("second"));

        assertEquals(List.of("first"), received);
        assertEquals(1, bus.pendingCount("result"));
        assertTrue(bus.subscribedQueues().isEmpty());
    }

    @Test
    void unsubscribe_stopsDeliveryAndCancelsReceiveOnce() {
        List<String> received = new ArrayList<>();
        bus.subscribe("progress", m -> received.add(text(m)));
        bus.receiveOnce("result", null, m -> received.add(text(m)), null);

        bus.unsubscribe("progress");
        bus.unsubscribe("result");
        bus.unsubscribe("never-subscribed");
        bus.publish("progress", bytes("p"));
        bus.publish("result", bytes("r"));

        assertTrue(received.isEmpty());
        assertEquals(Set.of(), bus.subscribedQueues());
    }

    @Test
    void unsubscribeFromOwnCallback_stopsFurtherDelivery() {
        List<String> received = new ArrayList<>();
        bus.subscribe("q", m -> {
            received.add(text(m));
            bus.unsubscribe("q");
        });

        bus.publish("q", bytes("1"));
        bus.publish("q", bytes("2"));

        assertEquals(List.of("1"), received);
        assertEquals(1, bus.pendingCount("q"));
    }

    @Test
    void failingCallback_doesNotStopLaterDeliveries() {
        List<String> received = new ArrayList<>();
        bus.subscribe("q", m -> {
            if (text(m).equals("bad")) {
                throw new IllegalStateException("boom");
            }
            received.add(text(m));
        });

        bus.publish("q", bytes("bad"));
        bus.publish("q", bytes("good"));

        assertEquals(List.of("good"), received);
    }

    @Test
    void receiveOnce_timeoutFiresWhenNothingArrives() throws Exception {
        CountDownLatch timedOut = new CountDownLatch(1);
        AtomicInteger delivered = new AtomicInteger();

        bus.receiveOnce("result", Duration.ofMillis(50), m -> delivered.incrementAndGet(), timedOut::countDown);

        assertTrue(timedOut.await(5, TimeUnit.SECONDS));
        bus.publish("result", bytes("late"));
        assertEquals(0, delivered.get());
        assertEquals(1, bus.pendingCount("result"));
    }

    @Test
    void receiveOnce_messageBeforeTimeout_cancelsTimeout() throws Exception {
        CountDownLatch timedOut = new CountDownLatch(1);
        List<String> received = new ArrayList<>();

        bus.receiveOnce("result", Duration.ofMillis(100), m -> received.add(text(m)), timedOut::countDown);
        bus.publish("result", bytes("on time"));

        assertEquals(List.of("on time"), received);
        assertEquals(false, timedOut.await(300, TimeUnit.MILLISECONDS));
    }

    @Test
    void publish_afterClose_throwsBrokerException() {
        bus.close();

        BrokerException e = assertThrows(BrokerException.class, () -> bus.publish("q", bytes("x")));
        assertEquals("q", e.getQueueName());
    }
}
