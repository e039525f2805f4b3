package com.composeops.core.events;

import com.composeops.core.connection.ConnectionNotFoundException;
import com.composeops.core.connection.ConnectionRegistry;
import com.composeops.core.connection.EventChannel;
import com.composeops.core.connection.RecordingChannel;
import com.composeops.core.metrics.ComposeOpsMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class GroupBroadcasterTest {

    private ConnectionRegistry connections;
    private SimpleMeterRegistry meters;
    private GroupBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        connections = new ConnectionRegistry();
        meters = new SimpleMeterRegistry();
        broadcaster = new GroupBroadcaster(connections, new ComposeOpsMetrics(meters));
    }

    @AfterEach
    void tearDown() {
        broadcaster.shutdown();
    }

    /**
     * Channel whose sends block until released.
     */
    static final class BlockingChannel implements EventChannel {

        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public void send(String eventName, Object data) {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private static OperationProgress progress(String operationId, int percent) {
        return new OperationProgress(operationId, "compose_up", "running", percent, "app", null, null);
    }

    private RecordingChannel connect(String connectionId) {
        var channel = new RecordingChannel();
        connections.register(connectionId, channel);
        return channel;
    }

    @Nested
    @DisplayName("Publishing")
    class PublishTests {

        @Test
        @DisplayName("every subscriber receives the payload")
        void fanOut() throws Exception {
            var a = connect("a");
            var b = connect("b");
            var c = connect("c");
            broadcaster.subscribe("a", "op-1");
            broadcaster.subscribe("b", "op-1");

            int queued = broadcaster.publish("op-1", progress("op-1", 50));

            assertEquals(2, queued);
            assertTrue(a.awaitCount(OperationProgress.EVENT_NAME, 1, 5, TimeUnit.SECONDS));
            assertTrue(b.awaitCount(OperationProgress.EVENT_NAME, 1, 5, TimeUnit.SECONDS));
            assertEquals(1, a.count(OperationProgress.EVENT_NAME));
            assertEquals(50, ((OperationProgress) b.events().get(0).data()).progress());
            assertTrue(c.events().isEmpty());
        }

        @Test
        @DisplayName("publishing with no subscribers is a no-op")
        void noSubscribers() {
            assertEquals(0, broadcaster.publish("op-1", progress("op-1", 10)));
        }

        @Test
        @DisplayName("a failing connection does not affect the others")
        void failureIsolation() throws Exception {
            var broken = connect("broken");
            var healthy = connect("healthy");
            broken.failFromNowOn();
            broadcaster.subscribe("broken", "op-1");
            broadcaster.subscribe("healthy", "op-1");

            broadcaster.publish("op-1", progress("op-1", 20));

            assertTrue(healthy.awaitCount(OperationProgress.EVENT_NAME, 1, 5, TimeUnit.SECONDS));
            awaitTrue(() -> meters.find("composeops.broadcast.delivery_failures").counter() != null
                    && meters.get("composeops.broadcast.delivery_failures").counter().count() == 1.0);
        }

        @Test
        @DisplayName("a stalled connection blocks neither the publisher nor other subscribers")
        void stalledConnection() throws Exception {
            var stalled = new BlockingChannel();
            connections.register("stalled", stalled);
            var fast = connect("fast");
            broadcaster.subscribe("stalled", "op-1");
            broadcaster.subscribe("fast", "op-1");

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                broadcaster.publish("op-1", progress("op-1", 10));
                assertTrue(stalled.entered.await(2, TimeUnit.SECONDS));
                broadcaster.publish("op-1", progress("op-1", 20));
            });

            assertTrue(fast.awaitCount(OperationProgress.EVENT_NAME, 2, 5, TimeUnit.SECONDS));
            assertEquals(1, broadcaster.pendingDeliveries("stalled"));
            stalled.release.countDown();
            awaitTrue(() -> broadcaster.pendingDeliveries("stalled") == 0);
        }

        @Test
        @DisplayName("a full outbox drops further updates for that connection")
        void outboxOverflow() throws Exception {
            var stalled = new BlockingChannel();
            connections.register("stalled", stalled);
            broadcaster.subscribe("stalled", "op-1");

            broadcaster.publish("op-1", progress("op-1", 0));
            assertTrue(stalled.entered.await(2, TimeUnit.SECONDS));
            int extra = 5;
            int queued = 0;
            for (int i = 0; i < GroupBroadcaster.MAX_PENDING_PER_CONNECTION + extra; i++) {
                queued += broadcaster.publish("op-1", progress("op-1", 1));
            }

            assertEquals(GroupBroadcaster.MAX_PENDING_PER_CONNECTION, queued);
            assertEquals(extra, meters.get("composeops.broadcast.delivery_failures").counter().count());
            stalled.release.countDown();
        }

        @Test
        @DisplayName("updates for one operation arrive in publish order")
        void ordering() throws Exception {
            var a = connect("a");
            broadcaster.subscribe("a", "op-1");

            for (int i = 0; i <= 100; i += 10) {
                broadcaster.publish("op-1", progress("op-1", i));
            }

            assertTrue(a.awaitCount(OperationProgress.EVENT_NAME, 11, 5, TimeUnit.SECONDS));

            var received = a.events().stream().map(s -> ((OperationProgress) s.data()).progress()).toList();
            assertEquals(IntStream.rangeClosed(0, 10).map(i -> i * 10).boxed().toList(), received);
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class SubscriptionTests {

        @Test
        @DisplayName("subscribing twice delivers once")
        void idempotent() throws Exception {
            var a = connect("a");
            broadcaster.subscribe("a", "op-1");
            broadcaster.subscribe("a", "op-1");

            assertEquals(1, broadcaster.publish("op-1", progress("op-1", 5)));
            broadcaster.subscribe("a", "op-2");
            broadcaster.publish("op-2", progress("op-2", 6));

            assertTrue(a.awaitCount(OperationProgress.EVENT_NAME, 2, 5, TimeUnit.SECONDS));
            assertEquals(2, a.events().size());
        }

        @Test
        @DisplayName("unsubscribed connections stop receiving")
        void unsubscribe() {
            var a = connect("a");
            broadcaster.subscribe("a", "op-1");
            broadcaster.unsubscribe("a", "op-1");

            assertEquals(0, broadcaster.publish("op-1", progress("op-1", 5)));

            assertTrue(a.events().isEmpty());
            assertTrue(broadcaster.subscribers("op-1").isEmpty());
            assertTrue(broadcaster.subscriptionsOf("a").isEmpty());
        }

        @Test
        @DisplayName("unknown connections cannot subscribe")
        void unknownConnection() {
            assertThrows(ConnectionNotFoundException.class, () -> broadcaster.subscribe("ghost", "op-1"));
            assertTrue(broadcaster.subscribers("op-1").isEmpty());
        }

        @Test
        @DisplayName("disconnect drops every subscription of the connection")
        void disconnectCleanup() {
            connect("a");
            connect("b");
            broadcaster.subscribe("a", "op-1");
            broadcaster.subscribe("a", "op-2");
            broadcaster.subscribe("b", "op-1");

            broadcaster.onDisconnect("a");

            assertEquals(Set.of("b"), broadcaster.subscribers("op-1"));
            assertTrue(broadcaster.subscribers("op-2").isEmpty());
            assertTrue(broadcaster.subscriptionsOf("a").isEmpty());
        }

        @Test
        @DisplayName("unregistered connections are skipped at delivery")
        void skipsDeparted() {
            connect("a");
            broadcaster.subscribe("a", "op-1");
            connections.unregister("a");

            assertEquals(0, broadcaster.publish("op-1", progress("op-1", 1)));
        }

        @Test
        @DisplayName("racing subscribe and unsubscribe leave both indexes consistent")
        void concurrentSubscribeUnsubscribe() throws Exception {
            connect("a");
            connect("b");
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            for (int t = 0; t < 8; t++) {
                String connectionId = t % 2 == 0 ? "a" : "b";
                pool.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < 2_000; i++) {
                            String operationId = "op-" + ThreadLocalRandom.current().nextInt(3);
                            if (ThreadLocalRandom.current().nextBoolean()) {
                                broadcaster.subscribe(connectionId, operationId);
                            } else {
                                broadcaster.unsubscribe(connectionId, operationId);
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

            for (String operationId : Set.of("op-0", "op-1", "op-2")) {
                for (String connectionId : Set.of("a", "b")) {
                    assertEquals(broadcaster.subscriptionsOf(connectionId).contains(operationId),
                            broadcaster.subscribers(operationId).contains(connectionId),
                            connectionId + " / " + operationId);
                }
            }

            broadcaster.onDisconnect("a");
            broadcaster.onDisconnect("b");
            for (String operationId : Set.of("op-0", "op-1", "op-2")) {
                assertTrue(broadcaster.subscribers(operationId).isEmpty());
            }
        }

        @Test
        @DisplayName("a connection unregistered before subscribing is rejected and leaves nothing behind")
        void subscribeAfterUnregister() {
            connect("a");
            connections.unregister("a");

            assertThrows(ConnectionNotFoundException.class, () -> broadcaster.subscribe("a", "op-1"));
            assertTrue(broadcaster.subscribers("op-1").isEmpty());
            assertTrue(broadcaster.subscriptionsOf("a").isEmpty());
        }
    }
}
