package com.composeops.core.events;

import com.composeops.core.connection.ConnectionNotFoundException;
import com.composeops.core.connection.ConnectionRegistry;
import com.composeops.core.connection.EventChannel;
import com.composeops.core.metrics.ComposeOpsMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory publish/subscribe registry fanning operation updates out to connections.
 * <p>
 * Subscriptions relate a connection id to an operation id (many-to-many). {@link #publish}
 * only queues: every connection has a bounded outbox drained by a broadcaster thread, so a
 * slow or stalled connection never holds up the publisher or the other subscribers. Payloads
 * reach a connection in the order they were published. Delivery is best-effort: a failing
 * connection is logged and skipped, and a full outbox drops the update.
 */
@Service
public class GroupBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(GroupBroadcaster.class);

    static final int MAX_PENDING_PER_CONNECTION = 1024;

    private final ConnectionRegistry connections;
    private final ComposeOpsMetrics metrics;

    /** Subscribers per operation id. */
    private final ConcurrentHashMap<String, Topic> topics = new ConcurrentHashMap<>();

    /** Operation ids per connection. Memberships change only inside this map's compute calls. */
    private final ConcurrentHashMap<String, Set<String>> connectionTopics = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, Outbox> outboxes = new ConcurrentHashMap<>();

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "broadcast-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public GroupBroadcaster(ConnectionRegistry connections, ComposeOpsMetrics metrics) {
        this.connections = connections;
        this.metrics = metrics;
    }

    /**
     * Subscribes a live connection to updates for an operation. Idempotent.
     *
     * @throws ConnectionNotFoundException if the connection is unknown or disconnects meanwhile
     */
    public void subscribe(String connectionId, String operationId) {
        connections.require(connectionId);
        connectionTopics.compute(connectionId, (cid, ids) -> {
            // the hub unregisters the channel before dropping memberships
            if (!connections.isConnected(cid)) {
                throw new ConnectionNotFoundException(cid);
            }
            Set<String> target = ids != null ? ids : ConcurrentHashMap.newKeySet();
            target.add(operationId);
            topics.compute(operationId, (id, topic) -> {
                Topic t = topic != null ? topic : new Topic(id);
                t.members.add(cid);
                return t;
            });
            return target;
        });
        log.info("Connection {} subscribed to operation {}", connectionId, operationId);
    }

    /**
     * Removes one subscription. Idempotent.
     */
    public void unsubscribe(String connectionId, String operationId) {
        if (connectionId == null) {
            return;
        }
        connectionTopics.computeIfPresent(connectionId, (cid, ids) -> {
            ids.remove(operationId);
            removeMembership(cid, operationId);
            return ids.isEmpty() ? null : ids;
        });
        log.info("Connection {} unsubscribed from operation {}", connectionId, operationId);
    }

    /**
     * Removes every subscription held by a connection and discards its pending updates.
     */
    public void onDisconnect(String connectionId) {
        if (connectionId == null) {
            return;
        }
        var dropped = new AtomicInteger();
        connectionTopics.computeIfPresent(connectionId, (cid, ids) -> {
            for (String operationId : ids) {
                removeMembership(cid, operationId);
            }
            dropped.set(ids.size());
            return null;
        });
        Outbox outbox = outboxes.remove(connectionId);
        if (outbox != null) {
            outbox.discard();
        }
        if (dropped.get() > 0) {
            log.debug("Dropped {} subscription(s) of connection {}", dropped.get(), connectionId);
        }
    }

    /**
     * Queues a payload for every connection currently subscribed to the operation. Never
     * blocks on a connection.
     *
     * @return number of connections the payload was queued for
     */
    public int publish(String operationId, OperationProgress payload) {
        Topic topic = topics.get(operationId);
        if (topic == null) {
            return 0;
        }
        return topic.enqueue(payload);
    }

    public Set<String> subscribers(String operationId) {
        Topic topic = topics.get(operationId);
        return topic != null ? Set.copyOf(topic.members) : Set.of();
    }

    public Set<String> subscriptionsOf(String connectionId) {
        Set<String> ids = connectionId != null ? connectionTopics.get(connectionId) : null;
        return ids != null ? Set.copyOf(ids) : Set.of();
    }

    public int pendingDeliveries(String connectionId) {
        Outbox outbox = connectionId != null ? outboxes.get(connectionId) : null;
        return outbox != null ? outbox.queue.size() : 0;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Group broadcaster stopped");
    }

    private void removeMembership(String connectionId, String operationId) {
        topics.computeIfPresent(operationId, (id, topic) -> {
            topic.members.remove(connectionId);
            return topic.members.isEmpty() ? null : topic;
        });
    }

    private record Delivery(String operationId, OperationProgress payload) {}

    private final class Topic {

        private final String operationId;
        private final CopyOnWriteArraySet<String> members = new CopyOnWriteArraySet<>();

        private Topic(String operationId) {
            this.operationId = operationId;
        }

        /** Serialised so every connection queues concurrent publishes in the same order. */
        private synchronized int enqueue(OperationProgress payload) {
            var delivery = new Delivery(operationId, payload);
            int queued = 0;
            for (String connectionId : members) {
                if (!connections.isConnected(connectionId)) {
                    continue;
                }
                if (outboxes.computeIfAbsent(connectionId, Outbox::new).offer(delivery)) {
                    queued++;
                }
            }
            log.debug("Queued progress for operation {} to {} connection(s)", operationId, queued);
            return queued;
        }
    }

    /**
     * Ordered pending updates for one connection. At most one broadcaster thread drains it at a time.
     */
    private final class Outbox {

        private final String connectionId;
        private final ArrayBlockingQueue<Delivery> queue = new ArrayBlockingQueue<>(MAX_PENDING_PER_CONNECTION);
        private final AtomicBoolean draining = new AtomicBoolean();

        private Outbox(String connectionId) {
            this.connectionId = connectionId;
        }

        private boolean offer(Delivery delivery) {
            if (!queue.offer(delivery)) {
                metrics.recordBroadcastFailure();
                log.warn("Dropped progress for operation {} to connection {}: {} update(s) already pending",
                        delivery.operationId(), connectionId, queue.size());
                return false;
            }
            schedule();
            return true;
        }

        private void schedule() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.debug("Broadcaster stopped, {} update(s) for connection {} not delivered",
                        queue.size(), connectionId);
            }
        }

        private void drain() {
            try {
                Delivery delivery;
                while ((delivery = queue.poll()) != null) {
                    deliver(delivery);
                }
            } finally {
                draining.set(false);
                if (!connections.isConnected(connectionId)) {
                    discard();
                    outboxes.remove(connectionId, this);
                } else if (!queue.isEmpty()) {
                    schedule();
                }
            }
        }

        private void deliver(Delivery delivery) {
            Optional<EventChannel> channel = connections.find(connectionId);
            if (channel.isEmpty()) {
                queue.clear();
                return;
            }
            try {
                channel.get().send(OperationProgress.EVENT_NAME, delivery.payload());
            } catch (Exception e) {
                metrics.recordBroadcastFailure();
                log.warn("Failed to deliver progress for operation {} to connection {}: {}",
                        delivery.operationId(), connectionId, e.getMessage());
            }
        }

        private void discard() {
            queue.clear();
        }
    }
}
