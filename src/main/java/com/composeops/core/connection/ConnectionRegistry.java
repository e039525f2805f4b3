package com.composeops.core.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live client connections keyed by connection id.
 * <p>
 * Only tracks the outbound channel; stream sessions and subscriptions are owned by
 * their respective services and torn down through {@link ConnectionHub#disconnect(String)}.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<String, EventChannel> channels = new ConcurrentHashMap<>();

    /**
     * Registers a channel under a freshly generated connection id.
     */
    public String register(EventChannel channel) {
        String connectionId = UUID.randomUUID().toString();
        channels.put(connectionId, channel);
        log.debug("Registered connection {} (total={})", connectionId, channels.size());
        return connectionId;
    }

    /**
     * Registers a channel under a caller-chosen id, replacing any previous channel for it.
     */
    public void register(String connectionId, EventChannel channel) {
        channels.put(connectionId, channel);
        log.debug("Registered connection {} (total={})", connectionId, channels.size());
    }

    public boolean unregister(String connectionId) {
        boolean removed = channels.remove(connectionId) != null;
        if (removed) {
            log.debug("Unregistered connection {} (total={})", connectionId, channels.size());
        }
        return removed;
    }

    public Optional<EventChannel> find(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(channels.get(connectionId));
    }

    public EventChannel require(String connectionId) {
        return find(connectionId).orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    public boolean isConnected(String connectionId) {
        return connectionId != null && channels.containsKey(connectionId);
    }

    public Set<String> connectionIds() {
        return Set.copyOf(channels.keySet());
    }

    public int size() {
        return channels.size();
    }
}
