package com.composeops.core.connection;

import com.composeops.core.events.GroupBroadcaster;
import com.composeops.core.logging.MdcContext;
import com.composeops.core.streaming.StreamCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the transport layer: opens connections and tears down everything a
 * connection owns when it drops.
 */
@Service
public class ConnectionHub {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHub.class);

    private final ConnectionRegistry registry;
    private final StreamCoordinator streams;
    private final GroupBroadcaster broadcaster;

    public ConnectionHub(ConnectionRegistry registry, StreamCoordinator streams, GroupBroadcaster broadcaster) {
        this.registry = registry;
        this.streams = streams;
        this.broadcaster = broadcaster;
    }

    public String connect(EventChannel channel) {
        String connectionId = registry.register(channel);
        log.info("Connection {} opened (active={})", connectionId, registry.size());
        return connectionId;
    }

    /**
     * Releases the connection's stream and subscriptions. Safe to call more than once and from
     * any thread. The channel is unregistered first so that concurrent subscribe or start
     * calls observe the disconnect and undo themselves.
     */
    public void disconnect(String connectionId) {
        if (connectionId == null) {
            return;
        }
        MdcContext.setConnection(connectionId);
        try {
            boolean known = registry.unregister(connectionId);
            try {
                streams.onDisconnect(connectionId);
            } catch (RuntimeException e) {
                log.error("Failed to stop stream for connection {}", connectionId, e);
            }
            try {
                broadcaster.onDisconnect(connectionId);
            } catch (RuntimeException e) {
                log.error("Failed to drop subscriptions for connection {}", connectionId, e);
            }
            if (known) {
                log.info("Connection {} closed (active={})", connectionId, registry.size());
            }
        } finally {
            MdcContext.clear();
        }
    }

    public boolean isConnected(String connectionId) {
        return registry.isConnected(connectionId);
    }

    public int activeConnections() {
        return registry.size();
    }
}
