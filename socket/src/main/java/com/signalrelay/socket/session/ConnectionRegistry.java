package com.signalrelay.socket.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks every live signaling connection on this node.
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    // Live connections: connection id -> connection
    private final Map<String, SignalingConnection> connections = new ConcurrentHashMap<>();

    public void register(SignalingConnection connection) {
        connections.put(connection.getId(), connection);
    }

    public boolean unregister(SignalingConnection connection) {
        return connections.remove(connection.getId(), connection);
    }

    public List<SignalingConnection> snapshot() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }

    /**
     * Sends a close frame to every connection (shutdown path).
     */
    public void closeAll() {
        log.info("Closing {} active connections", connections.size());
        snapshot().forEach(SignalingConnection::closeGracefully);
    }
}
