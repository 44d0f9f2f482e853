package com.signalrelay.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code relay.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: open signaling connections on a socket node.
     */
    public static final String SOCKET_CONNECTIONS_ACTIVE = "relay.socket.connections.active";

    /**
     * Counter: signaling connections accepted.
     */
    public static final String SOCKET_CONNECTIONS_TOTAL = "relay.socket.connections.total";

    /**
     * Gauge: rooms currently held by the registry.
     */
    public static final String SOCKET_ROOMS_ACTIVE = "relay.socket.rooms.active";

    /**
     * Counter: rooms created / deleted.
     * <p>
     * Tags: outcome (created/deleted)
     * </p>
     */
    public static final String SOCKET_ROOMS_TOTAL = "relay.socket.rooms.total";

    /**
     * Counter: frames rejected with an error reply.
     * <p>
     * Tags: reason
     * </p>
     */
    public static final String SOCKET_REJECTED_TOTAL = "relay.socket.rejected.total";

    /**
     * Counter: payloads forwarded to a peer.
     */
    public static final String SOCKET_RELAYED_TOTAL = "relay.socket.relayed.total";

    /**
     * Counter: payloads dropped because the sender had not joined a room.
     */
    public static final String SOCKET_DROPPED_TOTAL = "relay.socket.dropped.total";

    /**
     * Counter: connections terminated by the liveness sweep.
     */
    public static final String SOCKET_LIVENESS_TERMINATED_TOTAL = "relay.socket.liveness.terminated.total";

    /**
     * Counter: bytes received from / sent to WebSocket clients.
     */
    public static final String SOCKET_INBOUND_BYTES = "relay.socket.network.inbound.bytes";
    public static final String SOCKET_OUTBOUND_BYTES = "relay.socket.network.outbound.bytes";

    /**
     * Counter: proxied exchanges completed.
     * <p>
     * Tags: backend_id, outcome (success/error)
     * </p>
     */
    public static final String LB_REQUESTS_TOTAL = "relay.lb.requests.total";

    /**
     * Timer: proxied exchange duration.
     * <p>
     * Tags: backend_id
     * </p>
     */
    public static final String LB_REQUEST_LATENCY = "relay.lb.request.latency";

    /**
     * Counter: health transitions.
     * <p>
     * Tags: backend_id, outcome (recovered/degraded)
     * </p>
     */
    public static final String LB_HEALTH_TRANSITIONS_TOTAL = "relay.lb.health.transitions.total";

    /**
     * Gauge: backends currently healthy / registered.
     */
    public static final String LB_BACKENDS_HEALTHY = "relay.lb.backends.healthy";
    public static final String LB_BACKENDS_TOTAL = "relay.lb.backends.total";

    /**
     * Gauge: sticky session bindings held.
     */
    public static final String LB_STICKY_SESSIONS = "relay.lb.sticky.sessions";
}
