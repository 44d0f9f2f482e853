package com.signalrelay.socket.metrics;

import com.signalrelay.core.metrics.MetricsNames;
import com.signalrelay.core.metrics.MetricsTags;
import com.signalrelay.core.msg.ErrorReason;
import com.signalrelay.socket.config.SocketConfig;
import com.signalrelay.socket.room.RoomRegistry;
import com.signalrelay.socket.session.ConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.EnumMap;
import java.util.Map;

/**
 * Centralized metrics service for a signaling node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final SocketConfig config;

    // Counters
    private final Counter connectionsTotal;
    private final Counter roomsCreated;
    private final Counter roomsDeleted;
    private final Counter relayed;
    private final Counter dropped;
    private final Counter livenessTerminated;
    private final Map<ErrorReason, Counter> rejected = new EnumMap<>(ErrorReason.class);

    // Network traffic counters (bytes)
    private final Counter inboundBytes;
    private final Counter outboundBytes;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.config = config;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connectionsTotal = Counter.builder(MetricsNames.SOCKET_CONNECTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .description("Signaling connections accepted")
            .register(registry);

        roomsCreated = Counter.builder(MetricsNames.SOCKET_ROOMS_TOTAL)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .tag(MetricsTags.OUTCOME, "created")
            .description("Rooms created")
            .register(registry);

        roomsDeleted = Counter.builder(MetricsNames.SOCKET_ROOMS_TOTAL)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .tag(MetricsTags.OUTCOME, "deleted")
            .description("Rooms deleted after their last occupant left")
            .register(registry);

        relayed = Counter.builder(MetricsNames.SOCKET_RELAYED_TOTAL)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .description("Payloads forwarded to a peer")
            .register(registry);

        dropped = Counter.builder(MetricsNames.SOCKET_DROPPED_TOTAL)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .description("Payloads dropped because the sender is not in a room")
            .register(registry);

        livenessTerminated = Counter.builder(MetricsNames.SOCKET_LIVENESS_TERMINATED_TOTAL)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .description("Connections terminated after missing a pong")
            .register(registry);

        for (ErrorReason reason : ErrorReason.values()) {
            rejected.put(reason, Counter.builder(MetricsNames.SOCKET_REJECTED_TOTAL)
                .tag(MetricsTags.NODE_ID, config.getNodeId())
                .tag(MetricsTags.REASON, reason.tag())
                .description("Frames answered with an error")
                .register(registry));
        }

        inboundBytes = Counter.builder(MetricsNames.SOCKET_INBOUND_BYTES)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        outboundBytes = Counter.builder(MetricsNames.SOCKET_OUTBOUND_BYTES)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);
    }

    /**
     * Registers gauges over the live registries.
     */
    public void bindGauges(ConnectionRegistry connections, RoomRegistry rooms) {
        Gauge.builder(MetricsNames.SOCKET_CONNECTIONS_ACTIVE, connections, ConnectionRegistry::size)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .register(registry);
        Gauge.builder(MetricsNames.SOCKET_ROOMS_ACTIVE, rooms, RoomRegistry::roomCount)
            .tag(MetricsTags.NODE_ID, config.getNodeId())
            .register(registry);
    }

    public void recordConnectionOpened() {
        connectionsTotal.increment();
    }

    public void recordRoomCreated() {
        roomsCreated.increment();
    }

    public void recordRoomDeleted() {
        roomsDeleted.increment();
    }

    public void recordRelayed() {
        relayed.increment();
    }

    public void recordDropped() {
        dropped.increment();
    }

    public void recordLivenessTermination() {
        livenessTerminated.increment();
    }

    public void recordRejected(ErrorReason reason) {
        rejected.get(reason).increment();
    }

    public void recordInboundBytes(long bytes) {
        inboundBytes.increment(bytes);
    }

    public void recordOutboundBytes(long bytes) {
        outboundBytes.increment(bytes);
    }

    public double getRelayedCount() {
        return relayed.count();
    }

    public double getRejectedCount(ErrorReason reason) {
        return rejected.get(reason).count();
    }
}
