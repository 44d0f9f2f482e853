package com.signalrelay.socket.session;

import com.signalrelay.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.UUID;

/**
 * Factory for creating SignalingConnection objects.
 * <p>
 * Separated from the registry to isolate buffer sizing.
 * </p>
 */
public class ConnectionFactory {
    private final SocketConfig config;

    public ConnectionFactory(SocketConfig config) {
        this.config = config;
    }

    /**
     * Creates a new connection handle.
     *
     * @param remoteAddress client address
     * @param terminator    forcibly closes the channel
     * @return connection in the CONNECTED state
     */
    public SignalingConnection create(String remoteAddress, Runnable terminator) {
        Sinks.Many<OutboundFrame> sink = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<OutboundFrame>get(config.getPerConnBufferSize()).get()
        );
        return new SignalingConnection(UUID.randomUUID().toString(), remoteAddress, sink, terminator);
    }
}
