package com.signalrelay.socket.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client socket on this node.
 * <p>
 * Everything written to the client goes through a single sink, so frames from
 * the connection's own handler (init, errors, pings) and frames relayed by the
 * peer are serialized and keep their per-sender order.
 * </p>
 * <p>
 * Room membership ({@code roomId}, {@code initiator}) is only assigned by the
 * room registry.
 * </p>
 */
public class SignalingConnection {
    private static final Logger log = LoggerFactory.getLogger(SignalingConnection.class);

    private final String id;
    private final String remoteAddress;
    private final Sinks.Many<OutboundFrame> sink;
    private final Runnable terminator;

    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final AtomicBoolean open = new AtomicBoolean(true);

    private volatile String roomId;
    private volatile boolean initiator;
    private volatile long lastPongAt;

    /**
     * @param id            connection identifier (unique per node)
     * @param remoteAddress client address, as reported by the proxy when there is one
     * @param sink          outbound frame buffer
     * @param terminator    forcibly tears down the underlying channel
     */
    public SignalingConnection(String id, String remoteAddress, Sinks.Many<OutboundFrame> sink, Runnable terminator) {
        this.id = id;
        this.remoteAddress = remoteAddress;
        this.sink = sink;
        this.terminator = terminator;
        this.lastPongAt = System.currentTimeMillis();
    }

    public String getId() {
        return id;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public String getRoomId() {
        return roomId;
    }

    public boolean isInitiator() {
        return initiator;
    }

    public boolean isOpen() {
        return open.get();
    }

    public boolean isAlive() {
        return alive.get();
    }

    public long getLastPongAt() {
        return lastPongAt;
    }

    public Flux<OutboundFrame> outbound() {
        return sink.asFlux();
    }

    public void assignRoom(String roomId, boolean initiator) {
        this.roomId = roomId;
        this.initiator = initiator;
    }

    public void clearRoom() {
        this.roomId = null;
        this.initiator = false;
    }

    /**
     * Queues a text frame.
     *
     * @return false if the connection is closed or its buffer is full
     */
    public boolean send(String text) {
        return emit(OutboundFrame.text(text));
    }

    public boolean ping() {
        return emit(OutboundFrame.ping());
    }

    public void markAlive() {
        alive.set(true);
        lastPongAt = System.currentTimeMillis();
    }

    /**
     * Clears the liveness flag ahead of a ping.
     *
     * @return the flag's value before it was cleared
     */
    public boolean resetAlive() {
        return alive.getAndSet(false);
    }

    /**
     * Marks the connection closed and completes its outbound stream.
     *
     * @return true only for the first call
     */
    public boolean close() {
        if (!open.compareAndSet(true, false)) {
            return false;
        }
        synchronized (this) {
            sink.tryEmitComplete();
        }
        return true;
    }

    /**
     * Sends a close frame (1001 going away) and closes the connection.
     *
     * @return true only for the first close of this connection
     */
    public boolean closeGracefully() {
        synchronized (this) {
            if (open.get()) {
                sink.tryEmitNext(OutboundFrame.goingAway());
            }
        }
        return close();
    }

    /**
     * Closes the connection and tears down the channel without a close handshake.
     */
    public void terminate() {
        if (close()) {
            terminator.run();
        }
    }

    private synchronized boolean emit(OutboundFrame frame) {
        if (!open.get()) {
            return false;
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            log.warn("Failed to queue {} frame for connection {}: {}", frame.getKind(), id, result);
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "SignalingConnection{id=" + id + ", remote=" + remoteAddress + ", room=" + roomId + "}";
    }
}
