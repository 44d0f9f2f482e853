package com.signalrelay.socket.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.signalrelay.core.msg.ErrorReason;
import com.signalrelay.core.msg.SignalMessages;
import com.signalrelay.core.util.BytesUtils;
import com.signalrelay.core.util.JsonUtils;
import com.signalrelay.socket.config.SocketConfig;
import com.signalrelay.socket.metrics.MetricsService;
import com.signalrelay.socket.room.JoinOutcome;
import com.signalrelay.socket.room.RoomRegistry;
import com.signalrelay.socket.session.SignalingConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies the signaling protocol to inbound text frames.
 * <p>
 * Guards run in order, before any interpretation of the payload:
 * <ol>
 *   <li>size above the message limit → {@code Message too large} (never parsed)</li>
 *   <li>not a single JSON document → {@code Invalid JSON format}</li>
 *   <li>not an object with a non-empty string {@code type} → {@code Invalid message structure}</li>
 * </ol>
 * {@code join} is handled here; every other type is forwarded byte-for-byte
 * to the other occupants of the sender's room. All rejections are answered on
 * the sender's connection, which stays open.
 * </p>
 */
public class SignalingRouter {
    private static final Logger log = LoggerFactory.getLogger(SignalingRouter.class);

    private final SocketConfig config;
    private final RoomRegistry roomRegistry;
    private final MetricsService metricsService;

    public SignalingRouter(SocketConfig config, RoomRegistry roomRegistry, MetricsService metricsService) {
        this.config = config;
        this.roomRegistry = roomRegistry;
        this.metricsService = metricsService;
    }

    /**
     * Handles one inbound frame.
     *
     * @param connection sender
     * @param raw        frame text, relayed as is
     * @param byteLength encoded size of the frame on the wire
     */
    public void onFrame(SignalingConnection connection, String raw, int byteLength) {
        metricsService.recordInboundBytes(byteLength);

        if (byteLength > config.getMaxMessageSize()) {
            log.warn("Rejecting {} byte frame from {}", byteLength, connection.getRemoteAddress());
            reject(connection, ErrorReason.MESSAGE_TOO_LARGE);
            return;
        }

        JsonNode message;
        try {
            message = JsonUtils.parseTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Malformed JSON from {}: {}", connection.getId(), e.getOriginalMessage());
            reject(connection, ErrorReason.INVALID_JSON);
            return;
        }

        JsonNode type = message.get(SignalMessages.FIELD_TYPE);
        if (!message.isObject() || type == null || !type.isTextual() || type.asText().isEmpty()) {
            reject(connection, ErrorReason.INVALID_STRUCTURE);
            return;
        }

        if (SignalMessages.TYPE_JOIN.equals(type.asText())) {
            join(connection, message.get(SignalMessages.FIELD_ROOM));
        } else {
            relay(connection, raw, byteLength);
        }
    }

    /**
     * Handles a binary frame whose payload is not valid UTF-8. Such a frame can
     * never be a JSON document; the size guard still comes first.
     */
    public void onUndecodableFrame(SignalingConnection connection, int byteLength) {
        metricsService.recordInboundBytes(byteLength);

        if (byteLength > config.getMaxMessageSize()) {
            log.warn("Rejecting {} byte frame from {}", byteLength, connection.getRemoteAddress());
            reject(connection, ErrorReason.MESSAGE_TOO_LARGE);
            return;
        }
        log.debug("Binary frame from {} is not UTF-8", connection.getId());
        reject(connection, ErrorReason.INVALID_JSON);
    }

    private void join(SignalingConnection connection, JsonNode room) {
        if (room == null || !room.isTextual() || !roomRegistry.isValidRoomId(room.asText())) {
            reject(connection, ErrorReason.INVALID_ROOM_ID);
            return;
        }

        String roomId = room.asText();
        JoinOutcome outcome = roomRegistry.join(connection, roomId);
        switch (outcome) {
            case CREATED -> metricsService.recordRoomCreated();
            case JOINED -> log.debug("Connection {} is responder in room {}", connection.getId(), roomId);
            case FULL -> reject(connection, ErrorReason.ROOM_FULL);
            case ALREADY_IN_ROOM -> reject(connection, ErrorReason.ALREADY_IN_ROOM);
        }
    }

    private void relay(SignalingConnection connection, String raw, int byteLength) {
        if (connection.getRoomId() == null) {
            log.debug("Dropping payload from {}: not in a room", connection.getId());
            metricsService.recordDropped();
            return;
        }

        List<SignalingConnection> peers = roomRegistry.peersOf(connection);
        for (SignalingConnection peer : peers) {
            if (peer.isOpen() && peer.send(raw)) {
                metricsService.recordRelayed();
                metricsService.recordOutboundBytes(byteLength);
            }
        }
    }

    /**
     * Cleans up room membership for a closed connection.
     */
    public void onClose(SignalingConnection connection) {
        if (roomRegistry.leave(connection)) {
            metricsService.recordRoomDeleted();
        }
    }

    private void reject(SignalingConnection connection, ErrorReason reason) {
        metricsService.recordRejected(reason);
        String frame = SignalMessages.error(reason);
        if (connection.send(frame)) {
            metricsService.recordOutboundBytes(BytesUtils.utf8Length(frame));
        }
    }
}
