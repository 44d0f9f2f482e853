package com.signalrelay.socket.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a signaling node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    String host;
    int httpPort;
    String wsPath;

    int maxRoomSize;
    int maxRoomIdLength;
    int maxMessageSize;       // application limit, answered with an error frame
    int maxFramePayload;      // transport ceiling, must stay above maxMessageSize
    int perConnBufferSize;

    Duration pingInterval;

    public static SocketConfig fromEnv() {
        SocketConfig config = SocketConfig.builder()
            .nodeId(getEnv("NODE_ID", "socket-node-1"))
            .host(getEnv("HOST", "0.0.0.0"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "52178")))
            .wsPath(getEnv("WS_PATH", "/"))
            .maxRoomSize(Integer.parseInt(getEnv("MAX_ROOM_SIZE", "2")))
            .maxRoomIdLength(Integer.parseInt(getEnv("MAX_ROOM_ID_LENGTH", "50")))
            .maxMessageSize(Integer.parseInt(getEnv("MAX_MESSAGE_SIZE", "65536")))
            .maxFramePayload(Integer.parseInt(getEnv("MAX_FRAME_PAYLOAD", "1048576")))
            .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
            .pingInterval(Duration.ofSeconds(Integer.parseInt(getEnv("PING_INTERVAL_SEC", "30"))))
            .build();
        config.validate();
        return config;
    }

    /**
     * Fails fast on settings the node cannot run with.
     */
    public void validate() {
        if (maxRoomSize < 1) {
            throw new IllegalArgumentException("MAX_ROOM_SIZE must be >= 1, got " + maxRoomSize);
        }
        if (maxRoomIdLength < 1) {
            throw new IllegalArgumentException("MAX_ROOM_ID_LENGTH must be >= 1, got " + maxRoomIdLength);
        }
        if (maxFramePayload <= maxMessageSize) {
            throw new IllegalArgumentException(
                "MAX_FRAME_PAYLOAD (" + maxFramePayload + ") must exceed MAX_MESSAGE_SIZE (" + maxMessageSize + ")");
        }
        if (pingInterval == null || pingInterval.isZero() || pingInterval.isNegative()) {
            throw new IllegalArgumentException("PING_INTERVAL_SEC must be positive");
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
