package com.signalrelay.core.msg;

/**
 * Reasons a signaling frame is rejected. {@link #message()} is the exact text
 * put on the wire in the {@code error} field.
 */
public enum ErrorReason {
    MESSAGE_TOO_LARGE("Message too large"),
    INVALID_JSON("Invalid JSON format"),
    INVALID_STRUCTURE("Invalid message structure"),
    INVALID_ROOM_ID("Invalid room ID"),
    ROOM_FULL("Room is full"),
    ALREADY_IN_ROOM("Already in a room");

    private final String message;

    ErrorReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    /**
     * Lower-case tag value for metrics.
     */
    public String tag() {
        return name().toLowerCase();
    }
}
