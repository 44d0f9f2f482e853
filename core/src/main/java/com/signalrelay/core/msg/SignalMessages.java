package com.signalrelay.core.msg;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalrelay.core.util.JsonUtils;

/**
 * Signaling protocol vocabulary.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>join: {room} (1-50 chars)</li>
 *   <li>anything else: opaque payload relayed verbatim to the other occupant</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>init: {initiator}</li>
 *   <li>error: {error}</li>
 * </ul>
 * </p>
 */
public final class SignalMessages {
    private SignalMessages() {
    }

    public static final String FIELD_TYPE = "type";
    public static final String FIELD_ROOM = "room";

    public static final String TYPE_JOIN = "join";
    public static final String TYPE_INIT = "init";
    public static final String TYPE_ERROR = "error";

    public static String init(boolean initiator) {
        ObjectNode node = JsonUtils.mapper().createObjectNode()
            .put(FIELD_TYPE, TYPE_INIT)
            .put("initiator", initiator);
        return node.toString();
    }

    public static String error(ErrorReason reason) {
        ObjectNode node = JsonUtils.mapper().createObjectNode()
            .put(FIELD_TYPE, TYPE_ERROR)
            .put("error", reason.message());
        return node.toString();
    }
}
