package com.signalrelay.socket.session;

import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import lombok.Value;

/**
 * Frame queued for a connection. Netty frames are only materialized when the
 * outbound pipeline actually writes, so nothing reference-counted sits in the
 * per-connection buffer.
 */
@Value
public class OutboundFrame {

    public enum Kind { TEXT, PING, CLOSE }

    private static final OutboundFrame PING = new OutboundFrame(Kind.PING, null);
    private static final OutboundFrame CLOSE = new OutboundFrame(Kind.CLOSE, null);

    Kind kind;
    String text;

    public static OutboundFrame text(String text) {
        return new OutboundFrame(Kind.TEXT, text);
    }

    public static OutboundFrame ping() {
        return PING;
    }

    public static OutboundFrame goingAway() {
        return CLOSE;
    }

    public boolean isPing() {
        return kind == Kind.PING;
    }

    public WebSocketFrame toNettyFrame() {
        return switch (kind) {
            case PING -> new PingWebSocketFrame();
            case CLOSE -> new CloseWebSocketFrame(WebSocketCloseStatus.ENDPOINT_UNAVAILABLE);
            case TEXT -> new TextWebSocketFrame(text);
        };
    }
}
