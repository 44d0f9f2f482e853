package com.signalrelay.socket.ws;

import com.signalrelay.socket.config.SocketConfig;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

import java.net.InetSocketAddress;

/**
 * Handles the WebSocket upgrade.
 * <p>
 * Resolves the client address before the upgrade, preferring the first hop of
 * {@code X-Forwarded-For} set by the load balancer.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final WebsocketServerSpec serverSpec;

    public WebSocketUpgradeHandler(SocketConfig config, WebSocketHandler wsHandler) {
        this.wsHandler = wsHandler;
        this.serverSpec = WebsocketServerSpec.builder()
            .maxFramePayloadLength(config.getMaxFramePayload())
            .build();
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (!req.requestHeaders().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
            return res.status(HttpResponseStatus.BAD_REQUEST)
                .sendString(Mono.just("Expected WebSocket upgrade"))
                .then();
        }

        String remoteAddress = resolveRemoteAddress(req);
        log.debug("WebSocket handshake from {}", remoteAddress);

        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, remoteAddress), serverSpec);
    }

    static String resolveRemoteAddress(HttpServerRequest req) {
        String forwarded = req.requestHeaders().get("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = req.remoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
