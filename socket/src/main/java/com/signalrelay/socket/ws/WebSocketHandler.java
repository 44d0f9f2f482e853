package com.signalrelay.socket.ws;

import com.signalrelay.socket.metrics.MetricsService;
import com.signalrelay.socket.router.SignalingRouter;
import com.signalrelay.socket.session.ConnectionFactory;
import com.signalrelay.socket.session.ConnectionRegistry;
import com.signalrelay.socket.session.OutboundFrame;
import com.signalrelay.socket.session.SignalingConnection;
import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.Connection;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * WebSocket handler for signaling connections.
 * <p>
 * Lifecycle: CONNECTED on upgrade → IN_ROOM after a successful join →
 * TERMINATED on close, at which point room membership is released.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final int maxFramePayload;
    private final ConnectionFactory connectionFactory;
    private final ConnectionRegistry connectionRegistry;
    private final SignalingRouter router;
    private final MetricsService metricsService;

    public WebSocketHandler(
            int maxFramePayload,
            ConnectionFactory connectionFactory,
            ConnectionRegistry connectionRegistry,
            SignalingRouter router,
            MetricsService metricsService
    ) {
        this.maxFramePayload = maxFramePayload;
        this.connectionFactory = connectionFactory;
        this.connectionRegistry = connectionRegistry;
        this.router = router;
        this.metricsService = metricsService;
    }

    /**
     * Handles WebSocket connection lifecycle.
     *
     * @param inbound       WebSocket inbound
     * @param outbound      WebSocket outbound
     * @param remoteAddress client address (extracted before the upgrade)
     * @return Publisher completing when the connection is done
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, String remoteAddress) {
        SignalingConnection connection = connectionFactory.create(
            remoteAddress, () -> outbound.withConnection(Connection::dispose)
        );
        connectionRegistry.register(connection);
        metricsService.recordConnectionOpened();
        log.info("New client connected from {} (connection {})", remoteAddress, connection.getId());

        inbound.withConnection(channel -> channel.onDispose(() -> cleanup(connection)));

        return Mono.when(
                outbound.sendObject(connection.outbound().map(OutboundFrame::toNettyFrame)).then(),
                handleInbound(inbound, connection)
            )
            .doFinally(signal -> cleanup(connection));
    }

    private Mono<Void> handleInbound(WebsocketInbound inbound, SignalingConnection connection) {
        return inbound.aggregateFrames(maxFramePayload)
            .receiveFrames()
            .doOnNext(frame -> onFrame(connection, frame))
            .doOnError(err -> {
                // AbortedException is expected when the peer goes away mid-stream
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for {}", connection.getId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then(Mono.fromRunnable(() -> cleanup(connection)));
    }

    private void onFrame(SignalingConnection connection, WebSocketFrame frame) {
        if (frame instanceof PongWebSocketFrame) {
            connection.markAlive();
            return;
        }
        if (!(frame instanceof TextWebSocketFrame) && !(frame instanceof BinaryWebSocketFrame)) {
            return;
        }

        ByteBuf content = frame.content();
        int byteLength = content.readableBytes();
        MDC.put("connId", connection.getId());
        try {
            String text = decode(content);
            if (text == null) {
                router.onUndecodableFrame(connection, byteLength);
            } else {
                router.onFrame(connection, text, byteLength);
            }
        } catch (RuntimeException e) {
            log.error("Failed to handle frame from {}", connection.getId(), e);
        } finally {
            MDC.remove("connId");
        }
    }

    /**
     * Strict UTF-8 decode; {@code null} when the payload is not valid UTF-8.
     * Text frames were already validated by the codec, binary frames were not.
     */
    static String decode(ByteBuf content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(content.nioBuffer()).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private void cleanup(SignalingConnection connection) {
        connection.close();
        // unregister succeeds once per connection, whichever path gets here first
        if (!connectionRegistry.unregister(connection)) {
            return;
        }
        router.onClose(connection);
        log.info("Client {} disconnected (connection {})", connection.getRemoteAddress(), connection.getId());
    }
}
