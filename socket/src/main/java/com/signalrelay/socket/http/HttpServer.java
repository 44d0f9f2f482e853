package com.signalrelay.socket.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalrelay.core.metrics.PrometheusMetricsExporter;
import com.signalrelay.core.util.JsonUtils;
import com.signalrelay.socket.config.SocketConfig;
import com.signalrelay.socket.room.RoomRegistry;
import com.signalrelay.socket.session.ConnectionRegistry;
import com.signalrelay.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final ConnectionRegistry connectionRegistry;
    private final RoomRegistry roomRegistry;
    private final PrometheusMetricsExporter metricsExporter;
    private final WebSocketUpgradeHandler upgradeHandler;
    private DisposableServer server;

    /**
     * Binds the server and blocks until it is listening.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .host(config.getHost())
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Health probe used by the load balancer
                .get("/health", (req, res) -> res.status(200)
                    .header("Content-Type", "application/json")
                    .sendString(Mono.fromSupplier(this::healthJson)))
                .get("/metrics", (req, res) -> metricsExporter.serve(res))
                .get(config.getWsPath(), upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("Signaling server listening on {}:{}", config.getHost(), bound.port()))
            .doOnError(err -> log.error("Failed to start signaling server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }

    private String healthJson() {
        ObjectNode node = JsonUtils.mapper().createObjectNode();
        node.put("status", "ok");
        node.put("connections", connectionRegistry.size());
        node.put("rooms", roomRegistry.roomCount());
        return JsonUtils.writeValueAsString(node);
    }
}
