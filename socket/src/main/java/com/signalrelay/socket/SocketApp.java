package com.signalrelay.socket;

import com.signalrelay.core.metrics.PrometheusMetricsExporter;
import com.signalrelay.socket.config.SocketConfig;
import com.signalrelay.socket.http.HttpServer;
import com.signalrelay.socket.liveness.LivenessTracker;
import com.signalrelay.socket.metrics.MetricsService;
import com.signalrelay.socket.room.RoomRegistry;
import com.signalrelay.socket.router.SignalingRouter;
import com.signalrelay.socket.session.ConnectionFactory;
import com.signalrelay.socket.session.ConnectionRegistry;
import com.signalrelay.socket.ws.WebSocketHandler;
import com.signalrelay.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Hooks;

/**
 * Main entry point for a signaling node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Accept WebSocket clients on the configured path</li>
 *   <li>Pair clients into rooms and relay their signaling payloads</li>
 *   <li>Terminate clients that stop answering pings</li>
 *   <li>Expose /health and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        installFailureHandlers();

        log.info("Starting signaling node: {}", config.getNodeId());
        log.info("  Max room size: {}, max message size: {} bytes", config.getMaxRoomSize(), config.getMaxMessageSize());
        log.info("  Ping interval: {}", config.getPingInterval());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId(), "socket");
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        ConnectionRegistry connectionRegistry = new ConnectionRegistry();
        RoomRegistry roomRegistry = new RoomRegistry(config.getMaxRoomSize(), config.getMaxRoomIdLength());
        metricsService.bindGauges(connectionRegistry, roomRegistry);

        SignalingRouter router = new SignalingRouter(config, roomRegistry, metricsService);
        WebSocketHandler wsHandler = new WebSocketHandler(
            config.getMaxFramePayload(),
            new ConnectionFactory(config),
            connectionRegistry,
            router,
            metricsService
        );

        HttpServer httpServer = new HttpServer(
            config,
            connectionRegistry,
            roomRegistry,
            metricsExporter,
            new WebSocketUpgradeHandler(config, wsHandler)
        );
        httpServer.start();

        LivenessTracker livenessTracker = new LivenessTracker(connectionRegistry, metricsService, config.getPingInterval());
        livenessTracker.start();

        log.info("Signaling node {} is ready", config.getNodeId());

        handleShutdown(config, connectionRegistry, livenessTracker, httpServer, metricsExporter);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    /**
     * An unexpected error leaves the node in an unknown state, so it exits and
     * lets the supervisor restart it.
     */
    private static void installFailureHandlers() {
        Thread.setDefaultUncaughtExceptionHandler((thread, err) -> {
            log.error("Uncaught exception in thread {}, exiting", thread.getName(), err);
            System.exit(1);
        });
        Hooks.onErrorDropped(err -> log.warn("Dropped reactive error: {}", err.toString()));
    }

    private static void handleShutdown(SocketConfig config,
                                       ConnectionRegistry connectionRegistry,
                                       LivenessTracker livenessTracker,
                                       HttpServer httpServer,
                                       PrometheusMetricsExporter metricsExporter) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            livenessTracker.stop();
            connectionRegistry.closeAll();
            httpServer.stop();
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
