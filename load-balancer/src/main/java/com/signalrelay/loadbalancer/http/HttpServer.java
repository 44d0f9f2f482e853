package com.signalrelay.loadbalancer.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalrelay.core.metrics.PrometheusMetricsExporter;
import com.signalrelay.core.util.JsonUtils;
import com.signalrelay.loadbalancer.backend.BackendUpdate;
import com.signalrelay.loadbalancer.config.LBConfig;
import com.signalrelay.loadbalancer.exception.UnknownBackendException;
import com.signalrelay.loadbalancer.routing.ILoadBalancer;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Admin HTTP server: health, metrics, stats and backend management.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final LBConfig config;
    private final ILoadBalancer loadBalancer;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(LBConfig config, ILoadBalancer loadBalancer, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.loadBalancer = loadBalancer;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .host(config.getHost())
            .port(config.getAdminPort())
            .metrics(true, Function.identity())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("Admin server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start admin server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Liveness of the balancer itself
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/metrics", (req, res) -> metricsExporter.serve(res))
            .get("/api/v1/stats", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, loadBalancer.getStats())
            )
            .get("/api/v1/servers/{id}", (req, res) -> loadBalancer.getBackend(req.param("id"))
                .map(snapshot -> sendJson(res, HttpResponseStatus.OK, snapshot))
                .orElseGet(() -> sendError(res, HttpResponseStatus.NOT_FOUND, "Unknown backend: " + req.param("id")))
            )
            .post("/api/v1/servers", (req, res) -> readBody(req)
                .map(body -> loadBalancer.addBackend(
                    requiredText(body, "id"),
                    requiredText(body, "host"),
                    requiredInt(body, "port"),
                    body.hasNonNull("weight") ? body.get("weight").asInt() : 1
                ))
                .flatMap(snapshot -> sendJson(res, HttpResponseStatus.CREATED, snapshot))
                .onErrorResume(err -> handleError(res, err))
            )
            .put("/api/v1/servers/{id}", (req, res) -> readBody(req)
                .map(body -> JsonUtils.mapper().convertValue(body, BackendUpdate.class))
                .map(update -> loadBalancer.updateBackend(req.param("id"), update))
                .flatMap(snapshot -> sendJson(res, HttpResponseStatus.OK, snapshot))
                .onErrorResume(err -> handleError(res, err))
            )
            .delete("/api/v1/servers/{id}", (req, res) -> {
                String id = req.param("id");
                if (!loadBalancer.removeBackend(id)) {
                    return sendError(res, HttpResponseStatus.NOT_FOUND, "Unknown backend: " + id);
                }
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            })
            .post("/api/v1/servers/{id}/drain", (req, res) ->
                Mono.fromCallable(() -> loadBalancer.drain(req.param("id")))
                    .flatMap(snapshot -> sendJson(res, HttpResponseStatus.ACCEPTED, snapshot))
                    .onErrorResume(err -> handleError(res, err))
            )
            .delete("/api/v1/sticky-sessions", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, Map.of("cleared", loadBalancer.clearStickySessions()))
            );
    }

    private static Mono<JsonNode> readBody(HttpServerRequest req) {
        return req.receive()
            .aggregate()
            .asString()
            .defaultIfEmpty("")
            .map(body -> {
                JsonNode node = JsonUtils.readValue(body.isEmpty() ? "{}" : body, JsonNode.class);
                if (!node.isObject()) {
                    throw new IllegalArgumentException("Request body must be a JSON object");
                }
                return node;
            });
    }

    private static String requiredText(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
        return value.asText();
    }

    private static int requiredInt(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new IllegalArgumentException("Missing or invalid field: " + field);
        }
        return value.asInt();
    }

    private static Mono<Void> handleError(HttpServerResponse res, Throwable err) {
        if (err instanceof UnknownBackendException) {
            return sendError(res, HttpResponseStatus.NOT_FOUND, err.getMessage());
        }
        if (err instanceof IllegalArgumentException) {
            return sendError(res, HttpResponseStatus.BAD_REQUEST, err.getMessage());
        }
        log.error("Admin request failed", err);
        return sendError(res, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    private static Mono<Void> sendJson(HttpServerResponse res, HttpResponseStatus status, Object body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body))
            .flatMap(json -> res.status(status)
                .header(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .sendString(Mono.just(json))
                .then());
    }

    private static Mono<Void> sendError(HttpServerResponse res, HttpResponseStatus status, String message) {
        return sendJson(res, status, Map.of("error", message));
    }
}
