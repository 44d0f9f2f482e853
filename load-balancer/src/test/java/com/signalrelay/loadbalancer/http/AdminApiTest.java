package com.signalrelay.loadbalancer.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.signalrelay.core.metrics.PrometheusMetricsExporter;
import com.signalrelay.core.util.JsonUtils;
import com.signalrelay.loadbalancer.LBTestSupport;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.config.LBConfig;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import com.signalrelay.loadbalancer.routing.LoadBalancer;
import com.signalrelay.loadbalancer.routing.RoutingContext;
import com.signalrelay.loadbalancer.strategy.StrategyFactory;
import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AdminApiTest {

    private LoadBalancer loadBalancer;
    private PrometheusMetricsExporter metricsExporter;
    private HttpServer server;

    @BeforeEach
    void setUp() {
        LBConfig config = LBTestSupport.config().toBuilder().stickySessions(true).build();
        loadBalancer = new LoadBalancer(
            config, new BackendRegistry(), StrategyFactory.create(config.getAlgorithm()), new BackendEventBus()
        );
        metricsExporter = new PrometheusMetricsExporter(config.getNodeId(), "load-balancer");
        server = new HttpServer(config, loadBalancer, metricsExporter);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        metricsExporter.close();
        loadBalancer.stop();
    }

    private record Reply(int status, String body) {
        JsonNode json() throws JsonProcessingException {
            return JsonUtils.parseTree(body);
        }
    }

    private Reply call(HttpMethod method, String path, String body) {
        HttpClient.RequestSender sender = HttpClient.create()
            .headers(h -> h.add("Content-Type", "application/json"))
            .request(method)
            .uri("http://127.0.0.1:" + server.port() + path);
        HttpClient.ResponseReceiver<?> receiver = body == null
            ? sender
            : sender.send(ByteBufFlux.fromString(Mono.just(body)));
        return receiver
            .responseSingle((res, content) -> content.asString().defaultIfEmpty("")
                .map(text -> new Reply(res.status().code(), text)))
            .block(Duration.ofSeconds(5));
    }

    // ========== Servers ==========

    @Test
    @DisplayName("Server added over the API shows up in stats")
    void testAddAndStats() throws Exception {
        Reply created = call(HttpMethod.POST, "/api/v1/servers",
            "{\"id\":\"s1\",\"host\":\"10.0.0.1\",\"port\":52178,\"weight\":2}");

        assertEquals(201, created.status());
        assertEquals("s1", created.json().get("id").asText());
        assertEquals(2, created.json().get("weight").asInt());

        JsonNode stats = call(HttpMethod.GET, "/api/v1/stats", null).json();
        assertEquals(1, stats.get("totalServers").asInt());
        assertEquals(1, stats.get("healthyServers").asInt());
        assertEquals("round-robin", stats.get("algorithm").asText());
        assertTrue(stats.get("stickySessionsEnabled").asBoolean());
        assertEquals("s1", stats.get("servers").get(0).get("id").asText());
    }

    @Test
    @DisplayName("Invalid or duplicate server is a 400")
    void testAddRejected() throws Exception {
        assertEquals(400, call(HttpMethod.POST, "/api/v1/servers", "{\"id\":\"s1\",\"host\":\"h\"}").status());
        assertEquals(400, call(HttpMethod.POST, "/api/v1/servers", "[1,2]").status());
        assertEquals(400, call(HttpMethod.POST, "/api/v1/servers", "{not json").status());

        assertEquals(201, call(HttpMethod.POST, "/api/v1/servers", "{\"id\":\"s1\",\"host\":\"h\",\"port\":1}").status());
        Reply duplicate = call(HttpMethod.POST, "/api/v1/servers", "{\"id\":\"s1\",\"host\":\"h\",\"port\":2}");
        assertEquals(400, duplicate.status());
        assertEquals("Backend already registered: s1", duplicate.json().get("error").asText());
    }

    @Test
    void testGetUpdateDrainDelete() throws Exception {
        loadBalancer.addBackend("s1", "10.0.0.1", 52178, 1);

        assertEquals(200, call(HttpMethod.GET, "/api/v1/servers/s1", null).status());
        assertEquals(404, call(HttpMethod.GET, "/api/v1/servers/nope", null).status());

        Reply updated = call(HttpMethod.PUT, "/api/v1/servers/s1", "{\"weight\":4}");
        assertEquals(200, updated.status());
        assertEquals(4, updated.json().get("weight").asInt());
        assertEquals(404, call(HttpMethod.PUT, "/api/v1/servers/nope", "{\"weight\":4}").status());

        Reply drained = call(HttpMethod.POST, "/api/v1/servers/s1/drain", null);
        assertEquals(202, drained.status());
        assertTrue(drained.json().get("draining").asBoolean());

        assertEquals(204, call(HttpMethod.DELETE, "/api/v1/servers/s1", null).status());
        assertEquals(404, call(HttpMethod.DELETE, "/api/v1/servers/s1", null).status());
    }

    // ========== Operations ==========

    @Test
    void testClearStickySessions() throws Exception {
        loadBalancer.addBackend("s1", "10.0.0.1", 52178, 1);
        loadBalancer.route(RoutingContext.builder().sessionId("abc").build());

        Reply reply = call(HttpMethod.DELETE, "/api/v1/sticky-sessions", null);

        assertEquals(200, reply.status());
        assertEquals(1, reply.json().get("cleared").asInt());
        assertEquals(0, loadBalancer.stickySessionCount());
    }

    @Test
    void testHealthAndMetrics() {
        Reply health = call(HttpMethod.GET, "/healthz", null);
        assertEquals(200, health.status());
        assertEquals("OK", health.body());

        assertEquals(200, call(HttpMethod.GET, "/metrics", null).status());
    }
}
