package com.signalrelay.loadbalancer.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalrelay.core.util.JsonUtils;
import com.signalrelay.loadbalancer.LBTestSupport;
import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.config.LBConfig;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import com.signalrelay.loadbalancer.routing.LoadBalancer;
import com.signalrelay.loadbalancer.strategy.StrategyFactory;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.ByteBufFlux;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.server.HttpServer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Proxies real traffic to signaling backends bound to ephemeral ports.
 */
class ProxyIntegrationTest {

    private final List<DisposableServer> backendServers = new ArrayList<>();
    private LoadBalancer loadBalancer;
    private ProxyServer proxy;

    @AfterEach
    void tearDown() {
        if (proxy != null) {
            proxy.stop();
        }
        if (loadBalancer != null) {
            loadBalancer.stop();
        }
        backendServers.forEach(DisposableServer::disposeNow);
    }

    private int startBackend(String id) {
        DisposableServer server = HttpServer.create()
            .host("127.0.0.1")
            .port(0)
            .route(routes -> routes
                .get("/health", (req, res) -> res.sendString(Mono.just("ok")))
                .get("/echo", (req, res) -> res.header("X-Backend", id)
                    .sendString(Mono.just(req.requestHeaders().get("X-Forwarded-For")
                        + "|" + req.requestHeaders().get("X-Load-Balancer"))))
                .post("/echo-body", (req, res) -> res.header("X-Backend", id)
                    .sendString(req.receive().aggregate().asString().defaultIfEmpty("")))
                .ws("/ws", (in, out) -> out.sendString(in.receive().asString().map(text -> id + ":" + text)))
                .ws("/ws-close", (in, out) -> out.sendClose(4001, "room closed")))
            .bindNow();
        backendServers.add(server);
        return server.port();
    }

    private void startProxy(LBConfig config) {
        loadBalancer = new LoadBalancer(
            config, new BackendRegistry(), StrategyFactory.create(config.getAlgorithm()), new BackendEventBus()
        );
        proxy = new ProxyServer(config, new ProxyHandler(config, loadBalancer));
        proxy.start();
    }

    private String url(String path) {
        return "http://127.0.0.1:" + proxy.port() + path;
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(condition.getAsBoolean(), "Condition not met within 5s");
    }

    private record Reply(int status, String backend, String loadBalancer, String body) {
    }

    private static Reply get(HttpClient client, String url) {
        return client.get()
            .uri(url)
            .responseSingle((res, body) -> body.asString().defaultIfEmpty("").map(text -> new Reply(
                res.status().code(),
                res.responseHeaders().get("X-Backend"),
                res.responseHeaders().get("X-Load-Balancer"),
                text
            )))
            .block(Duration.ofSeconds(10));
    }

    private static Reply post(HttpClient client, String url, String body) {
        return client.post()
            .uri(url)
            .send(ByteBufFlux.fromString(Mono.just(body)))
            .responseSingle((res, content) -> content.asString().defaultIfEmpty("").map(text -> new Reply(
                res.status().code(),
                res.responseHeaders().get("X-Backend"),
                res.responseHeaders().get("X-Load-Balancer"),
                text
            )))
            .block(Duration.ofSeconds(10));
    }

    private int deadPort() {
        int port = startBackend("gone");
        backendServers.remove(backendServers.size() - 1).disposeNow();
        return port;
    }

    // ========== HTTP ==========

    @Test
    @DisplayName("Requests are forwarded with forwarding headers and spread round-robin")
    void testHttpForwarding() throws Exception {
        LBConfig config = LBTestSupport.config();
        startProxy(config);
        loadBalancer.addBackend("b1", "127.0.0.1", startBackend("b1"), 1);
        loadBalancer.addBackend("b2", "127.0.0.1", startBackend("b2"), 1);

        Reply first = get(HttpClient.create(), url("/echo"));
        Reply second = get(HttpClient.create(), url("/echo"));

        assertEquals(200, first.status());
        assertEquals("b1", first.backend());
        assertEquals("b2", second.backend());
        assertEquals("signal-relay-lb", first.loadBalancer());
        assertEquals("127.0.0.1|signal-relay-lb", first.body());

        Backend b1 = loadBalancer.getRegistry().get("b1").orElseThrow();
        await(() -> b1.getConnections() == 0 && b1.getTotalConnections() == 1);
        assertEquals(0, b1.getErrorCount());
    }

    @Test
    @DisplayName("Existing X-Forwarded-For chain is extended")
    void testForwardedForChain() {
        startProxy(LBTestSupport.config());
        loadBalancer.addBackend("b1", "127.0.0.1", startBackend("b1"), 1);

        Reply reply = get(HttpClient.create().headers(h -> h.add("X-Forwarded-For", "203.0.113.7")), url("/echo"));

        assertEquals("203.0.113.7, 127.0.0.1|signal-relay-lb", reply.body());
    }

    @Test
    @DisplayName("Session cookie pins every request to one backend")
    void testStickySessions() {
        startProxy(LBTestSupport.config().toBuilder().stickySessions(true).build());
        loadBalancer.addBackend("b1", "127.0.0.1", startBackend("b1"), 1);
        loadBalancer.addBackend("b2", "127.0.0.1", startBackend("b2"), 1);
        HttpClient client = HttpClient.create().headers(h -> h.add("Cookie", "sessionId=user-42"));

        String pinned = get(client, url("/echo")).backend();
        for (int i = 0; i < 5; i++) {
            assertEquals(pinned, get(client, url("/echo")).backend());
        }
    }

    @Test
    @DisplayName("No healthy backend answers 503 with a JSON body")
    void testNoBackend() throws Exception {
        startProxy(LBTestSupport.config());

        Reply reply = get(HttpClient.create(), url("/echo"));

        assertEquals(503, reply.status());
        JsonNode body = JsonUtils.parseTree(reply.body());
        assertEquals("Service Unavailable", body.get("error").asText());
        assertEquals("All backend servers are currently unavailable", body.get("message").asText());
        assertTrue(body.hasNonNull("timestamp"));
    }

    @Test
    @DisplayName("Unreachable backend answers 503 and counts an error")
    void testBackendDown() throws Exception {
        startProxy(LBTestSupport.config());
        loadBalancer.addBackend("b1", "127.0.0.1", deadPort(), 1);

        Reply reply = get(HttpClient.create(), url("/echo"));

        assertEquals(503, reply.status());
        assertEquals("Backend server b1 is unavailable", JsonUtils.parseTree(reply.body()).get("message").asText());

        Backend b1 = loadBalancer.getRegistry().get("b1").orElseThrow();
        await(() -> b1.getErrorCount() == 1 && b1.getConnections() == 0);
        assertNotNull(b1.getLastError());
    }

    @Test
    @DisplayName("Request body reaches the backend")
    void testPostBodyForwarded() throws Exception {
        startProxy(LBTestSupport.config());
        loadBalancer.addBackend("b1", "127.0.0.1", startBackend("b1"), 1);

        Reply reply = post(HttpClient.create(), url("/echo-body"), "{\"offer\":\"sdp\"}");

        assertEquals(200, reply.status());
        assertEquals("b1", reply.backend());
        assertEquals("{\"offer\":\"sdp\"}", reply.body());

        Backend b1 = loadBalancer.getRegistry().get("b1").orElseThrow();
        await(() -> b1.getConnections() == 0 && b1.getTotalConnections() == 1);
        assertEquals(0, b1.getErrorCount());
    }

    @Test
    @DisplayName("Request with a body to an unreachable backend answers 503")
    void testPostBackendDown() throws Exception {
        startProxy(LBTestSupport.config());
        loadBalancer.addBackend("b1", "127.0.0.1", deadPort(), 1);

        Reply reply = post(HttpClient.create(), url("/echo-body"), "payload");

        assertEquals(503, reply.status());
        Backend b1 = loadBalancer.getRegistry().get("b1").orElseThrow();
        await(() -> b1.getErrorCount() == 1 && b1.getConnections() == 0);
    }

    // ========== WebSocket ==========

    @Test
    @DisplayName("WebSocket upgrade to an unreachable backend answers 503 instead of upgrading")
    void testWebSocketBackendDown() throws Exception {
        startProxy(LBTestSupport.config());
        loadBalancer.addBackend("b1", "127.0.0.1", deadPort(), 1);

        // Given a client asking for an upgrade
        HttpClient client = HttpClient.create().headers(h -> h
            .add("Upgrade", "websocket")
            .add("Connection", "Upgrade")
            .add("Sec-WebSocket-Key", "dGhlIHNhbXBsZSBub25jZQ==")
            .add("Sec-WebSocket-Version", "13"));

        // When the backend cannot be reached
        Reply reply = get(client, url("/ws"));

        // Then no 101 is sent and the error is counted
        assertEquals(503, reply.status());
        JsonNode body = JsonUtils.parseTree(reply.body());
        assertEquals("Service Unavailable", body.get("error").asText());
        assertEquals("Backend server b1 is unavailable", body.get("message").asText());

        Backend b1 = loadBalancer.getRegistry().get("b1").orElseThrow();
        await(() -> b1.getErrorCount() == 1 && b1.getConnections() == 0);
    }

    @Test
    @DisplayName("Backend close code reaches the client")
    void testWebSocketCloseCodeForwarded() throws Exception {
        startProxy(LBTestSupport.config());
        loadBalancer.addBackend("b1", "127.0.0.1", startBackend("b1"), 1);
        Backend b1 = loadBalancer.getRegistry().get("b1").orElseThrow();

        WebSocketCloseStatus status = HttpClient.create()
            .websocket()
            .uri("ws://127.0.0.1:" + proxy.port() + "/ws-close")
            .handle((in, out) -> in.receiveCloseStatus())
            .next()
            .block(Duration.ofSeconds(10));

        assertNotNull(status);
        assertEquals(4001, status.code());
        assertEquals("room closed", status.reasonText());

        await(() -> b1.getConnections() == 0);
        assertEquals(0, b1.getErrorCount());
    }

    @Test
    @DisplayName("WebSocket frames are bridged both ways")
    void testWebSocketBridge() throws Exception {
        startProxy(LBTestSupport.config());
        loadBalancer.addBackend("b1", "127.0.0.1", startBackend("b1"), 1);
        Backend b1 = loadBalancer.getRegistry().get("b1").orElseThrow();

        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        Disposable connection = HttpClient.create()
            .websocket()
            .uri("ws://127.0.0.1:" + proxy.port() + "/ws")
            .handle((in, out) -> Mono.when(
                out.sendString(outbound.asFlux()),
                in.receive().asString().doOnNext(received::add)
            ))
            .subscribe();
        try {
            outbound.tryEmitNext("{\"type\":\"join\",\"room\":\"r1\"}");
            assertEquals("b1:{\"type\":\"join\",\"room\":\"r1\"}", received.poll(5, TimeUnit.SECONDS));

            outbound.tryEmitNext("second");
            assertEquals("b1:second", received.poll(5, TimeUnit.SECONDS));
            assertEquals(1, b1.getConnections());
        } finally {
            outbound.tryEmitComplete();
            connection.dispose();
        }

        await(() -> b1.getConnections() == 0);
        assertEquals(1, b1.getTotalConnections());
    }
}
