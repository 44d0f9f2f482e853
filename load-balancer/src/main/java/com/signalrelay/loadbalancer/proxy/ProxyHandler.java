package com.signalrelay.loadbalancer.proxy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalrelay.core.util.JsonUtils;
import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.config.LBConfig;
import com.signalrelay.loadbalancer.exception.BackendTransportException;
import com.signalrelay.loadbalancer.exception.NoHealthyBackendException;
import com.signalrelay.loadbalancer.routing.ILoadBalancer;
import com.signalrelay.loadbalancer.routing.RoutingContext;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forwards one client exchange to the backend chosen by the load balancer.
 * <p>
 * Plain HTTP request bodies are read in full and forwarded; responses are
 * streamed back. WebSocket upgrades are bridged frame by frame, pings and
 * pongs included, so the backend's liveness sweep talks to the real client.
 * Close codes are passed through in both directions.
 * </p>
 * <p>
 * Every routed exchange is counted once on start and completed exactly once,
 * on whichever terminal signal arrives first. A transport failure is never
 * retried against another backend; if nothing was sent to the client yet it
 * gets a 503.
 * </p>
 */
public class ProxyHandler {
    private static final Logger log = LoggerFactory.getLogger(ProxyHandler.class);

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_LOAD_BALANCER = "X-Load-Balancer";

    // Not forwarded: connection-scoped, or rewritten by the client/handshake
    private static final Set<String> HOP_BY_HOP = Set.of(
        "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
        "te", "trailer", "transfer-encoding", "upgrade", "host",
        "sec-websocket-key", "sec-websocket-version", "sec-websocket-extensions",
        "sec-websocket-accept", "sec-websocket-protocol"
    );

    private static final byte[] EMPTY_BODY = new byte[0];

    private final LBConfig config;
    private final ILoadBalancer loadBalancer;
    private final HttpClient httpClient;

    public ProxyHandler(LBConfig config, ILoadBalancer loadBalancer) {
        this(config, loadBalancer, HttpClient.create());
    }

    public ProxyHandler(LBConfig config, ILoadBalancer loadBalancer, HttpClient httpClient) {
        this.config = config;
        this.loadBalancer = loadBalancer;
        this.httpClient = httpClient;
    }

    public Mono<Void> handle(HttpServerRequest request, HttpServerResponse response) {
        RoutingContext context = RoutingContext.from(request, config.getStickyCookie());

        Backend backend;
        try {
            backend = loadBalancer.route(context);
        } catch (NoHealthyBackendException e) {
            log.error("Load balancer error: {}", e.getMessage());
            return serviceUnavailable(response, "All backend servers are currently unavailable");
        }

        if (isWebSocketUpgrade(request)) {
            return proxyWebSocket(request, response, backend);
        }
        return proxyHttp(request, response, backend);
    }

    private Mono<Void> proxyHttp(HttpServerRequest request, HttpServerResponse response, Backend backend) {
        // The body is read in full before dialing, so no inbound buffer outlives a failed connect
        return request.receive().aggregate().asByteArray()
            .defaultIfEmpty(EMPTY_BODY)
            .flatMap(body -> forwardHttp(request, response, backend, body));
    }

    private Mono<Void> forwardHttp(HttpServerRequest request, HttpServerResponse response, Backend backend, byte[] body) {
        RequestAccounting accounting = start(backend);

        return httpClient
            .headers(headers -> copyRequestHeaders(request, headers))
            .responseTimeout(config.getProxyTimeout())
            .request(request.method())
            .uri(backendUri("http", backend, request.uri()))
            .send((backendRequest, outbound) -> body.length == 0
                ? outbound.then()
                : outbound.sendByteArray(Mono.just(body)))
            .response((backendResponse, content) -> {
                response.status(backendResponse.status());
                copyResponseHeaders(backendResponse.responseHeaders(), response.responseHeaders());
                response.header(X_LOAD_BALANCER, config.getLbName());
                return response.send(content.retain());
            })
            .then()
            .doOnSuccess(done -> accounting.complete(null))
            .onErrorResume(err -> onProxyError(request, response, backend, accounting, err))
            .doFinally(signal -> accounting.complete(null));
    }

    /**
     * The backend is dialed before the client is upgraded, so a dead backend
     * still gets the client a 503 instead of a 101 followed by a close.
     */
    private Mono<Void> proxyWebSocket(HttpServerRequest request, HttpServerResponse response, Backend backend) {
        RequestAccounting accounting = start(backend);
        String subprotocols = request.requestHeaders().get(HttpHeaderNames.SEC_WEBSOCKET_PROTOCOL);

        WebsocketServerSpec.Builder serverSpec = WebsocketServerSpec.builder()
            .handlePing(true)
            .maxFramePayloadLength(config.getMaxFramePayload());
        WebsocketClientSpec.Builder clientSpec = WebsocketClientSpec.builder()
            .handlePing(true)
            .maxFramePayloadLength(config.getMaxFramePayload());
        if (subprotocols != null) {
            serverSpec.protocols(subprotocols);
            clientSpec.protocols(subprotocols);
        }

        Sinks.Empty<Void> released = Sinks.empty();

        return dialBackend(request, backend, clientSpec.build(), released)
            .timeout(config.getProxyTimeout())
            .flatMap(socket -> {
                response.header(X_LOAD_BALANCER, config.getLbName());
                return response.sendWebsocket(
                    (clientIn, clientOut) -> Mono.firstWithSignal(
                            relay(clientIn, socket.outbound()),
                            relay(socket.inbound(), clientOut))
                        .doFinally(signal -> released.tryEmitEmpty()),
                    serverSpec.build());
            })
            .onErrorResume(err -> onProxyError(request, response, backend, accounting, err))
            .doFinally(signal -> {
                released.tryEmitEmpty();
                accounting.complete(null);
            });
    }

    /**
     * Opens the backend socket and emits it once the handshake succeeded. The
     * backend connection stays open until {@code released} completes.
     */
    private Mono<BackendSocket> dialBackend(
        HttpServerRequest request,
        Backend backend,
        WebsocketClientSpec spec,
        Sinks.Empty<Void> released
    ) {
        return Mono.create(sink -> {
            AtomicBoolean connected = new AtomicBoolean(false);
            Disposable dial = httpClient
                .headers(headers -> copyRequestHeaders(request, headers))
                .websocket(spec)
                .uri(backendUri("ws", backend, request.uri()))
                .handle((backendIn, backendOut) -> {
                    connected.set(true);
                    sink.success(new BackendSocket(backendIn, backendOut));
                    return released.asMono();
                })
                .subscribe(
                    null,
                    err -> {
                        if (!connected.get()) {
                            sink.error(err);
                        } else {
                            log.debug("Backend socket on {} ended: {}", backend.getId(), err.getMessage());
                        }
                    },
                    () -> {
                        if (!connected.get()) {
                            sink.error(new IllegalStateException("Backend closed before the upgrade completed"));
                        }
                    });
            sink.onCancel(dial);
        });
    }

    /**
     * Copies data frames from one side to the other, then hands the peer's
     * close code on. Close frames themselves are answered by each side's own
     * handshake, so only their status crosses the bridge.
     */
    private static Mono<Void> relay(WebsocketInbound in, WebsocketOutbound out) {
        return out.sendObject(in.receiveFrames()
                .filter(frame -> !(frame instanceof CloseWebSocketFrame))
                .map(WebSocketFrame::retain))
            .then()
            .then(in.receiveCloseStatus()
                .defaultIfEmpty(WebSocketCloseStatus.EMPTY)
                .flatMap(status -> forwardClose(out, status)));
    }

    private static Mono<Void> forwardClose(WebsocketOutbound out, WebSocketCloseStatus status) {
        // 1005/1006 and other reserved codes must not appear on the wire
        Mono<Void> close = WebSocketCloseStatus.isValidStatusCode(status.code())
            ? out.sendClose(status.code(), status.reasonText())
            : out.sendClose();
        return close.onErrorResume(err -> Mono.empty());
    }

    private Mono<Void> onProxyError(
        HttpServerRequest request,
        HttpServerResponse response,
        Backend backend,
        RequestAccounting accounting,
        Throwable err
    ) {
        if (err instanceof AbortedException) {
            // client went away, the backend did nothing wrong
            accounting.complete(null);
            return Mono.empty();
        }
        BackendTransportException failure = new BackendTransportException(backend.getId(), err);
        accounting.complete(failure);
        log.error("Proxy error for {} {}: {}", request.method(), request.uri(), failure.getMessage());
        if (response.hasSentHeaders()) {
            return Mono.error(failure);
        }
        return serviceUnavailable(response, "Backend server " + backend.getId() + " is unavailable");
    }

    private RequestAccounting start(Backend backend) {
        loadBalancer.onRequestStart(backend);
        return new RequestAccounting(backend);
    }

    private void copyRequestHeaders(HttpServerRequest request, HttpHeaders target) {
        for (Map.Entry<String, String> header : request.requestHeaders()) {
            if (!HOP_BY_HOP.contains(header.getKey().toLowerCase())) {
                target.add(header.getKey(), header.getValue());
            }
        }
        String clientIp = request.remoteAddress() == null
            ? "unknown"
            : request.remoteAddress().getAddress() != null
                ? request.remoteAddress().getAddress().getHostAddress()
                : request.remoteAddress().getHostString();
        String forwarded = request.requestHeaders().get(X_FORWARDED_FOR);
        target.set(X_FORWARDED_FOR, forwarded == null || forwarded.isBlank() ? clientIp : forwarded + ", " + clientIp);
        target.set(X_LOAD_BALANCER, config.getLbName());
    }

    private static void copyResponseHeaders(HttpHeaders source, HttpHeaders target) {
        for (Map.Entry<String, String> header : source) {
            String name = header.getKey().toLowerCase();
            if (!HOP_BY_HOP.contains(name)) {
                target.add(header.getKey(), header.getValue());
            }
        }
    }

    private static String backendUri(String scheme, Backend backend, String requestUri) {
        String path = requestUri == null || requestUri.isEmpty() ? "/" : requestUri;
        return scheme + "://" + backend.getHost() + ":" + backend.getPort() + (path.startsWith("/") ? path : "/" + path);
    }

    static boolean isWebSocketUpgrade(HttpServerRequest request) {
        return request.requestHeaders().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true);
    }

    static Mono<Void> serviceUnavailable(HttpServerResponse response, String message) {
        ObjectNode body = JsonUtils.mapper().createObjectNode();
        body.put("error", "Service Unavailable");
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());

        return response.status(HttpResponseStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
            .sendString(Mono.just(JsonUtils.writeValueAsString(body)))
            .then();
    }

    private record BackendSocket(WebsocketInbound inbound, WebsocketOutbound outbound) {
    }

    /**
     * Completes a routed exchange exactly once.
     */
    private final class RequestAccounting {
        private final Backend backend;
        private final long startedAt = System.nanoTime();
        private final AtomicBoolean completed = new AtomicBoolean(false);

        RequestAccounting(Backend backend) {
            this.backend = backend;
        }

        void complete(Throwable error) {
            if (completed.compareAndSet(false, true)) {
                long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
                loadBalancer.onRequestComplete(backend, elapsedMs, error);
            }
        }
    }
}
