package com.signalrelay.loadbalancer.health;

import com.signalrelay.loadbalancer.backend.Backend;
import io.netty.handler.codec.http.HttpHeaderNames;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * {@code GET <path>} against the backend's HTTP port.
 */
public class HttpBackendProbe implements BackendProbe {

    private static final String USER_AGENT = "signal-relay-lb-health-check";

    private final HttpClient httpClient;
    private final String path;

    public HttpBackendProbe(String path) {
        this(HttpClient.create(), path);
    }

    public HttpBackendProbe(HttpClient httpClient, String path) {
        this.httpClient = httpClient.headers(h -> h.set(HttpHeaderNames.USER_AGENT, USER_AGENT));
        this.path = path.startsWith("/") ? path : "/" + path;
    }

    @Override
    public Mono<Integer> probe(Backend backend) {
        return httpClient.get()
            .uri("http://" + backend.getHost() + ":" + backend.getPort() + path)
            // drain the body so the pooled connection can be reused
            .responseSingle((response, body) -> body.asString()
                .defaultIfEmpty("")
                .thenReturn(response.status().code()));
    }
}
