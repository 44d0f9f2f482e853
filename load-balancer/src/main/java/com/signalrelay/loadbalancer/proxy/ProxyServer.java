package com.signalrelay.loadbalancer.proxy;

import com.signalrelay.loadbalancer.config.LBConfig;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.time.Duration;

/**
 * Client-facing listener; every request is handed to the proxy.
 */
public class ProxyServer {
    private static final Logger log = LoggerFactory.getLogger(ProxyServer.class);

    private final LBConfig config;
    private final ProxyHandler proxyHandler;
    private DisposableServer server;

    public ProxyServer(LBConfig config, ProxyHandler proxyHandler) {
        this.config = config;
        this.proxyHandler = proxyHandler;
    }

    public DisposableServer start() {
        server = HttpServer.create()
            .host(config.getHost())
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            // proxied paths are client-defined, keep the uri tag bounded
            .metrics(true, uri -> "proxy")
            .handle(proxyHandler::handle)
            .bind()
            .doOnNext(bound -> log.info("Load balancer started on {}:{}", config.getHost(), bound.port()))
            .doOnError(err -> log.error("Failed to start load balancer listener", err))
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
}
