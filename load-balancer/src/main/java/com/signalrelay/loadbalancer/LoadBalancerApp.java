package com.signalrelay.loadbalancer;

import com.signalrelay.core.metrics.PrometheusMetricsExporter;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.config.BackendSpec;
import com.signalrelay.loadbalancer.config.LBConfig;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import com.signalrelay.loadbalancer.health.HealthMonitor;
import com.signalrelay.loadbalancer.health.HttpBackendProbe;
import com.signalrelay.loadbalancer.http.HttpServer;
import com.signalrelay.loadbalancer.metrics.LoadBalancerMetrics;
import com.signalrelay.loadbalancer.proxy.ProxyHandler;
import com.signalrelay.loadbalancer.proxy.ProxyServer;
import com.signalrelay.loadbalancer.routing.LoadBalancer;
import com.signalrelay.loadbalancer.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Hooks;
import reactor.netty.DisposableServer;

public class LoadBalancerApp {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancerApp.class);

    public static void main(String[] args) {
        LBConfig config = LBConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        installFailureHandlers();

        log.info("Starting Load-Balancer: {}", config.getNodeId());
        log.info("  Algorithm: {}", config.getAlgorithm().configName());
        log.info("  Sticky sessions: {}", config.isStickySessions() ? "enabled" : "disabled");

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId(), "load-balancer");
        BackendEventBus eventBus = new BackendEventBus();
        BackendRegistry registry = new BackendRegistry();
        LoadBalancer loadBalancer = new LoadBalancer(
            config,
            registry,
            StrategyFactory.create(config.getAlgorithm()),
            eventBus
        );
        LoadBalancerMetrics metrics = new LoadBalancerMetrics(metricsExporter.getRegistry(), loadBalancer, eventBus);

        for (BackendSpec spec : config.getBackends()) {
            loadBalancer.addBackend(spec.getId(), spec.getHost(), spec.getPort(), spec.getWeight());
        }
        if (config.getBackends().isEmpty()) {
            log.warn("No BACKENDS configured; add servers through the admin API");
        }

        HealthMonitor healthMonitor = new HealthMonitor(
            registry,
            new HttpBackendProbe(config.getHealthCheckPath()),
            eventBus,
            config.getHealthCheckInterval(),
            config.getHealthCheckTimeout(),
            config.getErrorThreshold()
        );

        HttpServer adminServer = new HttpServer(config, loadBalancer, metricsExporter);
        adminServer.start();

        ProxyServer proxyServer = new ProxyServer(config, new ProxyHandler(config, loadBalancer));
        DisposableServer disposableServer = proxyServer.start();

        healthMonitor.start();

        log.info("Load-Balancer is ready");

        handleShutDown(config, healthMonitor, proxyServer, adminServer, metrics, metricsExporter, loadBalancer, eventBus);

        disposableServer.onDispose().block();
    }

    /**
     * An unexpected error leaves routing state unknown, so the process exits and
     * lets the supervisor restart it.
     */
    private static void installFailureHandlers() {
        Thread.setDefaultUncaughtExceptionHandler((thread, err) -> {
            log.error("Uncaught exception in thread {}, exiting", thread.getName(), err);
            System.exit(1);
        });
        Hooks.onErrorDropped(err -> log.warn("Dropped reactive error: {}", err.toString()));
    }

    private static void handleShutDown(
        LBConfig config,
        HealthMonitor healthMonitor,
        ProxyServer proxyServer,
        HttpServer adminServer,
        LoadBalancerMetrics metrics,
        PrometheusMetricsExporter metricsExporter,
        LoadBalancer loadBalancer,
        BackendEventBus eventBus
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received");

            healthMonitor.stop();

            proxyServer.stop();
            adminServer.stop();

            metrics.stop();
            metricsExporter.close();
            loadBalancer.stop();
            eventBus.close();

            log.info("Shutdown complete");
        }));
    }
}
