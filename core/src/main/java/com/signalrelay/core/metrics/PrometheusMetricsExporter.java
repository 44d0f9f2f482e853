package com.signalrelay.core.metrics;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerResponse;

/**
 * Serves this process's meters on {@code GET /metrics}.
 * <p>
 * Reactor Netty records its server and client meters into the global composite,
 * so the Prometheus registry hangs off that composite and application meters are
 * registered there too. Every meter is tagged with the node id and the component
 * (socket or load balancer) it belongs to.
 * </p>
 */
public class PrometheusMetricsExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final CompositeMeterRegistry composite;
    private final PrometheusMeterRegistry prometheusRegistry;

    @Getter
    private final MeterRegistry registry;

    public PrometheusMetricsExporter(String nodeId, String component) {
        this.composite = Metrics.globalRegistry;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        composite.add(prometheusRegistry);
        composite.config().commonTags(MetricsTags.NODE_ID, nodeId, MetricsTags.COMPONENT, component);
        this.registry = composite;
        log.info("Prometheus metrics enabled for {} {}", component, nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    /**
     * Writes the current scrape as the response body.
     */
    public Mono<Void> serve(HttpServerResponse response) {
        return response.header("Content-Type", CONTENT_TYPE)
            .sendString(Mono.fromSupplier(this::scrape))
            .then();
    }

    /**
     * Detaches from the global composite; meters stop being exported.
     */
    @Override
    public void close() {
        composite.remove(prometheusRegistry);
        prometheusRegistry.close();
    }
}
