package com.signalrelay.loadbalancer.metrics;

import com.signalrelay.core.metrics.MetricsNames;
import com.signalrelay.core.metrics.MetricsTags;
import com.signalrelay.loadbalancer.LBTestSupport;
import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.config.LBConfig;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import com.signalrelay.loadbalancer.routing.LoadBalancer;
import com.signalrelay.loadbalancer.strategy.StrategyFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoadBalancerMetricsTest {

    private SimpleMeterRegistry registry;
    private LoadBalancer loadBalancer;
    private LoadBalancerMetrics metrics;

    @BeforeEach
    void setUp() {
        LBConfig config = LBTestSupport.config().toBuilder().errorThreshold(1).build();
        BackendEventBus eventBus = new BackendEventBus();
        registry = new SimpleMeterRegistry();
        loadBalancer = new LoadBalancer(
            config, new BackendRegistry(), StrategyFactory.create(config.getAlgorithm()), eventBus
        );
        metrics = new LoadBalancerMetrics(registry, loadBalancer, eventBus);
    }

    @AfterEach
    void tearDown() {
        metrics.stop();
        loadBalancer.stop();
    }

    @Test
    void testRequestOutcomes() {
        loadBalancer.addBackend("s1", "h", 1, 1);
        Backend backend = loadBalancer.getRegistry().get("s1").orElseThrow();

        loadBalancer.onRequestStart(backend);
        loadBalancer.onRequestComplete(backend, 20, null);
        loadBalancer.onRequestStart(backend);
        loadBalancer.onRequestComplete(backend, 20, new IllegalStateException("reset"));

        assertEquals(1.0, metrics.requestCount("s1", "success"));
        assertEquals(1.0, metrics.requestCount("s1", "error"));
        assertEquals(2, registry.get(MetricsNames.LB_REQUEST_LATENCY).tag(MetricsTags.BACKEND_ID, "s1").timer().count());
    }

    @Test
    void testBackendGauges() {
        loadBalancer.addBackend("s1", "h", 1, 1);
        loadBalancer.addBackend("s2", "h", 2, 1);
        Backend s2 = loadBalancer.getRegistry().get("s2").orElseThrow();

        for (int i = 0; i < 2; i++) {
            loadBalancer.onRequestStart(s2);
            loadBalancer.onRequestComplete(s2, 5, new IllegalStateException("reset"));
        }

        assertEquals(2.0, registry.get(MetricsNames.LB_BACKENDS_TOTAL).gauge().value());
        assertEquals(1.0, registry.get(MetricsNames.LB_BACKENDS_HEALTHY).gauge().value());
        assertEquals(1.0, registry.get(MetricsNames.LB_HEALTH_TRANSITIONS_TOTAL)
            .tag(MetricsTags.OUTCOME, "degraded").counter().count());
    }
}
