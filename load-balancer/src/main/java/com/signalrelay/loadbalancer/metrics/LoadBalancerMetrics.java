package com.signalrelay.loadbalancer.metrics;

import com.signalrelay.core.metrics.MetricsNames;
import com.signalrelay.core.metrics.MetricsTags;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.event.BackendEvent;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import com.signalrelay.loadbalancer.routing.LoadBalancer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Duration;

/**
 * Feeds load balancer meters from the backend event bus.
 */
public class LoadBalancerMetrics {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancerMetrics.class);

    private final MeterRegistry registry;
    private final Disposable subscription;

    public LoadBalancerMetrics(MeterRegistry registry, LoadBalancer loadBalancer, BackendEventBus eventBus) {
        this.registry = registry;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        BackendRegistry backends = loadBalancer.getRegistry();
        Gauge.builder(MetricsNames.LB_BACKENDS_HEALTHY, backends, BackendRegistry::healthyCount)
            .description("Backends currently passing health checks")
            .register(registry);
        Gauge.builder(MetricsNames.LB_BACKENDS_TOTAL, backends, BackendRegistry::size)
            .description("Backends registered")
            .register(registry);
        Gauge.builder(MetricsNames.LB_STICKY_SESSIONS, loadBalancer, LoadBalancer::stickySessionCount)
            .description("Sticky session bindings held")
            .register(registry);

        this.subscription = eventBus.events()
            .subscribe(this::record, err -> log.error("Metrics event stream failed", err));
    }

    private void record(BackendEvent event) {
        switch (event.getType()) {
            case REQUEST_COMPLETED -> {
                Counter.builder(MetricsNames.LB_REQUESTS_TOTAL)
                    .tag(MetricsTags.BACKEND_ID, event.getBackendId())
                    .tag(MetricsTags.OUTCOME, event.isFailure() ? "error" : "success")
                    .description("Proxied exchanges completed")
                    .register(registry)
                    .increment();
                Timer.builder(MetricsNames.LB_REQUEST_LATENCY)
                    .tag(MetricsTags.BACKEND_ID, event.getBackendId())
                    .description("Proxied exchange duration")
                    .register(registry)
                    .record(Duration.ofMillis(event.getElapsedMs()));
            }
            case DEGRADED, RECOVERED -> Counter.builder(MetricsNames.LB_HEALTH_TRANSITIONS_TOTAL)
                .tag(MetricsTags.BACKEND_ID, event.getBackendId())
                .tag(MetricsTags.OUTCOME, event.getType() == BackendEvent.Type.DEGRADED ? "degraded" : "recovered")
                .description("Backend health transitions")
                .register(registry)
                .increment();
            default -> {
            }
        }
    }

    public double requestCount(String backendId, String outcome) {
        Counter counter = registry.find(MetricsNames.LB_REQUESTS_TOTAL)
            .tag(MetricsTags.BACKEND_ID, backendId)
            .tag(MetricsTags.OUTCOME, outcome)
            .counter();
        return counter == null ? 0.0 : counter.count();
    }

    public void stop() {
        subscription.dispose();
    }
}
