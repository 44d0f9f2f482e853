package com.signalrelay.loadbalancer.routing;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.backend.BackendSnapshot;
import com.signalrelay.loadbalancer.backend.BackendUpdate;
import com.signalrelay.loadbalancer.config.LBConfig;
import com.signalrelay.loadbalancer.event.BackendEvent;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import com.signalrelay.loadbalancer.exception.NoHealthyBackendException;
import com.signalrelay.loadbalancer.exception.UnknownBackendException;
import com.signalrelay.loadbalancer.strategy.LoadBalancingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.List;
import java.util.Optional;

/**
 * Routes requests to backends and keeps their counters.
 * <p>
 * Selection order:
 * <ol>
 *   <li>sticky binding, if enabled and it points at a healthy backend
 *       (draining backends keep their existing sessions)</li>
 *   <li>the configured strategy over healthy, non-draining backends;
 *       the result becomes the session's new binding</li>
 * </ol>
 * Health is flipped by request errors here and by probes in the health monitor;
 * degradations from either source evict the backend's sticky bindings.
 * </p>
 */
public class LoadBalancer implements ILoadBalancer {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final LBConfig config;
    private final BackendRegistry registry;
    private final LoadBalancingStrategy strategy;
    private final BackendEventBus eventBus;
    private final StickySessionTable stickyTable = new StickySessionTable();
    private final Disposable degradedSubscription;

    public LoadBalancer(LBConfig config,
                        BackendRegistry registry,
                        LoadBalancingStrategy strategy,
                        BackendEventBus eventBus) {
        this.config = config;
        this.registry = registry;
        this.strategy = strategy;
        this.eventBus = eventBus;

        this.degradedSubscription = eventBus.events()
            .filter(event -> event.getType() == BackendEvent.Type.DEGRADED)
            .subscribe(event -> {
                int evicted = stickyTable.evictBackend(event.getBackendId());
                if (evicted > 0) {
                    log.info("Evicted {} sticky sessions from unhealthy backend {}", evicted, event.getBackendId());
                }
            });
    }

    @Override
    public BackendSnapshot addBackend(String id, String host, int port, int weight) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Backend id is required");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Backend host is required");
        }
        validatePort(port);
        validateWeight(weight);

        Backend backend = registry.add(new Backend(id, host, port, weight));
        log.info("Added server: {} ({}:{}, weight {})", id, host, port, weight);

        BackendSnapshot snapshot = backend.snapshot();
        eventBus.publish(BackendEvent.of(BackendEvent.Type.ADDED, snapshot));
        return snapshot;
    }

    @Override
    public boolean removeBackend(String id) {
        Optional<Backend> removed = registry.remove(id);
        removed.ifPresent(backend -> {
            stickyTable.evictBackend(id);
            log.info("Removed server: {}", id);
            eventBus.publish(BackendEvent.of(BackendEvent.Type.REMOVED, backend.snapshot()));
        });
        return removed.isPresent();
    }

    @Override
    public Backend route(RoutingContext context) {
        String sessionId = config.isStickySessions() ? context.getSessionId() : null;

        if (sessionId != null) {
            Optional<Backend> sticky = resolveSticky(sessionId);
            if (sticky.isPresent()) {
                return sticky.get();
            }
        }

        List<Backend> candidates = registry.routable();
        if (candidates.isEmpty()) {
            throw new NoHealthyBackendException(registry.size());
        }

        Backend selected = strategy.select(candidates, context).orElse(candidates.get(0));

        if (sessionId != null) {
            stickyTable.bind(sessionId, selected.getId());
        }
        log.debug("Routed {} to {} via {}", context.getRemoteAddress(), selected.getId(), strategy.getName());
        return selected;
    }

    private Optional<Backend> resolveSticky(String sessionId) {
        Optional<String> boundId = stickyTable.lookup(sessionId);
        if (boundId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Backend> bound = registry.get(boundId.get());
        if (bound.isPresent() && bound.get().isHealthy()) {
            return bound;
        }
        stickyTable.evict(sessionId, boundId.get());
        log.debug("Sticky binding {} -> {} is stale, rerouting", sessionId, boundId.get());
        return Optional.empty();
    }

    @Override
    public void onRequestStart(Backend backend) {
        backend.onRequestStart();
    }

    @Override
    public void onRequestComplete(Backend backend, long elapsedMs, Throwable error) {
        String message = error == null ? null : describe(error);
        boolean degraded = backend.onRequestComplete(elapsedMs, message, config.getErrorThreshold());

        BackendSnapshot snapshot = backend.snapshot();
        eventBus.publish(BackendEvent.requestCompleted(snapshot, elapsedMs, message));

        if (degraded) {
            log.warn("Server {} marked as unhealthy due to errors ({} > {})",
                backend.getId(), snapshot.getErrors(), config.getErrorThreshold());
            eventBus.publish(BackendEvent.of(BackendEvent.Type.DEGRADED, snapshot));
        }
    }

    @Override
    public BackendSnapshot drain(String id) {
        Backend backend = require(id);
        if (backend.markDraining()) {
            log.info("Draining server {}", id);
            eventBus.publish(BackendEvent.of(BackendEvent.Type.DRAINING, backend.snapshot()));
        }
        return backend.snapshot();
    }

    @Override
    public BackendSnapshot updateBackend(String id, BackendUpdate update) {
        Backend backend = require(id);
        if (update.getPort() != null) {
            validatePort(update.getPort());
        }
        if (update.getWeight() != null) {
            validateWeight(update.getWeight());
        }
        if (update.getHost() != null && update.getHost().isBlank()) {
            throw new IllegalArgumentException("Backend host must not be blank");
        }

        boolean startsDraining = Boolean.TRUE.equals(update.getDraining()) && !backend.isDraining();
        backend.apply(update);
        log.info("Updated server {} configuration: {}", id, update);

        BackendSnapshot snapshot = backend.snapshot();
        eventBus.publish(BackendEvent.of(BackendEvent.Type.UPDATED, snapshot));
        if (startsDraining) {
            eventBus.publish(BackendEvent.of(BackendEvent.Type.DRAINING, snapshot));
        }
        return snapshot;
    }

    @Override
    public Optional<BackendSnapshot> getBackend(String id) {
        return registry.get(id).map(Backend::snapshot);
    }

    @Override
    public int clearStickySessions() {
        int cleared = stickyTable.clear();
        log.info("Cleared all sticky sessions ({})", cleared);
        return cleared;
    }

    @Override
    public LoadBalancerStats getStats() {
        List<BackendSnapshot> servers = registry.all().stream()
            .map(Backend::snapshot)
            .toList();

        return LoadBalancerStats.builder()
            .totalServers(servers.size())
            .healthyServers((int) servers.stream().filter(BackendSnapshot::isHealthy).count())
            .totalConnections(servers.stream().mapToLong(BackendSnapshot::getTotalConnections).sum())
            .activeConnections(servers.stream().mapToInt(BackendSnapshot::getConnections).sum())
            .totalErrors(servers.stream().mapToLong(BackendSnapshot::getErrors).sum())
            .averageResponseTime(servers.stream().mapToDouble(BackendSnapshot::getResponseTime).average().orElse(0.0))
            .algorithm(strategy.getName())
            .stickySessionsEnabled(config.isStickySessions())
            .activeSessions(stickyTable.size())
            .servers(servers)
            .build();
    }

    public BackendRegistry getRegistry() {
        return registry;
    }

    public int stickySessionCount() {
        return stickyTable.size();
    }

    public void stop() {
        degradedSubscription.dispose();
    }

    private Backend require(String id) {
        return registry.get(id).orElseThrow(() -> new UnknownBackendException(id));
    }

    private static void validatePort(int port) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
    }

    private static void validateWeight(int weight) {
        if (weight < 1) {
            throw new IllegalArgumentException("Weight must be positive: " + weight);
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
