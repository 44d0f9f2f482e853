package com.signalrelay.loadbalancer.strategy;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.routing.RoutingContext;

import java.util.List;
import java.util.Optional;

/**
 * Fewest active connections wins; ties go to the earliest registered.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return Algorithm.LEAST_CONNECTIONS.configName();
    }

    @Override
    public Optional<Backend> select(List<Backend> candidates, RoutingContext context) {
        Backend selected = null;
        int min = Integer.MAX_VALUE;
        for (Backend backend : candidates) {
            int connections = backend.getConnections();
            if (connections < min) {
                min = connections;
                selected = backend;
            }
        }
        return Optional.ofNullable(selected);
    }
}
