package com.signalrelay.loadbalancer.strategy;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.routing.RoutingContext;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through the routable set in registration order.
 * <p>
 * The cursor wraps modulo the size of the set it is handed, so it stays in
 * range as backends come and go.
 * </p>
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicInteger cursor = new AtomicInteger(0);

    @Override
    public String getName() {
        return Algorithm.ROUND_ROBIN.configName();
    }

    @Override
    public Optional<Backend> select(List<Backend> candidates, RoutingContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        int size = candidates.size();
        int current = cursor.getAndUpdate(i -> (i + 1) % size);
        return Optional.of(candidates.get(current % size));
    }

    @Override
    public void reset() {
        cursor.set(0);
    }
}
