package com.signalrelay.loadbalancer.strategy;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.routing.RoutingContext;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Picks a backend with probability proportional to its weight.
 */
public final class WeightedRandomStrategy implements LoadBalancingStrategy {

    private final Random random;

    public WeightedRandomStrategy() {
        this(new Random());
    }

    public WeightedRandomStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return Algorithm.WEIGHTED.configName();
    }

    @Override
    public Optional<Backend> select(List<Backend> candidates, RoutingContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        long totalWeight = 0;
        for (Backend backend : candidates) {
            totalWeight += backend.getWeight();
        }

        double draw = random.nextDouble() * totalWeight;
        for (Backend backend : candidates) {
            draw -= backend.getWeight();
            if (draw <= 0) {
                return Optional.of(backend);
            }
        }

        // Only reachable when weights changed under us mid-draw
        return Optional.of(candidates.get(0));
    }
}
