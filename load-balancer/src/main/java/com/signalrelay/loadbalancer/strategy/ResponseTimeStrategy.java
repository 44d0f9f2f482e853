package com.signalrelay.loadbalancer.strategy;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.routing.RoutingContext;

import java.util.List;
import java.util.Optional;

/**
 * Lowest moving-average response time wins; ties go to the earliest registered.
 */
public final class ResponseTimeStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return Algorithm.RESPONSE_TIME.configName();
    }

    @Override
    public Optional<Backend> select(List<Backend> candidates, RoutingContext context) {
        Backend selected = null;
        double fastest = Double.MAX_VALUE;
        for (Backend backend : candidates) {
            double responseTime = backend.getResponseTimeEma();
            if (selected == null || responseTime < fastest) {
                fastest = responseTime;
                selected = backend;
            }
        }
        return Optional.ofNullable(selected);
    }
}
