package com.signalrelay.loadbalancer.strategy;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.routing.RoutingContext;

import java.util.List;
import java.util.Optional;

/**
 * Picks one backend out of the routable set.
 * <p>
 * Implementations must be thread-safe: selections for concurrent requests run
 * on different event loops.
 * </p>
 */
public interface LoadBalancingStrategy {

    /**
     * Name used in configuration, stats and logs.
     */
    String getName();

    /**
     * Selects a backend.
     *
     * @param candidates healthy, non-draining backends in registration order
     * @param context    request attributes
     * @return selected backend, or empty if {@code candidates} is empty
     */
    Optional<Backend> select(List<Backend> candidates, RoutingContext context);

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
