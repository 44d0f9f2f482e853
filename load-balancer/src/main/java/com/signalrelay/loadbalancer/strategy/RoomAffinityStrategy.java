package com.signalrelay.loadbalancer.strategy;

import com.signalrelay.core.hash.Hashers;
import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.routing.RoutingContext;

import java.util.List;
import java.util.Optional;

/**
 * Sends every client of a room to the same backend.
 * <p>
 * Weighted rendezvous hashing over the routable set: the backend with the highest
 * score for the room id owns the room, and only rooms owned by a backend that
 * leaves the set move. Requests without a room hint go round-robin.
 * </p>
 */
public final class RoomAffinityStrategy implements LoadBalancingStrategy {

    private final LoadBalancingStrategy fallback;

    public RoomAffinityStrategy() {
        this(new RoundRobinStrategy());
    }

    public RoomAffinityStrategy(LoadBalancingStrategy fallback) {
        this.fallback = fallback;
    }

    @Override
    public String getName() {
        return Algorithm.ROOM_AFFINITY.configName();
    }

    @Override
    public Optional<Backend> select(List<Backend> candidates, RoutingContext context) {
        String room = context == null ? null : context.getRoomHint();
        if (room == null) {
            return fallback.select(candidates, context);
        }

        Backend owner = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Backend backend : candidates) {
            double score = Hashers.rendezvousScore(room, backend.getId(), backend.getWeight());
            if (owner == null || score > best) {
                best = score;
                owner = backend;
            }
        }
        return Optional.ofNullable(owner);
    }

    @Override
    public void reset() {
        fallback.reset();
    }
}
