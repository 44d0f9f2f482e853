package com.signalrelay.loadbalancer.strategy;

/**
 * Creates routing strategies from configuration.
 */
public final class StrategyFactory {

    private StrategyFactory() {
        // Utility class
    }

    public static LoadBalancingStrategy create(Algorithm algorithm) {
        return switch (algorithm) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case LEAST_CONNECTIONS -> new LeastConnectionsStrategy();
            case WEIGHTED -> new WeightedRandomStrategy();
            case RESPONSE_TIME -> new ResponseTimeStrategy();
            case ROOM_AFFINITY -> new RoomAffinityStrategy();
        };
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static LoadBalancingStrategy create(String name) {
        return create(Algorithm.fromName(name));
    }
}
