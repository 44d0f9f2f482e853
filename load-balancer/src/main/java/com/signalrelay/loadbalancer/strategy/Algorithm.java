package com.signalrelay.loadbalancer.strategy;

import java.util.Arrays;
import java.util.List;

/**
 * Selectable routing algorithms, by configuration name.
 */
public enum Algorithm {
    ROUND_ROBIN("round-robin"),
    LEAST_CONNECTIONS("least-connections"),
    WEIGHTED("weighted", "weighted-random"),
    RESPONSE_TIME("response-time"),
    ROOM_AFFINITY("room-affinity");

    private final String configName;
    private final List<String> aliases;

    Algorithm(String configName, String... aliases) {
        this.configName = configName;
        this.aliases = List.of(aliases);
    }

    public String configName() {
        return configName;
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static Algorithm fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(a -> a.configName.equals(normalized) || a.aliases.contains(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown load balancing algorithm: " + name));
    }
}
