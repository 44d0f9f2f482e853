package com.signalrelay.loadbalancer.health;

/**
 * Outcome of one health check cycle.
 *
 * @param healthy    backends healthy once every probe settled
 * @param total      backends registered
 * @param durationMs wall time of the cycle
 */
public record HealthCycleSummary(int healthy, int total, long durationMs) {

    public double healthyRatio() {
        return total == 0 ? 0.0 : (double) healthy / total;
    }
}
