package com.signalrelay.loadbalancer.backend;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One signaling instance behind the load balancer.
 * <p>
 * Connection counters are lock-free. Transitions that read and write several
 * fields together (error counting, health flips, response time averaging,
 * reconfiguration) hold the backend's monitor, so a probe result and a request
 * completion landing at the same time cannot lose an update.
 * </p>
 */
public class Backend {

    private final String id;
    private volatile String host;
    private volatile int port;
    private volatile int weight;

    private volatile boolean healthy = true;
    private volatile boolean draining;

    private final AtomicInteger connections = new AtomicInteger();
    private final AtomicLong totalConnections = new AtomicLong();
    private volatile int errorCount;
    private volatile BackendError lastError;
    private volatile double responseTimeEma;
    private volatile long lastHealthCheck;

    public Backend(String id, String host, int port, int weight) {
        this.id = id;
        this.host = host;
        this.port = port;
        this.weight = weight;
    }

    public String getId() {
        return id;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public boolean isDraining() {
        return draining;
    }

    /**
     * Eligible for new routing decisions.
     */
    public boolean isRoutable() {
        return healthy && !draining;
    }

    public int getConnections() {
        return connections.get();
    }

    public long getTotalConnections() {
        return totalConnections.get();
    }

    public int getErrorCount() {
        return errorCount;
    }

    public BackendError getLastError() {
        return lastError;
    }

    public double getResponseTimeEma() {
        return responseTimeEma;
    }

    public long getLastHealthCheck() {
        return lastHealthCheck;
    }

    public void onRequestStart() {
        connections.incrementAndGet();
        totalConnections.incrementAndGet();
    }

    /**
     * Records the end of a proxied exchange.
     *
     * @param elapsedMs      exchange duration
     * @param error          failure message, or null on success
     * @param errorThreshold errorCount above which the backend is marked unhealthy
     * @return true if this call flipped the backend to unhealthy
     */
    public synchronized boolean onRequestComplete(long elapsedMs, String error, int errorThreshold) {
        connections.updateAndGet(current -> Math.max(0, current - 1));
        updateResponseTime(elapsedMs);
        if (error == null) {
            return false;
        }
        errorCount++;
        lastError = new BackendError(System.currentTimeMillis(), error);
        if (errorCount > errorThreshold && healthy) {
            healthy = false;
            return true;
        }
        return false;
    }

    /**
     * Applies a successful probe. The error count decays by one; the backend is
     * healthy again once it is no longer above the threshold.
     *
     * @return true if this call flipped the backend to healthy
     */
    public synchronized boolean recordProbeSuccess(long elapsedMs, int errorThreshold) {
        boolean wasHealthy = healthy;
        errorCount = Math.max(0, errorCount - 1);
        updateResponseTime(elapsedMs);
        lastHealthCheck = System.currentTimeMillis();
        healthy = errorCount <= errorThreshold;
        return !wasHealthy && healthy;
    }

    /**
     * Applies a failed probe.
     *
     * @return true if this call flipped the backend to unhealthy
     */
    public synchronized boolean recordProbeFailure(String message) {
        boolean wasHealthy = healthy;
        healthy = false;
        errorCount++;
        long now = System.currentTimeMillis();
        lastError = new BackendError(now, message);
        lastHealthCheck = now;
        return wasHealthy;
    }

    /**
     * @return true if the backend was not already draining
     */
    public synchronized boolean markDraining() {
        boolean wasDraining = draining;
        draining = true;
        return !wasDraining;
    }

    public synchronized void apply(BackendUpdate update) {
        if (update.getHost() != null) {
            host = update.getHost();
        }
        if (update.getPort() != null) {
            port = update.getPort();
        }
        if (update.getWeight() != null) {
            weight = update.getWeight();
        }
        if (update.getDraining() != null) {
            draining = update.getDraining();
        }
    }

    // Two-sample moving average
    private void updateResponseTime(long elapsedMs) {
        responseTimeEma = (responseTimeEma + elapsedMs) / 2.0;
    }

    public synchronized BackendSnapshot snapshot() {
        return BackendSnapshot.builder()
            .id(id)
            .host(host)
            .port(port)
            .weight(weight)
            .healthy(healthy)
            .draining(draining)
            .connections(connections.get())
            .totalConnections(totalConnections.get())
            .errors(errorCount)
            .responseTime(responseTimeEma)
            .lastHealthCheck(lastHealthCheck)
            .lastError(lastError)
            .build();
    }

    @Override
    public String toString() {
        return "Backend{" + id + "@" + host + ":" + port + ", weight=" + weight
            + ", healthy=" + healthy + ", draining=" + draining + "}";
    }
}
