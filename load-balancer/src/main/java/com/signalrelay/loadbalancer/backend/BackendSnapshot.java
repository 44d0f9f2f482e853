package com.signalrelay.loadbalancer.backend;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of a backend, as reported by stats and the admin API.
 */
@Value
@Builder
public class BackendSnapshot {
    String id;
    String host;
    int port;
    int weight;
    boolean healthy;
    boolean draining;
    int connections;
    long totalConnections;
    int errors;
    double responseTime;
    long lastHealthCheck;
    BackendError lastError;
}
