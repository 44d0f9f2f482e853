package com.signalrelay.loadbalancer.routing;

import com.signalrelay.loadbalancer.backend.BackendSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LoadBalancerStats {
    int totalServers;
    int healthyServers;
    long totalConnections;
    int activeConnections;
    long totalErrors;
    double averageResponseTime;
    String algorithm;
    boolean stickySessionsEnabled;
    int activeSessions;
    List<BackendSnapshot> servers;
}
