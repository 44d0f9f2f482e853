package com.signalrelay.loadbalancer.event;

import com.signalrelay.loadbalancer.backend.BackendSnapshot;
import com.signalrelay.loadbalancer.health.HealthCycleSummary;
import lombok.Builder;
import lombok.Value;

/**
 * Backend lifecycle, health and traffic notification.
 */
@Value
@Builder
public class BackendEvent {

    public enum Type {
        ADDED,
        REMOVED,
        UPDATED,
        DRAINING,
        RECOVERED,
        DEGRADED,
        REQUEST_COMPLETED,
        HEALTH_CYCLE_COMPLETED
    }

    Type type;
    long timestamp;

    // Null for HEALTH_CYCLE_COMPLETED
    String backendId;
    BackendSnapshot backend;

    // REQUEST_COMPLETED only
    long elapsedMs;
    String error;

    // HEALTH_CYCLE_COMPLETED only
    HealthCycleSummary summary;

    public static BackendEvent of(Type type, BackendSnapshot backend) {
        return BackendEvent.builder()
            .type(type)
            .timestamp(System.currentTimeMillis())
            .backendId(backend.getId())
            .backend(backend)
            .build();
    }

    public static BackendEvent requestCompleted(BackendSnapshot backend, long elapsedMs, String error) {
        return BackendEvent.builder()
            .type(Type.REQUEST_COMPLETED)
            .timestamp(System.currentTimeMillis())
            .backendId(backend.getId())
            .backend(backend)
            .elapsedMs(elapsedMs)
            .error(error)
            .build();
    }

    public static BackendEvent healthCycleCompleted(HealthCycleSummary summary) {
        return BackendEvent.builder()
            .type(Type.HEALTH_CYCLE_COMPLETED)
            .timestamp(System.currentTimeMillis())
            .summary(summary)
            .build();
    }

    public boolean isFailure() {
        return error != null;
    }
}
