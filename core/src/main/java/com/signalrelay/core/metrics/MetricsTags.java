package com.signalrelay.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the emitting process type (socket, load-balancer).
     */
    public static final String COMPONENT = "component";

    /**
     * Tag key for backend identifier (load balancer side).
     */
    public static final String BACKEND_ID = "backend_id";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for outcome (success/error, recovered/degraded).
     */
    public static final String OUTCOME = "outcome";

}
