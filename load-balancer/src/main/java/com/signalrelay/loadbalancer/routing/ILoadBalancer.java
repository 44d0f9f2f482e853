package com.signalrelay.loadbalancer.routing;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.backend.BackendSnapshot;
import com.signalrelay.loadbalancer.backend.BackendUpdate;

import java.util.Optional;

/**
 * Backend selection and bookkeeping, as seen by the proxy and the admin API.
 */
public interface ILoadBalancer {

    /**
     * Registers a backend, healthy with no connections.
     *
     * @throws IllegalArgumentException if the id is taken or the address/weight is invalid
     */
    BackendSnapshot addBackend(String id, String host, int port, int weight);

    /**
     * @return true if a backend was removed
     */
    boolean removeBackend(String id);

    /**
     * Picks the backend for a new request or connection.
     *
     * @throws com.signalrelay.loadbalancer.exception.NoHealthyBackendException
     *         if no backend is healthy and not draining
     */
    Backend route(RoutingContext context);

    void onRequestStart(Backend backend);

    /**
     * Must be called exactly once per {@link #onRequestStart(Backend)}.
     *
     * @param error failure of the exchange, or null
     */
    void onRequestComplete(Backend backend, long elapsedMs, Throwable error);

    /**
     * Stops new routing decisions to the backend; existing sessions keep resolving.
     *
     * @throws com.signalrelay.loadbalancer.exception.UnknownBackendException for an unknown id
     */
    BackendSnapshot drain(String id);

    /**
     * @throws com.signalrelay.loadbalancer.exception.UnknownBackendException for an unknown id
     */
    BackendSnapshot updateBackend(String id, BackendUpdate update);

    Optional<BackendSnapshot> getBackend(String id);

    /**
     * @return number of bindings removed
     */
    int clearStickySessions();

    LoadBalancerStats getStats();
}
