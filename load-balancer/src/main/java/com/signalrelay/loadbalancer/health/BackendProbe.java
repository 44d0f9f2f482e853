package com.signalrelay.loadbalancer.health;

import com.signalrelay.loadbalancer.backend.Backend;
import reactor.core.publisher.Mono;

/**
 * Executes an out-of-band liveness check against a backend.
 */
public interface BackendProbe {

    /**
     * Probes the backend.
     *
     * @return the response status code; errors on transport failure.
     *         Timeouts are applied by the caller.
     */
    Mono<Integer> probe(Backend backend);
}
