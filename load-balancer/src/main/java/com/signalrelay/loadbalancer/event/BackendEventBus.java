package com.signalrelay.loadbalancer.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Broadcasts backend events to every current subscriber.
 * <p>
 * Best effort: a subscriber that cannot keep up misses events rather than
 * slowing the publisher. Publishing is serialized because probes and request
 * completions emit from different threads.
 * </p>
 */
public class BackendEventBus {
    private static final Logger log = LoggerFactory.getLogger(BackendEventBus.class);

    private final Sinks.Many<BackendEvent> sink = Sinks.many().multicast().directBestEffort();

    public synchronized void publish(BackendEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Backend event {} not delivered: {}", event.getType(), result);
        }
    }

    public Flux<BackendEvent> events() {
        return sink.asFlux();
    }

    public synchronized void close() {
        sink.tryEmitComplete();
    }
}
