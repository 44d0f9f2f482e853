package com.signalrelay.loadbalancer.health;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.event.BackendEvent;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically probes every registered backend.
 * <p>
 * All probes of a cycle run concurrently, each bounded by its own timeout, and
 * the cycle ends once every probe has settled. A tick that fires while the
 * previous cycle is still in flight is skipped.
 * </p>
 * <p>
 * 2xx marks a probe successful; any other status, a transport error or a
 * timeout is a failure. Health flips are published as {@code RECOVERED} /
 * {@code DEGRADED}, and each cycle publishes a summary.
 * </p>
 */
public class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final BackendRegistry registry;
    private final BackendProbe probe;
    private final BackendEventBus eventBus;
    private final Duration interval;
    private final Duration timeout;
    private final int errorThreshold;
    private final Scheduler scheduler;

    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private Disposable task;

    public HealthMonitor(BackendRegistry registry,
                         BackendProbe probe,
                         BackendEventBus eventBus,
                         Duration interval,
                         Duration timeout,
                         int errorThreshold) {
        this(registry, probe, eventBus, interval, timeout, errorThreshold, Schedulers.parallel());
    }

    public HealthMonitor(BackendRegistry registry,
                         BackendProbe probe,
                         BackendEventBus eventBus,
                         Duration interval,
                         Duration timeout,
                         int errorThreshold,
                         Scheduler scheduler) {
        this.registry = registry;
        this.probe = probe;
        this.eventBus = eventBus;
        this.interval = interval;
        this.timeout = timeout;
        this.errorThreshold = errorThreshold;
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (task != null && !task.isDisposed()) {
            return;
        }
        task = Flux.interval(interval, interval, scheduler)
            .onBackpressureDrop()
            .flatMap(tick -> triggerCycle())
            .subscribe(
                summary -> { },
                err -> log.error("Health checks stopped unexpectedly", err)
            );
        log.info("Health checks started (interval: {}, timeout: {})", interval, timeout);
    }

    public synchronized void stop() {
        if (task != null) {
            task.dispose();
            task = null;
            log.info("Health checks stopped");
        }
    }

    /**
     * Runs a cycle unless one is already in flight.
     *
     * @return the cycle summary, or empty if skipped
     */
    public Mono<HealthCycleSummary> triggerCycle() {
        return Mono.defer(() -> {
            if (!cycleInFlight.compareAndSet(false, true)) {
                log.warn("Previous health check cycle still running, skipping");
                return Mono.empty();
            }
            return runCycle().doFinally(signal -> cycleInFlight.set(false));
        });
    }

    public boolean isCycleInFlight() {
        return cycleInFlight.get();
    }

    private Mono<HealthCycleSummary> runCycle() {
        long startedAt = scheduler.now(TimeUnit.MILLISECONDS);
        List<Backend> backends = registry.all();
        log.debug("Starting health check cycle: {} backends", backends.size());

        return Flux.fromIterable(backends)
            .flatMap(this::check)
            .then(Mono.fromCallable(() -> {
                HealthCycleSummary summary = new HealthCycleSummary(
                    registry.healthyCount(),
                    registry.size(),
                    scheduler.now(TimeUnit.MILLISECONDS) - startedAt
                );
                log.info("Health check complete: {}/{} servers healthy", summary.healthy(), summary.total());
                eventBus.publish(BackendEvent.healthCycleCompleted(summary));
                return summary;
            }));
    }

    /**
     * Probes one backend; never errors.
     */
    private Mono<Boolean> check(Backend backend) {
        long startedAt = scheduler.now(TimeUnit.MILLISECONDS);
        return Mono.defer(() -> probe.probe(backend))
            .timeout(timeout, scheduler)
            .map(status -> {
                if (status >= 200 && status < 300) {
                    onSuccess(backend, scheduler.now(TimeUnit.MILLISECONDS) - startedAt);
                    return true;
                }
                onFailure(backend, "Health check failed with status: " + status);
                return false;
            })
            .switchIfEmpty(Mono.fromSupplier(() -> {
                onFailure(backend, "Health check returned no response");
                return false;
            }))
            .onErrorResume(err -> {
                onFailure(backend, describe(err));
                return Mono.just(false);
            });
    }

    private void onSuccess(Backend backend, long elapsedMs) {
        if (backend.recordProbeSuccess(elapsedMs, errorThreshold)) {
            log.info("Server {} is back online", backend.getId());
            eventBus.publish(BackendEvent.of(BackendEvent.Type.RECOVERED, backend.snapshot()));
        } else {
            log.debug("Health check passed: {} ({} ms)", backend.getId(), elapsedMs);
        }
    }

    private void onFailure(Backend backend, String reason) {
        if (backend.recordProbeFailure(reason)) {
            log.warn("Server {} health check failed: {}", backend.getId(), reason);
            eventBus.publish(BackendEvent.of(BackendEvent.Type.DEGRADED, backend.snapshot()));
        } else {
            log.debug("Server {} still unhealthy: {}", backend.getId(), reason);
        }
    }

    private String describe(Throwable err) {
        if (err instanceof TimeoutException) {
            return "Health check timed out after " + timeout.toMillis() + " ms";
        }
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }
}
