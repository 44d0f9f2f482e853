package com.signalrelay.socket.liveness;

import com.signalrelay.socket.metrics.MetricsService;
import com.signalrelay.socket.session.ConnectionRegistry;
import com.signalrelay.socket.session.SignalingConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Ping/pong sweep over all live connections.
 * <p>
 * Each tick terminates connections that have not answered the previous tick's
 * ping, then clears the flag on the survivors and pings them. A pong sets the
 * flag again. A dead peer is therefore detected within two intervals.
 * </p>
 */
public class LivenessTracker {
    private static final Logger log = LoggerFactory.getLogger(LivenessTracker.class);

    private final ConnectionRegistry connections;
    private final MetricsService metricsService;
    private final Duration interval;
    private final Scheduler scheduler;

    private Disposable sweepTask;

    public LivenessTracker(ConnectionRegistry connections, MetricsService metricsService, Duration interval) {
        this(connections, metricsService, interval, Schedulers.parallel());
    }

    public LivenessTracker(ConnectionRegistry connections, MetricsService metricsService,
                           Duration interval, Scheduler scheduler) {
        this.connections = connections;
        this.metricsService = metricsService;
        this.interval = interval;
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (sweepTask != null && !sweepTask.isDisposed()) {
            return;
        }
        sweepTask = Flux.interval(interval, interval, scheduler)
            .onBackpressureDrop(tick -> log.warn("Liveness sweep {} skipped, previous sweep still running", tick))
            .subscribe(tick -> sweep(), err -> log.error("Liveness sweep stopped", err));
        log.info("Liveness sweep started (interval: {})", interval);
    }

    /**
     * Runs one sweep.
     *
     * @return outcome counts
     */
    public SweepResult sweep() {
        int terminated = 0;
        int pinged = 0;
        for (SignalingConnection connection : connections.snapshot()) {
            if (!connection.isOpen()) {
                continue;
            }
            if (!connection.resetAlive()) {
                log.info("Terminating unresponsive connection {} from {}",
                    connection.getId(), connection.getRemoteAddress());
                connection.terminate();
                metricsService.recordLivenessTermination();
                terminated++;
                continue;
            }
            if (connection.ping()) {
                pinged++;
            }
        }
        if (terminated > 0) {
            log.info("Liveness sweep: {} pinged, {} terminated", pinged, terminated);
        } else {
            log.debug("Liveness sweep: {} pinged", pinged);
        }
        return new SweepResult(pinged, terminated);
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.dispose();
            sweepTask = null;
        }
        log.info("Liveness sweep stopped");
    }

    public record SweepResult(int pinged, int terminated) {
    }
}
