package com.signalrelay.loadbalancer.health;

import com.signalrelay.loadbalancer.backend.Backend;
import com.signalrelay.loadbalancer.backend.BackendRegistry;
import com.signalrelay.loadbalancer.event.BackendEvent;
import com.signalrelay.loadbalancer.event.BackendEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private VirtualTimeScheduler scheduler;
    private BackendRegistry registry;
    private FakeProbe probe;
    private BackendEventBus eventBus;
    private List<BackendEvent> events;
    private Disposable eventSubscription;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        registry = new BackendRegistry();
        probe = new FakeProbe();
        eventBus = new BackendEventBus();
        events = new CopyOnWriteArrayList<>();
        eventSubscription = eventBus.events().subscribe(events::add);
        monitor = new HealthMonitor(registry, probe, eventBus, INTERVAL, TIMEOUT, 10, scheduler);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
        eventSubscription.dispose();
        scheduler.dispose();
    }

    private Backend backend(String id) {
        return registry.add(new Backend(id, "127.0.0.1", 52178, 1));
    }

    private List<BackendEvent.Type> types(BackendEvent.Type... only) {
        List<BackendEvent.Type> wanted = List.of(only);
        return events.stream().map(BackendEvent::getType).filter(wanted::contains).toList();
    }

    // ========== Probe outcomes ==========

    @Test
    @DisplayName("2xx keeps a backend healthy, anything else marks it unhealthy")
    void testStatusCodes() {
        Backend ok = backend("ok");
        Backend noContent = backend("no-content");
        Backend broken = backend("broken");
        Backend redirect = backend("redirect");
        probe.respond("ok", () -> Mono.just(200));
        probe.respond("no-content", () -> Mono.just(204));
        probe.respond("broken", () -> Mono.just(500));
        probe.respond("redirect", () -> Mono.just(302));

        StepVerifier.create(monitor.triggerCycle())
            .assertNext(summary -> {
                assertEquals(2, summary.healthy());
                assertEquals(4, summary.total());
            })
            .verifyComplete();

        assertTrue(ok.isHealthy());
        assertTrue(noContent.isHealthy());
        assertFalse(broken.isHealthy());
        assertEquals("Health check failed with status: 500", broken.getLastError().message());
        assertFalse(redirect.isHealthy());
    }

    @Test
    @DisplayName("Transport error marks the backend unhealthy")
    void testTransportError() {
        Backend backend = backend("s1");
        probe.respond("s1", () -> Mono.error(new IOException("Connection refused")));

        StepVerifier.create(monitor.triggerCycle()).expectNextCount(1).verifyComplete();

        assertFalse(backend.isHealthy());
        assertEquals("Connection refused", backend.getLastError().message());
        assertEquals(List.of(BackendEvent.Type.DEGRADED), types(BackendEvent.Type.DEGRADED));
    }

    @Test
    @DisplayName("Probe that never answers fails after the timeout")
    void testTimeout() {
        Backend backend = backend("s1");
        probe.respond("s1", Mono::never);
        AtomicReference<HealthCycleSummary> result = new AtomicReference<>();

        monitor.triggerCycle().subscribe(result::set);
        scheduler.advanceTimeBy(TIMEOUT.minusMillis(1));
        assertNull(result.get());
        assertTrue(backend.isHealthy());

        scheduler.advanceTimeBy(Duration.ofMillis(1));

        assertNotNull(result.get());
        assertEquals(0, result.get().healthy());
        assertEquals(TIMEOUT.toMillis(), result.get().durationMs());
        assertFalse(backend.isHealthy());
        assertEquals("Health check timed out after 5000 ms", backend.getLastError().message());
    }

    @Test
    @DisplayName("Slow probe does not delay the others")
    void testProbesRunConcurrently() {
        Backend slow = backend("slow");
        Backend fast = backend("fast");
        probe.respond("slow", () -> Mono.delay(Duration.ofSeconds(4), scheduler).thenReturn(200));
        probe.respond("fast", () -> Mono.just(200));
        AtomicReference<HealthCycleSummary> result = new AtomicReference<>();

        monitor.triggerCycle().subscribe(result::set);

        assertTrue(fast.getLastHealthCheck() > 0);
        assertEquals(0, slow.getLastHealthCheck());
        assertNull(result.get());

        scheduler.advanceTimeBy(Duration.ofSeconds(4));

        assertTrue(slow.getLastHealthCheck() > 0);
        assertEquals(2, result.get().healthy());
        assertEquals(4000, result.get().durationMs());
    }

    // ========== Cycles ==========

    @Test
    @DisplayName("Cycle requested while one is in flight is skipped")
    void testOverlappingCycleSkipped() {
        backend("s1");
        probe.respond("s1", Mono::never);

        monitor.triggerCycle().subscribe();
        assertTrue(monitor.isCycleInFlight());

        StepVerifier.create(monitor.triggerCycle()).verifyComplete();
        assertEquals(1, probe.calls("s1"));

        scheduler.advanceTimeBy(TIMEOUT);
        assertFalse(monitor.isCycleInFlight());

        probe.respond("s1", () -> Mono.just(200));
        StepVerifier.create(monitor.triggerCycle()).expectNextCount(1).verifyComplete();
        assertEquals(2, probe.calls("s1"));
    }

    @Test
    @DisplayName("Scheduled cycles run once per interval")
    void testPeriodicCycles() {
        backend("s1");
        probe.respond("s1", () -> Mono.just(200));

        monitor.start();
        scheduler.advanceTimeBy(INTERVAL.minusSeconds(1));
        assertEquals(0, probe.calls("s1"));

        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(1, probe.calls("s1"));

        scheduler.advanceTimeBy(INTERVAL.multipliedBy(2));
        assertEquals(3, probe.calls("s1"));
        assertEquals(3, types(BackendEvent.Type.HEALTH_CYCLE_COMPLETED).size());

        monitor.stop();
        scheduler.advanceTimeBy(INTERVAL.multipliedBy(2));
        assertEquals(3, probe.calls("s1"));
    }

    @Test
    @DisplayName("Empty registry completes with an empty summary")
    void testEmptyRegistry() {
        StepVerifier.create(monitor.triggerCycle())
            .assertNext(summary -> {
                assertEquals(0, summary.total());
                assertEquals(0.0, summary.healthyRatio(), 0.0);
            })
            .verifyComplete();
    }

    // ========== Transitions ==========

    @Test
    @DisplayName("Failed backend recovers on the next successful probe")
    void testRecovery() {
        Backend backend = backend("s1");
        probe.respond("s1", () -> Mono.just(503));
        StepVerifier.create(monitor.triggerCycle()).expectNextCount(1).verifyComplete();
        StepVerifier.create(monitor.triggerCycle()).expectNextCount(1).verifyComplete();

        probe.respond("s1", () -> Mono.just(200));
        StepVerifier.create(monitor.triggerCycle()).expectNextCount(1).verifyComplete();

        assertTrue(backend.isHealthy());
        assertEquals(
            List.of(BackendEvent.Type.DEGRADED, BackendEvent.Type.RECOVERED),
            types(BackendEvent.Type.DEGRADED, BackendEvent.Type.RECOVERED)
        );
    }

    @Test
    @DisplayName("Backend degraded by request errors stays out until probes bring it under the threshold")
    void testRecoveryAfterRequestErrors() {
        Backend backend = backend("s1");
        for (int i = 0; i < 12; i++) {
            backend.onRequestComplete(1, "reset", 10);
        }
        probe.respond("s1", () -> Mono.just(200));

        StepVerifier.create(monitor.triggerCycle())
            .assertNext(summary -> assertEquals(0, summary.healthy()))
            .verifyComplete();
        assertEquals(11, backend.getErrorCount());

        StepVerifier.create(monitor.triggerCycle())
            .assertNext(summary -> assertEquals(1, summary.healthy()))
            .verifyComplete();

        assertEquals(10, backend.getErrorCount());
        assertEquals(List.of(BackendEvent.Type.RECOVERED), types(BackendEvent.Type.RECOVERED));
    }

    /**
     * Answers per backend id and counts calls.
     */
    private static final class FakeProbe implements BackendProbe {
        private final Map<String, Supplier<Mono<Integer>>> responses = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        void respond(String backendId, Supplier<Mono<Integer>> response) {
            responses.put(backendId, response);
        }

        int calls(String backendId) {
            AtomicInteger count = calls.get(backendId);
            return count == null ? 0 : count.get();
        }

        @Override
        public Mono<Integer> probe(Backend backend) {
            calls.computeIfAbsent(backend.getId(), id -> new AtomicInteger()).incrementAndGet();
            Supplier<Mono<Integer>> response = responses.get(backend.getId());
            return response == null ? Mono.just(200) : response.get();
        }
    }
}
