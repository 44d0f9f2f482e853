package com.signalrelay.loadbalancer.backend;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Registered backends in registration order.
 * <p>
 * Reads are lock-free snapshots; strategies index into the snapshot they were
 * given, so registration order is what round-robin and tie-breaking see.
 * </p>
 */
public class BackendRegistry {

    private final Map<String, Backend> byId = new ConcurrentHashMap<>();
    private final List<Backend> ordered = new CopyOnWriteArrayList<>();

    /**
     * @throws IllegalArgumentException if the id is already registered
     */
    public synchronized Backend add(Backend backend) {
        if (byId.putIfAbsent(backend.getId(), backend) != null) {
            throw new IllegalArgumentException("Backend already registered: " + backend.getId());
        }
        ordered.add(backend);
        return backend;
    }

    public synchronized Optional<Backend> remove(String id) {
        Backend removed = byId.remove(id);
        if (removed != null) {
            ordered.remove(removed);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Backend> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<Backend> all() {
        return List.copyOf(ordered);
    }

    /**
     * Healthy, non-draining backends in registration order.
     */
    public List<Backend> routable() {
        return ordered.stream()
            .filter(Backend::isRoutable)
            .collect(Collectors.toList());
    }

    public int size() {
        return ordered.size();
    }

    public int healthyCount() {
        return (int) ordered.stream().filter(Backend::isHealthy).count();
    }
}
