package com.signalrelay.loadbalancer.routing;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session token to backend id bindings.
 * <p>
 * Entries are not validated here; the load balancer checks the bound backend
 * on every lookup and evicts stale bindings.
 * </p>
 */
public class StickySessionTable {

    private final Map<String, String> bindings = new ConcurrentHashMap<>();

    public Optional<String> lookup(String sessionId) {
        return Optional.ofNullable(bindings.get(sessionId));
    }

    public void bind(String sessionId, String backendId) {
        bindings.put(sessionId, backendId);
    }

    /**
     * Removes the binding only if it still points at the given backend.
     */
    public boolean evict(String sessionId, String backendId) {
        return bindings.remove(sessionId, backendId);
    }

    /**
     * @return number of bindings removed
     */
    public int evictBackend(String backendId) {
        int before = bindings.size();
        bindings.values().removeIf(backendId::equals);
        return Math.max(0, before - bindings.size());
    }

    /**
     * @return number of bindings removed
     */
    public int clear() {
        int size = bindings.size();
        bindings.clear();
        return size;
    }

    public int size() {
        return bindings.size();
    }
}
