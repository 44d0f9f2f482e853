package com.signalrelay.loadbalancer.backend;

/**
 * Last failure observed for a backend.
 *
 * @param timestamp epoch millis
 * @param message   human-readable cause
 */
public record BackendError(long timestamp, String message) {
}
