package com.signalrelay.loadbalancer.exception;

/**
 * No backend is healthy and accepting new traffic.
 */
public class NoHealthyBackendException extends LoadBalancerException {

    private final int registeredBackends;

    public NoHealthyBackendException(int registeredBackends) {
        super("No healthy backend available (" + registeredBackends + " registered)");
        this.registeredBackends = registeredBackends;
    }

    public int getRegisteredBackends() {
        return registeredBackends;
    }
}
