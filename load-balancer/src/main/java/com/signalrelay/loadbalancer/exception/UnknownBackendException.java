package com.signalrelay.loadbalancer.exception;

public class UnknownBackendException extends LoadBalancerException {

    private final String backendId;

    public UnknownBackendException(String backendId) {
        super("Unknown backend: " + backendId);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
