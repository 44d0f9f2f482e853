package com.signalrelay.loadbalancer.exception;

/**
 * A proxied exchange with an already selected backend failed.
 * <p>
 * Never retried against another backend.
 * </p>
 */
public class BackendTransportException extends LoadBalancerException {

    private final String backendId;

    public BackendTransportException(String backendId, Throwable cause) {
        super("Transport failure to backend " + backendId + ": " + describe(cause), cause);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
