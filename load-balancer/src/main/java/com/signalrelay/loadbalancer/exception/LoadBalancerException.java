package com.signalrelay.loadbalancer.exception;

/**
 * Base class for failures raised by the load balancer.
 */
public class LoadBalancerException extends RuntimeException {

    public LoadBalancerException(String message) {
        super(message);
    }

    public LoadBalancerException(String message, Throwable cause) {
        super(message, cause);
    }
}
