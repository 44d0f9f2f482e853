package com.signalrelay.loadbalancer.config;

import com.signalrelay.loadbalancer.strategy.Algorithm;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the load balancer, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class LBConfig {

    String nodeId;
    String host;
    int httpPort;          // proxied client traffic
    int adminPort;         // admin API and metrics
    String lbName;         // value of the X-Load-Balancer header

    Algorithm algorithm;
    boolean stickySessions;
    String stickyCookie;

    // Health checking
    Duration healthCheckInterval;
    Duration healthCheckTimeout;
    String healthCheckPath;
    int errorThreshold;    // errorCount above this marks a backend unhealthy

    // Proxying
    Duration proxyTimeout;
    int maxFramePayload;

    @Singular
    List<BackendSpec> backends;

    public static LBConfig fromEnv() {
        return LBConfig.builder()
            .nodeId(getEnv("NODE_ID", "lb-node-1"))
            .host(getEnv("HOST", "0.0.0.0"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .adminPort(Integer.parseInt(getEnv("ADMIN_PORT", "8090")))
            .lbName(getEnv("LB_NAME", "signal-relay-lb"))
            .algorithm(Algorithm.fromName(getEnv("LB_ALGORITHM", "round-robin")))
            .stickySessions(Boolean.parseBoolean(getEnv("STICKY_SESSIONS", "false")))
            .stickyCookie(getEnv("STICKY_COOKIE", "sessionId"))
            .healthCheckInterval(Duration.ofSeconds(Integer.parseInt(getEnv("HEALTH_CHECK_INTERVAL_SEC", "30"))))
            .healthCheckTimeout(Duration.ofMillis(Integer.parseInt(getEnv("HEALTH_CHECK_TIMEOUT_MS", "5000"))))
            .healthCheckPath(getEnv("HEALTH_CHECK_PATH", "/health"))
            .errorThreshold(Integer.parseInt(getEnv("ERROR_THRESHOLD", "10")))
            .proxyTimeout(Duration.ofMillis(Integer.parseInt(getEnv("PROXY_TIMEOUT_MS", "30000"))))
            .maxFramePayload(Integer.parseInt(getEnv("MAX_FRAME_PAYLOAD", "1048576")))
            .backends(BackendSpec.parseList(getEnv("BACKENDS", "")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
