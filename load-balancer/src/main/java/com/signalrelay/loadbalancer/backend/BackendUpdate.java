package com.signalrelay.loadbalancer.backend;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial backend reconfiguration. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendUpdate {
    private String host;
    private Integer port;
    private Integer weight;
    private Boolean draining;
}
