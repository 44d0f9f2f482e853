package com.signalrelay.loadbalancer.config;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Static backend entry from configuration.
 * <p>
 * Format: {@code id=host:port[:weight]}, entries separated by commas.
 * </p>
 */
@Value
public class BackendSpec {
    String id;
    String host;
    int port;
    int weight;

    public static List<BackendSpec> parseList(String value) {
        List<BackendSpec> specs = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return specs;
        }
        for (String entry : value.split(",")) {
            if (!entry.isBlank()) {
                specs.add(parse(entry.trim()));
            }
        }
        return specs;
    }

    public static BackendSpec parse(String entry) {
        int eq = entry.indexOf('=');
        if (eq <= 0 || eq == entry.length() - 1) {
            throw new IllegalArgumentException("Backend entry must be id=host:port[:weight], got '" + entry + "'");
        }
        String id = entry.substring(0, eq).trim();
        String[] address = entry.substring(eq + 1).trim().split(":");
        if (address.length < 2 || address.length > 3 || address[0].isBlank()) {
            throw new IllegalArgumentException("Backend entry must be id=host:port[:weight], got '" + entry + "'");
        }
        try {
            int port = Integer.parseInt(address[1].trim());
            int weight = address.length == 3 ? Integer.parseInt(address[2].trim()) : 1;
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Invalid port in backend entry '" + entry + "'");
            }
            if (weight < 1) {
                throw new IllegalArgumentException("Weight must be positive in backend entry '" + entry + "'");
            }
            return new BackendSpec(id, address[0].trim(), port, weight);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non-numeric port or weight in backend entry '" + entry + "'", e);
        }
    }
}
