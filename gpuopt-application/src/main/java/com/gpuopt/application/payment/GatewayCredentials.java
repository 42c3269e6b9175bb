package com.gpuopt.application.payment;

import java.util.Map;

/**
 * Credential values for one gateway, keyed by the names in {@link GatewayId#requiredCredentials()}.
 */
public record GatewayCredentials(Map<String, String> values) {

    public static final GatewayCredentials EMPTY = new GatewayCredentials(Map.of());

    public GatewayCredentials {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public String get(String name) {
        String v = values.get(name);
        return v == null ? "" : v.trim();
    }

    public boolean has(String name) {
        return !get(name).isEmpty();
    }

    public boolean covers(Iterable<String> names) {
        for (String n : names) {
            if (!has(n)) return false;
        }
        return true;
    }
}
