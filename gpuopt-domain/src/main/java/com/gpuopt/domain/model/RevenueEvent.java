package com.gpuopt.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Audit row written alongside customer mutations.
 */
public record RevenueEvent(
        String eventType,
        String customerEmail,
        BigDecimal amount,
        Map<String, String> metadata,
        Instant createdAt
) {
    public static final String SIGNUP = "signup";
    public static final String UPGRADE = "upgrade";

    public RevenueEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
