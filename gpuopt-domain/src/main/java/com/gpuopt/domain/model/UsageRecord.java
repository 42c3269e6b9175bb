package com.gpuopt.domain.model;

import java.time.Instant;

/**
 * Persisted usage row. Append-only.
 */
public record UsageRecord(
        String customerEmail,
        int gpuIndex,
        String gpuName,
        double utilization,
        double memoryUsed,
        double memoryTotal,
        double costPerHour,
        double potentialSavings,
        Instant recordedAt
) {
}
