package com.gpuopt.domain.model;

import java.math.BigDecimal;

/**
 * Limits and list price of a tier.
 *
 * A negative value in {@code maxGpus}, {@code requestsPerHour} or {@code callsPerDay} means unbounded.
 */
public record TierLimits(
        BigDecimal monthlyPriceUsd,
        int maxGpus,
        int requestsPerHour,
        int callsPerDay
) {
    public static final int UNBOUNDED = -1;

    public boolean allowsGpuCount(int count) {
        return maxGpus < 0 || count <= maxGpus;
    }
}
