package com.gpuopt.infrastructure.db;

/**
 * Monitoring counters of a {@link ResourcePool}.
 */
public record PoolStats(
        int poolSize,
        int idle,
        long acquired,
        long ephemeralOpened,
        long closedOnRelease
) {
}
