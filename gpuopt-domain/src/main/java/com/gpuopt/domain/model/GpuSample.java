package com.gpuopt.domain.model;

/**
 * One GPU reading as sent by a monitoring agent, after defaults have been applied.
 */
public record GpuSample(
        int gpuIndex,
        String gpuName,
        double utilization,
        double memoryUsed,
        double memoryTotal,
        double temperature,
        double costPerHour
) {
    public static final double DEFAULT_TEMPERATURE = 0.0;
    public static final double DEFAULT_COST_PER_HOUR = 3.0;
}
