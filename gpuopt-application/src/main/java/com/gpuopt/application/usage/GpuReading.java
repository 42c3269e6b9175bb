package com.gpuopt.application.usage;

/**
 * Raw agent reading. Boxed fields are null when the agent omitted them.
 */
public record GpuReading(
        Integer gpuIndex,
        String gpuName,
        Double utilization,
        Double memoryUsed,
        Double memoryTotal,
        Double temperature,
        Double costPerHour
) {
}
