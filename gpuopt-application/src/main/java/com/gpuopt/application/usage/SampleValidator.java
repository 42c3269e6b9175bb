package com.gpuopt.application.usage;

import com.gpuopt.domain.ValidationException;
import com.gpuopt.domain.model.GpuSample;

/**
 * Range checks and defaults for agent readings.
 */
final class SampleValidator {

    static final int MAX_GPU_INDEX = 16;
    static final int MAX_NAME_LENGTH = 100;
    static final double MAX_TEMPERATURE = 150.0;
    static final String UNKNOWN_GPU = "unknown";

    private SampleValidator() {}

    /**
     * @param position index of the reading in the batch, used as the default GPU index
     */
    static GpuSample validate(GpuReading r, int position) {
        if (r == null) {
            throw invalid(position, "reading is null");
        }

        int gpuIndex = r.gpuIndex() == null ? position : r.gpuIndex();
        if (gpuIndex < 0 || gpuIndex > MAX_GPU_INDEX) {
            throw invalid(position, "gpu_index must be between 0 and " + MAX_GPU_INDEX);
        }

        String name = r.gpuName() == null || r.gpuName().isBlank() ? UNKNOWN_GPU : r.gpuName();
        if (name.length() > MAX_NAME_LENGTH) {
            throw invalid(position, "gpu_name must be at most " + MAX_NAME_LENGTH + " characters");
        }

        double util = required(r.utilization(), "gpu_util", position);
        if (util < 0 || util > 100) {
            throw invalid(position, "gpu_util must be between 0 and 100");
        }

        double memUsed = nonNegative(required(r.memoryUsed(), "mem_used", position), "mem_used", position);
        double memTotal = nonNegative(required(r.memoryTotal(), "mem_total", position), "mem_total", position);

        double temperature = r.temperature() == null ? GpuSample.DEFAULT_TEMPERATURE : finite(r.temperature(), "temperature", position);
        if (temperature < 0 || temperature > MAX_TEMPERATURE) {
            throw invalid(position, "temperature must be between 0 and " + (int) MAX_TEMPERATURE);
        }

        double cost = r.costPerHour() == null
                ? GpuSample.DEFAULT_COST_PER_HOUR
                : nonNegative(finite(r.costPerHour(), "cost_per_hour", position), "cost_per_hour", position);

        return new GpuSample(gpuIndex, name, util, memUsed, memTotal, temperature, cost);
    }

    private static double required(Double v, String field, int position) {
        if (v == null) {
            throw invalid(position, field + " is required");
        }
        return finite(v, field, position);
    }

    private static double finite(Double v, String field, int position) {
        if (v.isNaN() || v.isInfinite()) {
            throw invalid(position, field + " must be a finite number");
        }
        return v;
    }

    private static double nonNegative(double v, String field, int position) {
        if (v < 0) {
            throw invalid(position, field + " must be >= 0");
        }
        return v;
    }

    private static ValidationException invalid(int position, String message) {
        return new ValidationException("gpu_data[" + position + "]: " + message);
    }
}
