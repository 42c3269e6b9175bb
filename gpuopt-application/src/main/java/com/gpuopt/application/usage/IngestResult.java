package com.gpuopt.application.usage;

import com.gpuopt.domain.model.SubscriptionTier;

public record IngestResult(
        int gpusMonitored,
        double potentialHourlySavings,
        double monthlyProjection,
        SubscriptionTier tier
) {
}
