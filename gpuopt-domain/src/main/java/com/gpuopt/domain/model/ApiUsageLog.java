package com.gpuopt.domain.model;

import java.time.Instant;

public record ApiUsageLog(
        String customerEmail,
        String maskedApiKey,
        String endpoint,
        String method,
        String ip,
        String userAgent,
        int statusCode,
        long durationMs,
        Instant createdAt
) {
}
