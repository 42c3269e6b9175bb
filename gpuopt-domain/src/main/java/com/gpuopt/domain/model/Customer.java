package com.gpuopt.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Paying (or free) account. Email and API key are both unique.
 */
public record Customer(
        long id,
        String email,
        String apiKey,
        SubscriptionTier tier,
        int gpuCount,
        double monthlySavings,
        Instant createdAt,
        Instant lastPaymentAt
) {
    public Customer {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean isPaying() {
        return tier != SubscriptionTier.FREE;
    }
}
